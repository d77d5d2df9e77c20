package com.gillianbc.retirement.model;

public enum RetirementStatus {
    ON_TRACK("On Track"),
    NEEDS_ADJUSTMENT("Needs Adjustment"),
    AT_RISK("At Risk of Shortfall");

    private final String label;

    RetirementStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
