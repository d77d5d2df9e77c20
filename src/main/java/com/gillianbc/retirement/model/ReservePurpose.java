package com.gillianbc.retirement.model;

public enum ReservePurpose {
    LONG_TERM_CARE("Long-term care"),
    HEALTHCARE("Healthcare"),
    LEGACY("Legacy / inheritance"),
    EMERGENCY("Emergency fund");

    private final String label;

    ReservePurpose(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
