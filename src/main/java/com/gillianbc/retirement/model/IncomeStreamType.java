package com.gillianbc.retirement.model;

public enum IncomeStreamType {
    SOCIAL_SECURITY(true),
    PENSION(true),
    RENTAL(false),
    ANNUITY(true),
    PART_TIME(false),
    OTHER(false);

    private final boolean guaranteedByDefault;

    IncomeStreamType(boolean guaranteedByDefault) {
        this.guaranteedByDefault = guaranteedByDefault;
    }

    /**
     * Guaranteed income does not depend on market conditions.
     */
    public boolean isGuaranteedByDefault() {
        return guaranteedByDefault;
    }
}
