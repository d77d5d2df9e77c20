package com.gillianbc.retirement.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Length of a reserve runway. Unlimited is an explicit state, never a large number.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RunwayYears {

    private static final RunwayYears UNLIMITED = new RunwayYears(true, 0, 0);

    private final boolean unlimited;
    private final int years;
    /** Months covered when less than a full year is covered. */
    private final int months;

    private RunwayYears(boolean unlimited, int years, int months) {
        this.unlimited = unlimited;
        this.years = years;
        this.months = months;
    }

    public static RunwayYears unlimited() {
        return UNLIMITED;
    }

    public static RunwayYears ofYears(int years) {
        if (years < 0) {
            throw new IllegalArgumentException("years must be >= 0");
        }
        return new RunwayYears(false, years, 0);
    }

    public static RunwayYears ofMonths(int months) {
        if (months < 0 || months >= 12) {
            throw new IllegalArgumentException("months must be between 0 and 11");
        }
        return new RunwayYears(false, 0, months);
    }

    /**
     * @return true when this runway lasts at least the given number of years
     */
    public boolean covers(int requiredYears) {
        return unlimited || years >= requiredYears;
    }
}
