package com.gillianbc.retirement.model;

/**
 * How the protected reserve of a depletion target is sized.
 */
public enum ReserveType {
    /** The unspent share of the portfolio: 100% minus the target percentage spent. */
    DERIVED,
    /** A custom percentage of the current portfolio. */
    PERCENTAGE,
    /** A fixed dollar floor. */
    ABSOLUTE
}
