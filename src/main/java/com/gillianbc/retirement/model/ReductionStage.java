package com.gillianbc.retirement.model;

/**
 * How far spending was cut in a year to keep the portfolio above its reserve floor.
 */
public enum ReductionStage {
    NONE,
    DISCRETIONARY_REDUCED,
    ESSENTIALS_ONLY,
    ESSENTIALS_REDUCED
}
