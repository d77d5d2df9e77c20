package com.gillianbc.retirement.model;

public enum IncomeFloorStatus {
    /** Guaranteed income meets or exceeds essential expenses. */
    FULLY_COVERED,
    PARTIAL,
    INSUFFICIENT
}
