package com.gillianbc.retirement.model;

public enum TrajectoryStatus {
    ON_TRACK,
    UNDERSPENDING,
    OVERSPENDING
}
