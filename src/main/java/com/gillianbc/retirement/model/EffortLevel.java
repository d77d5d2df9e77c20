package com.gillianbc.retirement.model;

public enum EffortLevel {
    MINIMAL,
    LOW,
    MODERATE
}
