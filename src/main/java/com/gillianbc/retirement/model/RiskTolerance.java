package com.gillianbc.retirement.model;

public enum RiskTolerance {
    CONSERVATIVE,
    MODERATE,
    AGGRESSIVE
}
