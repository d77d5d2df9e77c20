package com.gillianbc.retirement.model;

public enum WarningSeverity {
    INFO,
    WARNING
}
