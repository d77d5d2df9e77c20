package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class YearlyCoverage {
    int age;
    int year;
    @NonNull BigDecimal guaranteedIncome;
    @NonNull BigDecimal essentialExpenses;
    /** Three decimal places; null when there are no essential expenses that year. */
    BigDecimal coverageRatio;
    boolean fullyCovered;
    @NonNull IncomeFloorStatus status;
}
