package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Retirement spending under one strategy (flat or phased).
 */
@Value
@Builder
public class SpendingSeries {
    @NonNull BigDecimal totalLifetimeSpending;
    Integer depletionAge;
    @NonNull BigDecimal endingBalance;
    @NonNull @Singular("year") List<YearlySpending> yearlySpending;
}
