package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Sustainable spending for one spending phase, weighted so the phases together match the
 * sustainable annual amount.
 */
@Value
@Builder
public class PhaseSpendingBreakdown {
    @NonNull String phaseName;
    int startAge;
    int endAge;
    int yearsInPhase;
    @NonNull BigDecimal annualSpending;
    @NonNull BigDecimal monthlySpending;
}
