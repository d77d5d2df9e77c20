package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * How far guaranteed (non-market) income covers essential spending through retirement.
 */
@Value
@Builder
public class IncomeFloorAnalysis {
    @NonNull BigDecimal guaranteedIncomeAtRetirement;
    @NonNull BigDecimal essentialExpensesAtRetirement;
    @NonNull BigDecimal coverageRatioAtRetirement;
    @NonNull IncomeFloorStatus status;
    boolean floorEstablished;
    /** First age at which guaranteed income covers essentials; null if it never does. */
    Integer floorEstablishedAge;
    @NonNull @Singular("coverage") List<YearlyCoverage> coverageByAge;
    @NonNull String insightStatement;
}
