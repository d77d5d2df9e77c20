package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Sustainable spending for a depletion target and how current plans compare with it.
 * <p>
 * When the target cannot be evaluated (e.g. target age not after retirement) {@code evaluated} is false,
 * amounts are zero and {@code statusMessage} says why.
 */
@Value
@Builder
public class DepletionFeedback {
    boolean evaluated;
    @NonNull BigDecimal reserveAmount;
    @NonNull BigDecimal sustainableAnnualSpending;
    @NonNull BigDecimal sustainableMonthlySpending;
    @NonNull BigDecimal plannedAnnualSpending;
    @NonNull TrajectoryStatus trajectoryStatus;
    @NonNull String statusMessage;
    @NonNull @Singular List<String> warningMessages;
    /** Empty unless spending phases are active. */
    @NonNull @Singular("phase") List<PhaseSpendingBreakdown> phaseBreakdown;
    @NonNull BigDecimal projectedReserveAtTarget;
    Integer projectedDepletionAge;
}
