package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Effect of moving one lever while every other input stays at baseline.
 */
@Value
@Builder
public class LeverImpact {
    @NonNull Lever lever;
    @NonNull BigDecimal currentValue;
    @NonNull BigDecimal testDelta;
    @NonNull LeverDirection direction;
    @NonNull BigDecimal perturbedBalance;
    /** perturbedBalance - baseline ending balance */
    @NonNull BigDecimal impactOnBalance;
    /** Signed; zero when the baseline balance is zero. */
    @NonNull BigDecimal percentImpact;
    Integer perturbedDepletion;
    /** Change in years until depletion; null when neither run depletes or the change removes depletion. */
    Integer impactOnDepletion;

    public String getDisplayName() {
        return lever.getDisplayName();
    }
}
