package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Flat spending against phased spending for the same household.
 */
@Value
@Builder
public class SpendingComparison {
    @NonNull SpendingSeries flatSpending;
    @NonNull SpendingSeries phasedSpending;
    /** Extra phased spending over the first {@code earlyYearsCount} retired years. */
    @NonNull BigDecimal earlyYearsBonus;
    int earlyYearsCount;
    /** Age where cumulative phased and flat spending meet; null if they never do. */
    Integer breakEvenAge;
    /** Years the phased portfolio outlasts the flat one; negative when it runs out sooner. */
    int longevityDifference;
}
