package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * One retirement spending phase, e.g. "Go-Go", "Slow-Go", "No-Go".
 * <p>
 * Multipliers scale the base essential / discretionary budget. An absolute override, when present,
 * replaces the scaled amount (today's dollars).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SpendingPhase {
    @NonNull String id;
    @NonNull String name;
    int startAge;
    @NonNull @Builder.Default BigDecimal essentialMultiplier = BigDecimal.ONE;
    @NonNull @Builder.Default BigDecimal discretionaryMultiplier = BigDecimal.ONE;
    BigDecimal absoluteEssential;
    BigDecimal absoluteDiscretionary;
}
