package com.gillianbc.retirement.model;

import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Essential and discretionary budget for one age, before inflation.
 */
@Value
public class PhaseAdjustedExpenses {
    @NonNull BigDecimal essential;
    @NonNull BigDecimal discretionary;
    /** Null when no phase applies. */
    String phaseName;

    public BigDecimal total() {
        return essential.add(discretionary);
    }
}
