package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Goal of spending a share of today's portfolio by a given age, keeping the rest as a reserve.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DepletionTarget {
    boolean enabled;
    /** 0..100 */
    @NonNull BigDecimal targetPercentageSpent;
    int targetAge;
    ReserveConfig reserve;

    public ReserveConfig reserveOrDerived() {
        return reserve != null ? reserve : ReserveConfig.derived();
    }
}
