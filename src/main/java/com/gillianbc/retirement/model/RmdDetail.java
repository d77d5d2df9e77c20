package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Required minimum distribution for one year: what the divisor demanded and what was withdrawn.
 */
@Value
@Builder
@Jacksonized
public class RmdDetail {
    @NonNull BigDecimal required;
    @NonNull BigDecimal taken;
    @NonNull BigDecimal distributionPeriod;
}
