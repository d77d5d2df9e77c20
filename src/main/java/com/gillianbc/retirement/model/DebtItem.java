package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class DebtItem {
    @NonNull String name;
    @NonNull BigDecimal balance;
    /** Annual percentage, e.g. 6.5; null means the default rate. */
    BigDecimal interestRate;
}
