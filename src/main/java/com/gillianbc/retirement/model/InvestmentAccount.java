package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class InvestmentAccount {
    @NonNull String name;
    /** Null is treated as {@link AccountType#OTHER}. */
    AccountType type;
    @NonNull BigDecimal balance;
    BigDecimal monthlyContribution;
}
