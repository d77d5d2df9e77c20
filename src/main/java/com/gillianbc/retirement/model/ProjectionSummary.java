package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class ProjectionSummary {
    @NonNull BigDecimal startingBalance;
    /** Balance entering the retirement-age year, before its first withdrawal. */
    @NonNull BigDecimal projectedRetirementBalance;
    @NonNull BigDecimal endingBalance;
    @NonNull BigDecimal totalContributions;
    @NonNull BigDecimal totalWithdrawals;
    /** Years after retirement age at which the portfolio runs out; null if it never does. */
    Integer yearsUntilDepletion;

    BigDecimal reserveFloor;
    int yearsReserveConstrained;
    Integer firstReserveConstraintAge;
}
