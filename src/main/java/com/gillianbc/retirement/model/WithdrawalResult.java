package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of one year's draw on the portfolio.
 */
@Value
@Builder
public class WithdrawalResult {
    /** Gross amounts removed from each category, RMD included. */
    @NonNull BalanceByType withdrawals;
    @NonNull BigDecimal rmdRequired;
    @NonNull BigDecimal rmdTaken;
    /** RMD taken beyond the need; goes back in as taxable savings. */
    @NonNull BigDecimal rmdReinvested;
    /** Need the balances could not cover. */
    @NonNull BigDecimal shortfall;

    /**
     * @return money actually used to meet the need
     */
    public BigDecimal spent() {
        return withdrawals.total().subtract(rmdReinvested);
    }
}
