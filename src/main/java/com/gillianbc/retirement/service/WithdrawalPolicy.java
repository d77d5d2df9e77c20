package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.BalanceByType;
import com.gillianbc.retirement.model.WithdrawalResult;

import java.math.BigDecimal;

/**
 * Decides how a year's net cash need is drawn from the three tax categories.
 */
public interface WithdrawalPolicy {

    /**
     * @param need            cash required this year; zero or less means nothing needs funding
     * @param balances        balances available before the draw
     * @param requiredMinimum amount that must leave the tax-deferred category this year regardless of need
     * @return amounts drawn per category; any RMD beyond the need is reported as reinvested
     */
    WithdrawalResult withdraw(BigDecimal need, BalanceByType balances, BigDecimal requiredMinimum);
}
