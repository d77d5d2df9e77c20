package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * One simulated year. Balances are end-of-year values after growth; all amounts are rounded to cents.
 */
@Value
@Builder
@Jacksonized
public class ProjectionRecord {
    int age;
    int year;
    @NonNull BigDecimal balance;
    @NonNull BalanceByType balanceByType;

    /** Contributions while working, income from streams once retired. */
    @NonNull BigDecimal inflows;
    /** Spending actually paid in a retired year: expenses, healthcare and debt. */
    @NonNull BigDecimal outflows;

    @NonNull BigDecimal contributions;
    @NonNull BigDecimal income;
    /** Portfolio money spent on the year's need, RMD reinvestment excluded. */
    @NonNull BigDecimal withdrawals;
    /** Gross amounts taken from each category, RMD included. */
    @NonNull BalanceByType withdrawalsByType;

    @NonNull BigDecimal essentialExpenses;
    @NonNull BigDecimal discretionaryExpenses;
    @NonNull BigDecimal healthcareExpenses;
    @NonNull BigDecimal debtPayments;
    String activePhaseName;

    RmdDetail rmd;

    boolean retired;
    boolean reserveConstrained;
    @NonNull @Builder.Default ReductionStage reductionStage = ReductionStage.NONE;
    @NonNull BigDecimal spendingShortfall;
    /** Balance above the reserve floor; null when no floor is set. */
    BigDecimal reserveBalance;

    /** Positive when money went into the portfolio, negative when it came out. */
    @NonNull BigDecimal netFlow;

    public BigDecimal totalSpending() {
        return essentialExpenses.add(discretionaryExpenses);
    }
}
