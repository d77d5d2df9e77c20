package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

/**
 * A household's persisted financial profile, the raw material for a {@link ProjectionInput}.
 */
@Value
@Builder
@Jacksonized
public class FinancialSnapshot {
    int birthYear;
    int targetRetirementAge;
    @NonNull RiskTolerance riskTolerance;
    @NonNull BigDecimal annualIncome;
    /** Percentage of income saved, 0..100. */
    @NonNull BigDecimal savingsRate;
    @NonNull @Singular List<InvestmentAccount> investmentAccounts;
    /** Null when the household has not broken spending down; expenses are then derived from income. */
    BigDecimal monthlyEssentialSpending;
    BigDecimal monthlyDiscretionarySpending;
    @NonNull @Singular List<DebtItem> debts;
    @NonNull @Singular List<IncomeStream> incomeStreams;
    SpendingPhaseConfig spendingPhaseConfig;
    DepletionTarget depletionTarget;
}
