package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

/**
 * Immutable snapshot of everything one projection run needs.
 * <p>
 * Rates are fractions (0.07 = 7%). Balances and contributions are today's dollars. Essential,
 * discretionary and healthcare amounts are the retirement-age baseline that the simulator inflates
 * year by year. {@code startYear} is the calendar year of {@code currentAge} so that a run never
 * reads the clock.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ProjectionInput {

    int currentAge;
    int retirementAge;
    int maxAge;
    int startYear;

    @NonNull BalanceByType balancesByType;

    @NonNull @Builder.Default BigDecimal annualContribution = BigDecimal.ZERO;
    /** Percentages per category, summing to 100. */
    @NonNull BalanceByType contributionAllocation;

    @NonNull BigDecimal expectedReturn;
    @NonNull BigDecimal inflationRate;
    @NonNull @Builder.Default BigDecimal contributionGrowthRate = BigDecimal.ZERO;

    /** Housing, food, insurance... */
    @NonNull @Builder.Default BigDecimal annualEssentialExpenses = BigDecimal.ZERO;
    /** Travel, entertainment... */
    @NonNull @Builder.Default BigDecimal annualDiscretionaryExpenses = BigDecimal.ZERO;

    @NonNull @Builder.Default BigDecimal annualHealthcareCosts = BigDecimal.ZERO;
    @NonNull @Builder.Default BigDecimal healthcareInflationRate = BigDecimal.ZERO;

    @NonNull @Singular List<IncomeStream> incomeStreams;

    @NonNull @Builder.Default BigDecimal annualDebtPayments = BigDecimal.ZERO;
    /** First age without debt payments; null keeps them through maxAge. */
    Integer debtPayoffAge;

    SpendingPhaseConfig spendingPhaseConfig;
    DepletionTarget depletionTarget;
    /** Portfolio floor withdrawals may not breach; null for none. */
    BigDecimal reserveFloor;

    @NonNull @Builder.Default RmdConfig rmdConfig = RmdConfig.defaults();

    /**
     * Essential plus discretionary: the flat annual budget in today's dollars.
     */
    public BigDecimal totalBaseExpenses() {
        return annualEssentialExpenses.add(annualDiscretionaryExpenses);
    }

    public boolean hasActiveSpendingPhases() {
        return spendingPhaseConfig != null && spendingPhaseConfig.isActive();
    }

    public boolean hasEnabledDepletionTarget() {
        return depletionTarget != null && depletionTarget.isEnabled();
    }

    /**
     * Debt payments scheduled at the given age.
     */
    public BigDecimal debtPaymentsAt(int age) {
        if (debtPayoffAge != null && age >= debtPayoffAge) {
            return BigDecimal.ZERO;
        }
        return annualDebtPayments;
    }
}
