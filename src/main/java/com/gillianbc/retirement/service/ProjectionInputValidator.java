package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.BalanceByType;
import com.gillianbc.retirement.model.DepletionTarget;
import com.gillianbc.retirement.model.IncomeStream;
import com.gillianbc.retirement.model.Money;
import com.gillianbc.retirement.model.ProjectionInput;
import com.gillianbc.retirement.model.ReserveConfig;
import com.gillianbc.retirement.model.ReserveType;
import com.gillianbc.retirement.model.SpendingPhase;
import com.gillianbc.retirement.model.SpendingPhaseConfig;
import com.gillianbc.retirement.reference.UniformLifetimeTable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Checks every invariant of a {@link ProjectionInput} and reports all violations at once.
 */
@Component
public class ProjectionInputValidator {

    public void validate(ProjectionInput input) {
        Objects.requireNonNull(input, "input must not be null");
        List<String> violations = new ArrayList<>();

        checkAges(input, violations);
        checkAllocation(input.getContributionAllocation(), violations);

        checkNonNegative("expectedReturn", input.getExpectedReturn(), violations);
        checkNonNegative("inflationRate", input.getInflationRate(), violations);
        checkNonNegative("contributionGrowthRate", input.getContributionGrowthRate(), violations);
        checkNonNegative("healthcareInflationRate", input.getHealthcareInflationRate(), violations);

        BalanceByType balances = input.getBalancesByType();
        checkNonNegative("balancesByType.taxDeferred", balances.getTaxDeferred(), violations);
        checkNonNegative("balancesByType.taxFree", balances.getTaxFree(), violations);
        checkNonNegative("balancesByType.taxable", balances.getTaxable(), violations);
        checkNonNegative("annualContribution", input.getAnnualContribution(), violations);
        checkNonNegative("annualEssentialExpenses", input.getAnnualEssentialExpenses(), violations);
        checkNonNegative("annualDiscretionaryExpenses", input.getAnnualDiscretionaryExpenses(), violations);
        checkNonNegative("annualHealthcareCosts", input.getAnnualHealthcareCosts(), violations);
        checkNonNegative("annualDebtPayments", input.getAnnualDebtPayments(), violations);
        if (input.getReserveFloor() != null) {
            checkNonNegative("reserveFloor", input.getReserveFloor(), violations);
        }
        // The divisor table has no entries below its first age, so an earlier trigger would never fire
        if (input.getRmdConfig().isEnabled() && input.getRmdConfig().getStartAge() < UniformLifetimeTable.FIRST_AGE) {
            violations.add("rmdConfig.startAge must be >= " + UniformLifetimeTable.FIRST_AGE);
        }

        checkIncomeStreams(input.getIncomeStreams(), violations);
        if (input.getSpendingPhaseConfig() != null) {
            checkPhases(input.getSpendingPhaseConfig(), violations);
        }
        if (input.hasEnabledDepletionTarget()) {
            checkDepletionTarget(input.getDepletionTarget(), violations);
        }

        if (!violations.isEmpty()) {
            throw new ProjectionValidationException(violations);
        }
    }

    private void checkAges(ProjectionInput input, List<String> violations) {
        if (input.getCurrentAge() < 0) {
            violations.add("currentAge must be >= 0");
        }
        if (input.getRetirementAge() < input.getCurrentAge()) {
            violations.add("retirementAge must be >= currentAge");
        }
        if (input.getMaxAge() < input.getRetirementAge()) {
            violations.add("maxAge must be >= retirementAge");
        }
    }

    private void checkAllocation(BalanceByType allocation, List<String> violations) {
        if (allocation.getTaxDeferred().signum() < 0
                || allocation.getTaxFree().signum() < 0
                || allocation.getTaxable().signum() < 0) {
            violations.add("contributionAllocation percentages must be >= 0");
        }
        if (allocation.total().compareTo(Money.HUNDRED) != 0) {
            violations.add("contributionAllocation must sum to 100 but was " + allocation.total().toPlainString());
        }
    }

    private void checkIncomeStreams(List<IncomeStream> streams, List<String> violations) {
        Set<String> ids = new HashSet<>();
        for (IncomeStream stream : streams) {
            if (!ids.add(stream.getId())) {
                violations.add("incomeStreams id " + stream.getId() + " is not unique");
            }
            if (stream.getAnnualAmount().signum() < 0) {
                violations.add("incomeStreams[" + stream.getId() + "].annualAmount must be >= 0");
            }
            if (stream.getEndAge() != null && stream.getEndAge() < stream.getStartAge()) {
                violations.add("incomeStreams[" + stream.getId() + "].endAge must be >= startAge");
            }
        }
    }

    private void checkPhases(SpendingPhaseConfig config, List<String> violations) {
        if (!config.isEnabled()) {
            return;
        }
        List<SpendingPhase> phases = config.getPhases();
        if (phases.isEmpty() || phases.size() > SpendingPhaseConfig.MAX_PHASES) {
            violations.add("spendingPhaseConfig must have between 1 and " + SpendingPhaseConfig.MAX_PHASES + " phases");
        }
        Set<Integer> startAges = new HashSet<>();
        for (SpendingPhase phase : phases) {
            if (!startAges.add(phase.getStartAge())) {
                violations.add("spendingPhaseConfig start age " + phase.getStartAge() + " is used more than once");
            }
            checkNonNegative("phase " + phase.getName() + " essentialMultiplier", phase.getEssentialMultiplier(), violations);
            checkNonNegative("phase " + phase.getName() + " discretionaryMultiplier", phase.getDiscretionaryMultiplier(), violations);
            if (phase.getAbsoluteEssential() != null) {
                checkNonNegative("phase " + phase.getName() + " absoluteEssential", phase.getAbsoluteEssential(), violations);
            }
            if (phase.getAbsoluteDiscretionary() != null) {
                checkNonNegative("phase " + phase.getName() + " absoluteDiscretionary", phase.getAbsoluteDiscretionary(), violations);
            }
        }
    }

    private void checkDepletionTarget(DepletionTarget target, List<String> violations) {
        BigDecimal pct = target.getTargetPercentageSpent();
        if (pct.signum() < 0 || pct.compareTo(Money.HUNDRED) > 0) {
            violations.add("depletionTarget.targetPercentageSpent must be between 0 and 100");
        }
        ReserveConfig reserve = target.reserveOrDerived();
        if (reserve.getType() != ReserveType.DERIVED) {
            if (reserve.getAmount() == null) {
                violations.add("depletionTarget.reserve.amount is required for " + reserve.getType() + " reserves");
            } else if (reserve.getAmount().signum() < 0) {
                violations.add("depletionTarget.reserve.amount must be >= 0");
            } else if (reserve.getType() == ReserveType.PERCENTAGE && reserve.getAmount().compareTo(Money.HUNDRED) > 0) {
                violations.add("depletionTarget.reserve.amount must be <= 100 for PERCENTAGE reserves");
            }
        }
    }

    private static void checkNonNegative(String name, BigDecimal value, List<String> violations) {
        if (value.signum() < 0) {
            violations.add(name + " must be >= 0");
        }
    }
}
