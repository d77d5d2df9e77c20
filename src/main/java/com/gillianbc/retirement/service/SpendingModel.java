package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.Money;
import com.gillianbc.retirement.model.PhaseAdjustedExpenses;
import com.gillianbc.retirement.model.ProjectionInput;
import com.gillianbc.retirement.model.SpendingPhase;
import com.gillianbc.retirement.model.SpendingPhaseConfig;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Essential and discretionary spending by age, flat or shaped by spending phases.
 * <p>
 * The phase in force is the last one (by start age) that has started. Before the first phase
 * starts the base amounts apply unchanged.
 */
@Component
public class SpendingModel {

    public Optional<SpendingPhase> activePhase(SpendingPhaseConfig config, int age) {
        if (config == null || !config.isActive()) {
            return Optional.empty();
        }
        SpendingPhase active = null;
        for (SpendingPhase phase : config.sortedPhases()) {
            if (phase.getStartAge() <= age) {
                active = phase;
            }
        }
        return Optional.ofNullable(active);
    }

    /**
     * Budget for the age in retirement-baseline dollars, before inflation.
     */
    public PhaseAdjustedExpenses expensesAt(ProjectionInput input, int age) {
        Objects.requireNonNull(input, "input must not be null");
        return expensesAt(input.getAnnualEssentialExpenses(), input.getAnnualDiscretionaryExpenses(),
                input.getSpendingPhaseConfig(), age);
    }

    public PhaseAdjustedExpenses expensesAt(BigDecimal baseEssential, BigDecimal baseDiscretionary,
                                            SpendingPhaseConfig config, int age) {
        Optional<SpendingPhase> phase = activePhase(config, age);
        if (phase.isEmpty()) {
            return new PhaseAdjustedExpenses(baseEssential, baseDiscretionary, null);
        }
        SpendingPhase p = phase.get();
        BigDecimal essential = p.getAbsoluteEssential() != null
                ? p.getAbsoluteEssential()
                : baseEssential.multiply(p.getEssentialMultiplier(), Money.MATH_CONTEXT);
        BigDecimal discretionary = p.getAbsoluteDiscretionary() != null
                ? p.getAbsoluteDiscretionary()
                : baseDiscretionary.multiply(p.getDiscretionaryMultiplier(), Money.MATH_CONTEXT);
        return new PhaseAdjustedExpenses(essential, discretionary, p.getName());
    }

    /**
     * General inflation since retirement: (1 + inflationRate)^(age - retirementAge).
     */
    public BigDecimal inflationFactor(ProjectionInput input, int age) {
        return Money.growthFactor(input.getInflationRate(), age - input.getRetirementAge());
    }

    public BigDecimal healthcareCostsAt(ProjectionInput input, int age) {
        return input.getAnnualHealthcareCosts().multiply(
                Money.growthFactor(input.getHealthcareInflationRate(), age - input.getRetirementAge()),
                Money.MATH_CONTEXT);
    }

    /**
     * Inflated essential spending for the age.
     */
    public BigDecimal essentialExpensesAt(ProjectionInput input, int age) {
        return expensesAt(input, age).getEssential().multiply(inflationFactor(input, age), Money.MATH_CONTEXT);
    }
}
