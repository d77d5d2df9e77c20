package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.Money;
import com.gillianbc.retirement.model.ReserveRunway;
import com.gillianbc.retirement.model.RunwayYears;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * How long a protected reserve would pay for spending that guaranteed income leaves uncovered,
 * with the gap growing by inflation every year.
 */
@Component
public class ReserveRunwayCalculator {

    public static final int MAX_YEARS = 100;

    public ReserveRunway calculateReserveRunway(BigDecimal reserveAmount,
                                                BigDecimal annualEssentialExpenses,
                                                BigDecimal annualDiscretionaryExpenses,
                                                BigDecimal guaranteedAnnualIncome,
                                                BigDecimal inflationRate) {
        Objects.requireNonNull(reserveAmount, "reserveAmount must not be null");
        Objects.requireNonNull(annualEssentialExpenses, "annualEssentialExpenses must not be null");
        Objects.requireNonNull(annualDiscretionaryExpenses, "annualDiscretionaryExpenses must not be null");
        Objects.requireNonNull(guaranteedAnnualIncome, "guaranteedAnnualIncome must not be null");
        Objects.requireNonNull(inflationRate, "inflationRate must not be null");

        BigDecimal essentialGap = Money.nonNegative(annualEssentialExpenses.subtract(guaranteedAnnualIncome));
        BigDecimal fullSpendingGap = essentialGap.add(Money.nonNegative(annualDiscretionaryExpenses));

        RunwayYears essentials = runway(reserveAmount, essentialGap, inflationRate);
        RunwayYears fullSpending = runway(reserveAmount, fullSpendingGap, inflationRate);

        return ReserveRunway.builder()
                .reserveAmount(Money.round(reserveAmount))
                .essentialGap(Money.round(essentialGap))
                .yearsOfEssentials(essentials)
                .yearsOfFullSpending(fullSpending)
                .description(describe(essentials, essentialGap))
                .build();
    }

    /**
     * Whole years the reserve pays the inflating need, capped at {@link #MAX_YEARS}; months when it
     * cannot pay a full year.
     */
    RunwayYears runway(BigDecimal reserve, BigDecimal annualNeed, BigDecimal inflationRate) {
        if (annualNeed.signum() <= 0) {
            return RunwayYears.unlimited();
        }
        BigDecimal remaining = Money.nonNegative(reserve);
        BigDecimal need = annualNeed;
        int years = 0;
        while (years < MAX_YEARS && remaining.compareTo(need) >= 0) {
            remaining = remaining.subtract(need);
            need = need.multiply(BigDecimal.ONE.add(inflationRate), Money.MATH_CONTEXT);
            years++;
        }
        if (years > 0) {
            return RunwayYears.ofYears(years);
        }
        int months = remaining.multiply(Money.TWELVE).divide(annualNeed, 0, RoundingMode.DOWN).intValue();
        return RunwayYears.ofMonths(Math.min(months, 11));
    }

    private static String describe(RunwayYears essentials, BigDecimal essentialGap) {
        if (essentialGap.signum() <= 0 || essentials.isUnlimited()) {
            return "Guaranteed income covers all essential expenses";
        }
        int years = essentials.getYears();
        if (years >= 30) {
            return "Reserve provides 30+ years of essential expense coverage";
        }
        if (years >= 10) {
            return "Reserve covers ~" + years + " years of essential expenses";
        }
        if (years >= 1) {
            return "Reserve covers " + years + (years == 1 ? " year" : " years") + " of essential expenses";
        }
        return "Reserve covers " + essentials.getMonths() + " months of essential expenses";
    }
}
