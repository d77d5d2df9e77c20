package com.gillianbc.retirement;

import com.gillianbc.retirement.model.BalanceByType;
import com.gillianbc.retirement.model.IncomeStream;
import com.gillianbc.retirement.model.IncomeStreamType;
import com.gillianbc.retirement.model.ProjectionInput;
import com.gillianbc.retirement.model.SpendingPhase;
import com.gillianbc.retirement.model.SpendingPhaseConfig;

import java.math.BigDecimal;

/**
 * Households shared by the projection tests. Growth, inflation and healthcare are zero unless a
 * test sets them, so expected values can be worked out by hand.
 */
public final class ProjectionFixtures {

    public static final int START_YEAR = 2025;

    private ProjectionFixtures() {
    }

    /**
     * 30-year-old saving 20,000 a year at 7% from nothing, retiring at 65, no spending.
     */
    public static ProjectionInput.ProjectionInputBuilder saver() {
        return ProjectionInput.builder()
                .currentAge(30)
                .retirementAge(65)
                .maxAge(90)
                .startYear(START_YEAR)
                .balancesByType(BalanceByType.zero())
                .annualContribution(new BigDecimal("20000"))
                .contributionAllocation(BalanceByType.of("60", "30", "10"))
                .expectedReturn(new BigDecimal("0.07"))
                .inflationRate(BigDecimal.ZERO);
    }

    /**
     * Already retired at 65 with 500,000 spread across the categories and 40,000 of spending.
     */
    public static ProjectionInput.ProjectionInputBuilder retiree() {
        return ProjectionInput.builder()
                .currentAge(65)
                .retirementAge(65)
                .maxAge(90)
                .startYear(START_YEAR)
                .balancesByType(BalanceByType.of("300000", "100000", "100000"))
                .contributionAllocation(BalanceByType.of("60", "30", "10"))
                .expectedReturn(BigDecimal.ZERO)
                .inflationRate(BigDecimal.ZERO)
                .annualEssentialExpenses(new BigDecimal("30000"))
                .annualDiscretionaryExpenses(new BigDecimal("10000"));
    }

    public static IncomeStream socialSecurity(String annualAmount, int startAge) {
        return IncomeStream.builder()
                .id("ss")
                .name("Social Security")
                .type(IncomeStreamType.SOCIAL_SECURITY)
                .annualAmount(new BigDecimal(annualAmount))
                .startAge(startAge)
                .inflationAdjusted(true)
                .build();
    }

    public static IncomeStream rental(String annualAmount, int startAge) {
        return IncomeStream.builder()
                .id("rental")
                .name("Rental flat")
                .type(IncomeStreamType.RENTAL)
                .annualAmount(new BigDecimal(annualAmount))
                .startAge(startAge)
                .build();
    }

    /**
     * Go-Go from 65 at 120% discretionary, Slow-Go from 75 at 70%, essentials unchanged.
     */
    public static SpendingPhaseConfig goGoSlowGo() {
        return SpendingPhaseConfig.builder()
                .enabled(true)
                .phase(SpendingPhase.builder()
                        .id("go-go")
                        .name("Go-Go")
                        .startAge(65)
                        .discretionaryMultiplier(new BigDecimal("1.2"))
                        .build())
                .phase(SpendingPhase.builder()
                        .id("slow-go")
                        .name("Slow-Go")
                        .startAge(75)
                        .discretionaryMultiplier(new BigDecimal("0.7"))
                        .build())
                .build();
    }
}
