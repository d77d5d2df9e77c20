package com.gillianbc.retirement.service;

import com.gillianbc.retirement.ProjectionFixtures;
import com.gillianbc.retirement.model.BalanceByType;
import com.gillianbc.retirement.model.ProjectionInput;
import com.gillianbc.retirement.model.SpendingComparison;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SpendingComparisonServiceTest {

    private final SpendingComparisonService service = new SpendingComparisonService();

    /**
     * Flat: 40,000 every year. Phased: 42,000 a year to 74, then 37,000.
     */
    private static ProjectionInput household() {
        return ProjectionFixtures.retiree()
                .balancesByType(BalanceByType.of("0", "0", "2000000"))
                .spendingPhaseConfig(ProjectionFixtures.goGoSlowGo())
                .build();
    }

    @Test
    @DisplayName("Phased spending front-loads 2,000 a year over the first ten years")
    void calculateSpendingComparison_earlyYearsBonus() {
        SpendingComparison comparison = service.calculateSpendingComparison(household());

        assertEquals(10, comparison.getEarlyYearsCount());
        assertEquals(new BigDecimal("20000.00"), comparison.getEarlyYearsBonus());
    }

    @Test
    @DisplayName("Lifetime totals and yearly series for both strategies")
    void calculateSpendingComparison_lifetimeTotals() {
        SpendingComparison comparison = service.calculateSpendingComparison(household(), 10);

        assertEquals(0, comparison.getFlatSpending().getTotalLifetimeSpending().compareTo(new BigDecimal("1040000")));
        assertEquals(0, comparison.getPhasedSpending().getTotalLifetimeSpending().compareTo(new BigDecimal("1012000")));
        assertEquals(26, comparison.getPhasedSpending().getYearlySpending().size());
        assertEquals("Go-Go", comparison.getPhasedSpending().getYearlySpending().get(0).getPhaseName());
        assertNull(comparison.getFlatSpending().getYearlySpending().get(0).getPhaseName());
        assertNull(comparison.getFlatSpending().getDepletionAge());
    }

    @Test
    @DisplayName("Cumulative phased spending falls back below flat at 81")
    void calculateSpendingComparison_breakEvenAge() {
        SpendingComparison comparison = service.calculateSpendingComparison(household(), 10);

        assertEquals(81, comparison.getBreakEvenAge());
        assertEquals(0, comparison.getLongevityDifference());
    }

    @Test
    @DisplayName("Front-loaded spending that runs the money out sooner shows as lost longevity")
    void calculateSpendingComparison_longevityDifference() {
        ProjectionInput input = household().toBuilder()
                .balancesByType(BalanceByType.of("0", "0", "410000"))
                .build();

        SpendingComparison comparison = service.calculateSpendingComparison(input, 5);

        // Flat: 410,000 at 40,000 a year lasts into 75. Phased: 42,000 a year is gone at 74
        assertEquals(75, comparison.getFlatSpending().getDepletionAge());
        assertEquals(74, comparison.getPhasedSpending().getDepletionAge());
        assertEquals(-1, comparison.getLongevityDifference());
    }

    @Test
    @DisplayName("The early-years window must be at least one year")
    void calculateSpendingComparison_invalidWindow_throws() {
        assertThrows(IllegalArgumentException.class, () -> service.calculateSpendingComparison(household(), 0));
    }
}
