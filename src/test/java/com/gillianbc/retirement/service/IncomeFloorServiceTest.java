package com.gillianbc.retirement.service;

import com.gillianbc.retirement.ProjectionFixtures;
import com.gillianbc.retirement.model.IncomeFloorAnalysis;
import com.gillianbc.retirement.model.IncomeFloorStatus;
import com.gillianbc.retirement.model.IncomeStream;
import com.gillianbc.retirement.model.IncomeStreamType;
import com.gillianbc.retirement.model.ProjectionInput;
import com.gillianbc.retirement.model.YearlyCoverage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IncomeFloorServiceTest {

    private final IncomeFloorService service = new IncomeFloorService();

    private static IncomeStream pension(String amount) {
        return IncomeStream.builder()
                .id("pension").name("Final salary").type(IncomeStreamType.PENSION)
                .annualAmount(new BigDecimal(amount)).startAge(65)
                .build();
    }

    private static ProjectionInput withStreams(IncomeStream... streams) {
        ProjectionInput.ProjectionInputBuilder builder = ProjectionFixtures.retiree();
        for (IncomeStream stream : streams) {
            builder.incomeStream(stream);
        }
        return builder.build();
    }

    @Test
    @DisplayName("Nothing to analyse without guaranteed income")
    void analyze_noGuaranteedIncome_isEmpty() {
        assertTrue(service.analyze(withStreams(ProjectionFixtures.rental("50000", 65))).isEmpty());
    }

    @Test
    @DisplayName("Nothing to analyse without essential expenses")
    void analyze_noEssentials_isEmpty() {
        ProjectionInput input = withStreams(pension("10000")).toBuilder()
                .annualEssentialExpenses(BigDecimal.ZERO)
                .build();
        assertTrue(service.analyze(input).isEmpty());
    }

    @Test
    @DisplayName("Guaranteed income matching essentials covers the floor from retirement")
    void analyze_fullyCovered() {
        IncomeFloorAnalysis analysis = service.analyze(withStreams(pension("30000"))).orElseThrow();

        assertEquals(IncomeFloorStatus.FULLY_COVERED, analysis.getStatus());
        assertTrue(analysis.isFloorEstablished());
        assertEquals(65, analysis.getFloorEstablishedAge());
        assertEquals(new BigDecimal("1.000"), analysis.getCoverageRatioAtRetirement());
        assertEquals("Your essential lifestyle is fully covered by guaranteed income from retirement.",
                analysis.getInsightStatement());
    }

    @Test
    @DisplayName("Social Security from 67 leaves the first two years partial, then covers the floor")
    void analyze_socialSecurityStartsLater() {
        IncomeFloorAnalysis analysis = service.analyze(
                withStreams(ProjectionFixtures.socialSecurity("36000", 67))).orElseThrow();

        assertEquals(IncomeFloorStatus.PARTIAL, analysis.getStatus());
        assertEquals(67, analysis.getFloorEstablishedAge());
        assertEquals(26, analysis.getCoverageByAge().size());

        YearlyCoverage atSixtyFive = analysis.getCoverageByAge().get(0);
        assertEquals(65, atSixtyFive.getAge());
        assertEquals(ProjectionFixtures.START_YEAR, atSixtyFive.getYear());
        assertFalse(atSixtyFive.isFullyCovered());
        assertEquals(IncomeFloorStatus.PARTIAL, atSixtyFive.getStatus());

        YearlyCoverage atSixtySeven = analysis.getCoverageByAge().get(2);
        assertTrue(atSixtySeven.isFullyCovered());
        assertEquals(new BigDecimal("1.200"), atSixtySeven.getCoverageRatio());
        assertEquals("Guaranteed income covers 0% of essential expenses at retirement, "
                + "and fully covers your essential lifestyle starting at age 67.", analysis.getInsightStatement());
    }

    @Test
    @DisplayName("Half-covered essentials are partial")
    void analyze_partial() {
        IncomeFloorAnalysis analysis = service.analyze(withStreams(pension("15000"))).orElseThrow();

        assertEquals(IncomeFloorStatus.PARTIAL, analysis.getStatus());
        assertFalse(analysis.isFloorEstablished());
        assertNull(analysis.getFloorEstablishedAge());
        assertEquals("Guaranteed income covers 50% of essential expenses at retirement.", analysis.getInsightStatement());
    }

    @Test
    @DisplayName("Negligible guaranteed income is insufficient")
    void analyze_insufficient() {
        IncomeFloorAnalysis analysis = service.analyze(withStreams(pension("10"))).orElseThrow();

        assertEquals(IncomeFloorStatus.INSUFFICIENT, analysis.getStatus());
        assertEquals("Essential expenses exceed guaranteed income throughout retirement. "
                + "Guaranteed income covers 0% of essential expenses.", analysis.getInsightStatement());
    }
}
