package com.gillianbc.retirement.service;

import com.gillianbc.retirement.ProjectionFixtures;
import com.gillianbc.retirement.model.BalanceByType;
import com.gillianbc.retirement.model.DepletionTarget;
import com.gillianbc.retirement.model.FieldChange;
import com.gillianbc.retirement.model.ProjectionInput;
import com.gillianbc.retirement.model.RmdConfig;
import com.gillianbc.retirement.model.StalenessResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StalenessCheckerTest {

    private final StalenessChecker checker = new StalenessChecker();

    private static ProjectionInput stored() {
        return ProjectionFixtures.retiree()
                .expectedReturn(new BigDecimal("0.06"))
                .incomeStream(ProjectionFixtures.socialSecurity("24000", 67))
                .incomeStream(ProjectionFixtures.rental("6000", 65))
                .build();
    }

    @Test
    @DisplayName("Identical inputs are not stale")
    void check_identical_notStale() {
        StalenessResult result = checker.checkProjectionStaleness(stored(), stored());

        assertFalse(result.isStale());
        assertTrue(result.getChangedFields().isEmpty());
        assertTrue(result.getChanges().isEmpty());
    }

    @Test
    @DisplayName("Income stream order and decimal scale do not matter")
    void check_reorderedStreamsAndScale_notStale() {
        ProjectionInput current = stored().toBuilder()
                .clearIncomeStreams()
                .incomeStream(ProjectionFixtures.rental("6000.00", 65))
                .incomeStream(ProjectionFixtures.socialSecurity("24000", 67))
                .expectedReturn(new BigDecimal("0.060"))
                .build();

        assertFalse(checker.checkProjectionStaleness(stored(), current).isStale());
    }

    @Test
    @DisplayName("A disabled spending phase config is the same as none")
    void check_disabledPhases_equalsAbsent() {
        ProjectionInput current = stored().toBuilder()
                .spendingPhaseConfig(ProjectionFixtures.goGoSlowGo().toBuilder().enabled(false).build())
                .build();

        assertFalse(checker.checkProjectionStaleness(stored(), current).isStale());
    }

    @Test
    @DisplayName("Changed fields are listed in input field order with both values")
    void check_changedFields() {
        ProjectionInput current = stored().toBuilder()
                .expectedReturn(new BigDecimal("0.07"))
                .retirementAge(67)
                .balancesByType(BalanceByType.of("300000", "100000", "150000"))
                .build();

        StalenessResult result = checker.checkProjectionStaleness(stored(), current);

        assertTrue(result.isStale());
        assertThat(result.getChangedFields()).containsExactly("retirementAge", "balancesByType", "expectedReturn");
        assertEquals(new FieldChange("retirementAge", "65", "67"), result.getChanges().get(0));
        assertEquals("{\"taxDeferred\":300000,\"taxFree\":100000,\"taxable\":150000}",
                result.getChanges().get(1).getCurrentValue());
        assertEquals(new FieldChange("expectedReturn", "0.06", "0.07"), result.getChanges().get(2));
    }

    @Test
    @DisplayName("Enabling spending phases makes a projection stale")
    void check_enablingPhases_isStale() {
        ProjectionInput current = stored().toBuilder()
                .spendingPhaseConfig(ProjectionFixtures.goGoSlowGo())
                .build();

        StalenessResult result = checker.checkProjectionStaleness(stored(), current);

        assertThat(result.getChangedFields()).containsExactly("spendingPhaseConfig");
        assertEquals("null", result.getChanges().get(0).getPreviousValue());
    }

    private static final Map<String, UnaryOperator<ProjectionInput>> SINGLE_FIELD_CHANGES = new LinkedHashMap<>();

    static {
        SINGLE_FIELD_CHANGES.put("currentAge", i -> i.toBuilder().currentAge(64).build());
        SINGLE_FIELD_CHANGES.put("retirementAge", i -> i.toBuilder().retirementAge(67).build());
        SINGLE_FIELD_CHANGES.put("maxAge", i -> i.toBuilder().maxAge(95).build());
        SINGLE_FIELD_CHANGES.put("startYear", i -> i.toBuilder().startYear(2026).build());
        SINGLE_FIELD_CHANGES.put("balancesByType", i -> i.toBuilder().balancesByType(BalanceByType.of("300000", "100000", "150000")).build());
        SINGLE_FIELD_CHANGES.put("annualContribution", i -> i.toBuilder().annualContribution(new BigDecimal("5000")).build());
        SINGLE_FIELD_CHANGES.put("contributionAllocation", i -> i.toBuilder().contributionAllocation(BalanceByType.of("50", "40", "10")).build());
        SINGLE_FIELD_CHANGES.put("expectedReturn", i -> i.toBuilder().expectedReturn(new BigDecimal("0.07")).build());
        SINGLE_FIELD_CHANGES.put("inflationRate", i -> i.toBuilder().inflationRate(new BigDecimal("0.03")).build());
        SINGLE_FIELD_CHANGES.put("contributionGrowthRate", i -> i.toBuilder().contributionGrowthRate(new BigDecimal("0.02")).build());
        SINGLE_FIELD_CHANGES.put("annualEssentialExpenses", i -> i.toBuilder().annualEssentialExpenses(new BigDecimal("31000")).build());
        SINGLE_FIELD_CHANGES.put("annualDiscretionaryExpenses", i -> i.toBuilder().annualDiscretionaryExpenses(new BigDecimal("12000")).build());
        SINGLE_FIELD_CHANGES.put("annualHealthcareCosts", i -> i.toBuilder().annualHealthcareCosts(new BigDecimal("6500")).build());
        SINGLE_FIELD_CHANGES.put("healthcareInflationRate", i -> i.toBuilder().healthcareInflationRate(new BigDecimal("0.05")).build());
        SINGLE_FIELD_CHANGES.put("incomeStreams", i -> i.toBuilder().clearIncomeStreams()
                .incomeStream(ProjectionFixtures.socialSecurity("24000", 67)).build());
        SINGLE_FIELD_CHANGES.put("annualDebtPayments", i -> i.toBuilder().annualDebtPayments(new BigDecimal("3000")).build());
        SINGLE_FIELD_CHANGES.put("debtPayoffAge", i -> i.toBuilder().debtPayoffAge(70).build());
        SINGLE_FIELD_CHANGES.put("spendingPhaseConfig", i -> i.toBuilder().spendingPhaseConfig(ProjectionFixtures.goGoSlowGo()).build());
        SINGLE_FIELD_CHANGES.put("depletionTarget", i -> i.toBuilder().depletionTarget(DepletionTarget.builder()
                .enabled(true)
                .targetPercentageSpent(new BigDecimal("80"))
                .targetAge(85)
                .build()).build());
        SINGLE_FIELD_CHANGES.put("reserveFloor", i -> i.toBuilder().reserveFloor(new BigDecimal("50000")).build());
        SINGLE_FIELD_CHANGES.put("rmdConfig", i -> i.toBuilder().rmdConfig(RmdConfig.builder().startAge(75).build()).build());
    }

    static Stream<String> trackedFields() {
        return StalenessChecker.FIELDS.keySet().stream();
    }

    @Test
    @DisplayName("Every tracked field has a single-field change below")
    void fieldsCoveredBySingleFieldChanges() {
        assertThat(SINGLE_FIELD_CHANGES.keySet()).containsExactlyElementsOf(StalenessChecker.FIELDS.keySet());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("trackedFields")
    @DisplayName("Changing one field makes the projection stale and names only that field")
    void check_singleFieldChange_namesThatField(String field) {
        ProjectionInput current = SINGLE_FIELD_CHANGES.get(field).apply(stored());

        StalenessResult result = checker.checkProjectionStaleness(stored(), current);

        assertTrue(result.isStale(), field);
        assertThat(result.getChangedFields()).containsExactly(field);
        assertThat(result.getChanges()).extracting(FieldChange::getField).containsExactly(field);
    }
}
