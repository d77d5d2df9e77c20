package com.gillianbc.retirement.service;

import com.gillianbc.retirement.ProjectionFixtures;
import com.gillianbc.retirement.model.BalanceByType;
import com.gillianbc.retirement.model.ProjectionInput;
import com.gillianbc.retirement.model.ProjectionWarning;
import com.gillianbc.retirement.model.RmdConfig;
import com.gillianbc.retirement.model.WarningSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProjectionWarningServiceTest {

    private final ProjectionWarningService service = new ProjectionWarningService();

    private static ProjectionWarning only(List<ProjectionWarning> warnings, String field) {
        return warnings.stream().filter(w -> w.getField().equals(field)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("Ordinary inputs produce no warnings")
    void generate_ordinaryInput_none() {
        ProjectionInput input = ProjectionFixtures.saver()
                .inflationRate(new BigDecimal("0.025"))
                .build();

        assertTrue(service.generate(input).isEmpty());
    }

    @Test
    @DisplayName("Inflation above 8% is a warning")
    void generate_highInflation() {
        List<ProjectionWarning> warnings = service.generate(ProjectionFixtures.saver()
                .inflationRate(new BigDecimal("0.09"))
                .build());

        ProjectionWarning warning = only(warnings, "inflationRate");
        assertEquals(WarningSeverity.WARNING, warning.getSeverity());
        assertThat(warning.getMessage()).startsWith("Inflation rate of 9.0% is higher than historical averages.");
    }

    @Test
    @DisplayName("Returns below 2% get an informational note")
    void generate_lowReturn() {
        List<ProjectionWarning> warnings = service.generate(ProjectionFixtures.saver()
                .expectedReturn(new BigDecimal("0.015"))
                .build());

        assertEquals(WarningSeverity.INFO, only(warnings, "expectedReturn").getSeverity());
        assertThat(only(warnings, "expectedReturn").getMessage()).startsWith("Expected return of 1.5% is quite conservative.");
    }

    @Test
    @DisplayName("No savings and no contributions is a warning")
    void generate_noSavings() {
        List<ProjectionWarning> warnings = service.generate(ProjectionFixtures.saver()
                .annualContribution(BigDecimal.ZERO)
                .build());

        assertEquals(WarningSeverity.WARNING, only(warnings, "savings").getSeverity());
    }

    @Test
    @DisplayName("Debt payments at or above contributions are flagged")
    void generate_debtExceedsContributions() {
        List<ProjectionWarning> warnings = service.generate(ProjectionFixtures.saver()
                .annualDebtPayments(new BigDecimal("20000"))
                .build());

        assertEquals("Your debt payments exceed your retirement contributions. Consider prioritizing debt reduction.",
                only(warnings, "debt").getMessage());
    }

    @Test
    @DisplayName("Retirement within five years is noted, singular for one year")
    void generate_retirementSoon() {
        List<ProjectionWarning> warnings = service.generate(ProjectionFixtures.saver()
                .currentAge(64)
                .build());

        assertEquals("You're 1 year from retirement. Focus on preserving capital and finalizing your income strategy.",
                only(warnings, "retirementAge").getMessage());
    }

    @Test
    @DisplayName("Approaching RMD age with a large tax-deferred balance is noted")
    void generate_rmdApproaching() {
        List<ProjectionWarning> warnings = service.generate(ProjectionFixtures.retiree()
                .currentAge(71)
                .retirementAge(71)
                .balancesByType(BalanceByType.of("250000", "0", "0"))
                .build());

        assertThat(only(warnings, "rmd").getMessage()).contains("With $250,000 in tax-deferred accounts");
    }

    @Test
    @DisplayName("The RMD notice follows the configured trigger age")
    void generate_rmdFollowsConfiguredStartAge() {
        ProjectionInput input = ProjectionFixtures.retiree()
                .currentAge(73)
                .retirementAge(73)
                .balancesByType(BalanceByType.of("250000", "0", "0"))
                .rmdConfig(RmdConfig.builder().startAge(75).build())
                .build();

        ProjectionWarning warning = only(service.generate(input), "rmd");
        assertThat(warning.getMessage())
                .startsWith("You're approaching age 75 when Required Minimum Distributions (RMDs) begin.")
                .endsWith("starting at age 75.");

        // Already at the trigger age, or with RMDs switched off, there is nothing to warn about
        assertThat(service.generate(input.toBuilder().currentAge(75).retirementAge(75).build()))
                .extracting(ProjectionWarning::getField)
                .doesNotContain("rmd");
        assertThat(service.generate(input.toBuilder().rmdConfig(RmdConfig.builder().enabled(false).build()).build()))
                .extracting(ProjectionWarning::getField)
                .doesNotContain("rmd");
    }
}
