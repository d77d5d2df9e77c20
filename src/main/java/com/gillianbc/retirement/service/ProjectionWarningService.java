package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.Money;
import com.gillianbc.retirement.model.ProjectionInput;
import com.gillianbc.retirement.model.ProjectionWarning;
import com.gillianbc.retirement.model.RmdConfig;
import com.gillianbc.retirement.model.WarningSeverity;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flags inputs that are valid but unusual enough to deserve a note alongside the projection.
 */
@Service
public class ProjectionWarningService {

    private static final BigDecimal HIGH_INFLATION = new BigDecimal("0.08");
    private static final BigDecimal LOW_RETURN = new BigDecimal("0.02");
    private static final BigDecimal RMD_BALANCE_THRESHOLD = BigDecimal.valueOf(100_000);
    /** How many years before the RMD trigger age the notice starts. */
    private static final int RMD_NOTICE_YEARS = 3;

    public List<ProjectionWarning> generate(ProjectionInput input) {
        Objects.requireNonNull(input, "input must not be null");
        List<ProjectionWarning> warnings = new ArrayList<>();

        if (input.getInflationRate().compareTo(HIGH_INFLATION) > 0) {
            warnings.add(new ProjectionWarning("inflationRate",
                    "Inflation rate of " + percent(input.getInflationRate())
                            + "% is higher than historical averages. Consider using a more conservative estimate (2-4% is typical).",
                    WarningSeverity.WARNING));
        }

        if (input.getExpectedReturn().compareTo(LOW_RETURN) < 0 && input.getExpectedReturn().signum() >= 0) {
            warnings.add(new ProjectionWarning("expectedReturn",
                    "Expected return of " + percent(input.getExpectedReturn())
                            + "% is quite conservative. Historical stock market returns average 7-10% before inflation.",
                    WarningSeverity.INFO));
        }

        if (input.getBalancesByType().total().signum() == 0 && input.getAnnualContribution().signum() == 0) {
            warnings.add(new ProjectionWarning("savings",
                    "Starting with no savings and no contributions will result in relying entirely on other income sources in retirement.",
                    WarningSeverity.WARNING));
        }

        if (input.getAnnualDebtPayments().signum() > 0 && input.getAnnualContribution().signum() > 0
                && input.getAnnualContribution().compareTo(input.getAnnualDebtPayments()) <= 0) {
            warnings.add(new ProjectionWarning("debt",
                    "Your debt payments exceed your retirement contributions. Consider prioritizing debt reduction.",
                    WarningSeverity.INFO));
        }

        int yearsToRetirement = input.getRetirementAge() - input.getCurrentAge();
        if (yearsToRetirement > 0 && yearsToRetirement <= 5) {
            warnings.add(new ProjectionWarning("retirementAge",
                    "You're " + yearsToRetirement + (yearsToRetirement == 1 ? " year" : " years")
                            + " from retirement. Focus on preserving capital and finalizing your income strategy.",
                    WarningSeverity.INFO));
        }

        BigDecimal taxDeferred = input.getBalancesByType().getTaxDeferred();
        RmdConfig rmd = input.getRmdConfig();
        if (rmd.isEnabled()
                && input.getCurrentAge() >= rmd.getStartAge() - RMD_NOTICE_YEARS
                && input.getCurrentAge() < rmd.getStartAge()
                && taxDeferred.compareTo(RMD_BALANCE_THRESHOLD) > 0) {
            warnings.add(new ProjectionWarning("rmd",
                    "You're approaching age " + rmd.getStartAge() + " when Required Minimum Distributions (RMDs) begin. With "
                            + Money.formatWhole(taxDeferred)
                            + " in tax-deferred accounts, you'll be required to withdraw a minimum amount each year starting at age "
                            + rmd.getStartAge() + ".",
                    WarningSeverity.INFO));
        }

        return warnings;
    }

    private static String percent(BigDecimal rate) {
        return rate.multiply(Money.HUNDRED).setScale(1, RoundingMode.HALF_UP).toPlainString();
    }
}
