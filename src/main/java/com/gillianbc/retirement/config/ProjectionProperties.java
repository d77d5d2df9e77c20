package com.gillianbc.retirement.config;

import com.gillianbc.retirement.model.BalanceByType;
import com.gillianbc.retirement.model.RiskTolerance;
import com.gillianbc.retirement.model.TaxCategory;
import com.gillianbc.retirement.reference.UniformLifetimeTable;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.List;

/**
 * Engine defaults, bound from {@code retirement.projection.*}.
 */
@Validated
@ConfigurationProperties(prefix = "retirement.projection")
public record ProjectionProperties(
        @DefaultValue("90") @Min(1) int maxAge,
        @DefaultValue("0.025") @DecimalMin("0") BigDecimal inflationRate,
        @DefaultValue("0.05") @DecimalMin("0") BigDecimal healthcareInflationRate,
        @DefaultValue("0") @DecimalMin("0") BigDecimal contributionGrowthRate,
        @DefaultValue("60") BigDecimal allocationTaxDeferred,
        @DefaultValue("30") BigDecimal allocationTaxFree,
        @DefaultValue("10") BigDecimal allocationTaxable,
        @DefaultValue("0.04") BigDecimal conservativeReturn,
        @DefaultValue("0.06") BigDecimal moderateReturn,
        @DefaultValue("0.08") BigDecimal aggressiveReturn,
        @DefaultValue("73") @Min(UniformLifetimeTable.FIRST_AGE) int rmdStartAge,
        // Width of the on-track band around sustainable spending, as a fraction
        @DefaultValue("0.05") @DecimalMin("0") BigDecimal trajectoryTolerance,
        @DefaultValue("10") @Min(1) int spendingComparisonYears,
        // Percent change in ending balance that makes a small lever worth suggesting
        @DefaultValue("1.0") @DecimalMin("0") BigDecimal materialityPercent,
        @DefaultValue({"TAXABLE", "TAX_DEFERRED", "TAX_FREE"}) @NotEmpty List<TaxCategory> withdrawalOrder,
        @DefaultValue("8000") BigDecimal healthcareCostUnder65,
        @DefaultValue("6500") BigDecimal healthcareCost65To74,
        @DefaultValue("12000") BigDecimal healthcareCost75Plus,
        @DefaultValue("10") @Min(1) int debtPayoffYears
) {

    /**
     * The same values Spring binds when nothing is configured, for use outside a container.
     */
    public static ProjectionProperties defaults() {
        return new ProjectionProperties(
                90,
                new BigDecimal("0.025"),
                new BigDecimal("0.05"),
                BigDecimal.ZERO,
                new BigDecimal("60"),
                new BigDecimal("30"),
                new BigDecimal("10"),
                new BigDecimal("0.04"),
                new BigDecimal("0.06"),
                new BigDecimal("0.08"),
                73,
                new BigDecimal("0.05"),
                10,
                new BigDecimal("1.0"),
                List.of(TaxCategory.TAXABLE, TaxCategory.TAX_DEFERRED, TaxCategory.TAX_FREE),
                new BigDecimal("8000"),
                new BigDecimal("6500"),
                new BigDecimal("12000"),
                10);
    }

    public BalanceByType contributionAllocation() {
        return new BalanceByType(allocationTaxDeferred, allocationTaxFree, allocationTaxable);
    }

    public BigDecimal returnFor(RiskTolerance riskTolerance) {
        switch (riskTolerance) {
            case CONSERVATIVE:
                return conservativeReturn;
            case AGGRESSIVE:
                return aggressiveReturn;
            default:
                return moderateReturn;
        }
    }

    /**
     * Annual healthcare cost estimate in today's dollars for someone retiring at the given age.
     */
    public BigDecimal healthcareCostAt(int age) {
        if (age < 65) {
            return healthcareCostUnder65;
        }
        if (age < 75) {
            return healthcareCost65To74;
        }
        return healthcareCost75Plus;
    }
}
