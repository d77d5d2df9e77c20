package com.gillianbc.retirement.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

/**
 * Caller-supplied values that take precedence over snapshot-derived defaults. Every field is optional.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ProjectionOverrides {

    @DecimalMin("0") @DecimalMax("0.30")
    BigDecimal expectedReturn;

    @DecimalMin("0") @DecimalMax("0.10")
    BigDecimal inflationRate;

    @Min(50) @Max(120)
    Integer maxAge;

    @DecimalMin("0") @DecimalMax("0.10")
    BigDecimal contributionGrowthRate;

    @Min(30) @Max(80)
    Integer retirementAge;

    @Valid
    List<IncomeStream> incomeStreams;

    @DecimalMin("0") @DecimalMax("100000")
    BigDecimal annualHealthcareCosts;

    @DecimalMin("0") @DecimalMax("0.15")
    BigDecimal healthcareInflationRate;

    BalanceByType contributionAllocation;

    SpendingPhaseConfig spendingPhaseConfig;

    DepletionTarget depletionTarget;

    /** Older clients send a claiming age and monthly benefit instead of an income stream. */
    @Min(62) @Max(70)
    Integer socialSecurityAge;

    @DecimalMin("0") @DecimalMax("10000")
    BigDecimal socialSecurityMonthly;

    public static ProjectionOverrides none() {
        return ProjectionOverrides.builder().build();
    }

    @JsonIgnore
    @AssertTrue(message = "contributionAllocation must sum to 100")
    public boolean isContributionAllocationValid() {
        if (contributionAllocation == null) {
            return true;
        }
        return contributionAllocation.getTaxDeferred().signum() >= 0
                && contributionAllocation.getTaxFree().signum() >= 0
                && contributionAllocation.getTaxable().signum() >= 0
                && contributionAllocation.total().compareTo(Money.HUNDRED) == 0;
    }

    @JsonIgnore
    @AssertTrue(message = "spendingPhaseConfig must have at most 4 phases with strictly ascending start ages")
    public boolean isSpendingPhaseConfigValid() {
        if (spendingPhaseConfig == null || !spendingPhaseConfig.isEnabled()) {
            return true;
        }
        List<SpendingPhase> phases = spendingPhaseConfig.getPhases();
        if (phases.isEmpty() || phases.size() > SpendingPhaseConfig.MAX_PHASES) {
            return false;
        }
        for (int i = 1; i < phases.size(); i++) {
            if (phases.get(i).getStartAge() <= phases.get(i - 1).getStartAge()) {
                return false;
            }
        }
        return true;
    }

    @JsonIgnore
    @AssertTrue(message = "depletionTarget percentage must be between 0 and 100")
    public boolean isDepletionTargetValid() {
        if (depletionTarget == null || !depletionTarget.isEnabled()) {
            return true;
        }
        BigDecimal pct = depletionTarget.getTargetPercentageSpent();
        return pct.signum() >= 0 && pct.compareTo(Money.HUNDRED) <= 0;
    }
}
