package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * The human-readable subset of a {@link ProjectionInput}, stored next to a result.
 */
@Value
@Builder
@Jacksonized
public class ProjectionAssumptions {
    @NonNull BigDecimal expectedReturn;
    @NonNull BigDecimal inflationRate;
    @NonNull BigDecimal healthcareInflationRate;
    @NonNull BigDecimal contributionGrowthRate;
    int retirementAge;
    int maxAge;

    public static ProjectionAssumptions from(ProjectionInput input) {
        Objects.requireNonNull(input, "input must not be null");
        return ProjectionAssumptions.builder()
                .expectedReturn(input.getExpectedReturn())
                .inflationRate(input.getInflationRate())
                .healthcareInflationRate(input.getHealthcareInflationRate())
                .contributionGrowthRate(input.getContributionGrowthRate())
                .retirementAge(input.getRetirementAge())
                .maxAge(input.getMaxAge())
                .build();
    }
}
