package com.gillianbc.retirement.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * A single assumption whose perturbation is measured by sensitivity analysis.
 * <p>
 * Declaration order is the tie-break when two levers move the outcome by the same amount.
 */
public enum Lever {

    EXPECTED_RETURN("expectedReturn", "Expected Return", Kind.RATE, LeverDirection.INCREASE, "0.01", null,
            "Review annually based on portfolio allocation and market conditions") {
        @Override
        public BigDecimal currentValue(ProjectionInput input) {
            return input.getExpectedReturn();
        }

        @Override
        ProjectionInput withValue(ProjectionInput input, BigDecimal value) {
            return input.toBuilder().expectedReturn(value).build();
        }
    },
    INFLATION_RATE("inflationRate", "Inflation Rate", Kind.RATE, LeverDirection.DECREASE, "0.005", null,
            "Consider updating if inflation trends significantly change") {
        @Override
        public BigDecimal currentValue(ProjectionInput input) {
            return input.getInflationRate();
        }

        @Override
        ProjectionInput withValue(ProjectionInput input, BigDecimal value) {
            return input.toBuilder().inflationRate(value).build();
        }
    },
    RETIREMENT_AGE("retirementAge", "Retirement Age", Kind.AGE, LeverDirection.INCREASE, "1", EffortLevel.MODERATE,
            "Revisit as career plans evolve") {
        @Override
        public BigDecimal currentValue(ProjectionInput input) {
            return BigDecimal.valueOf(input.getRetirementAge());
        }

        @Override
        ProjectionInput withValue(ProjectionInput input, BigDecimal value) {
            return input.toBuilder().retirementAge(value.intValueExact()).build();
        }

        @Override
        boolean isApplicable(ProjectionInput input, BigDecimal value) {
            return value.intValueExact() <= input.getMaxAge();
        }
    },
    CONTRIBUTION_GROWTH_RATE("contributionGrowthRate", "Contribution Growth", Kind.RATE, LeverDirection.INCREASE, "0.01",
            EffortLevel.MINIMAL, "Adjust based on expected career trajectory") {
        @Override
        public BigDecimal currentValue(ProjectionInput input) {
            return input.getContributionGrowthRate();
        }

        @Override
        ProjectionInput withValue(ProjectionInput input, BigDecimal value) {
            return input.toBuilder().contributionGrowthRate(value).build();
        }

        @Override
        boolean isApplicable(ProjectionInput input, BigDecimal value) {
            return input.getAnnualContribution().signum() > 0 && input.getCurrentAge() < input.getRetirementAge();
        }
    },
    HEALTHCARE_INFLATION_RATE("healthcareInflationRate", "Healthcare Inflation", Kind.RATE, LeverDirection.DECREASE, "0.01",
            null, "Monitor healthcare cost trends periodically") {
        @Override
        public BigDecimal currentValue(ProjectionInput input) {
            return input.getHealthcareInflationRate();
        }

        @Override
        ProjectionInput withValue(ProjectionInput input, BigDecimal value) {
            return input.toBuilder().healthcareInflationRate(value).build();
        }
    },
    ANNUAL_HEALTHCARE_COSTS("annualHealthcareCosts", "Healthcare Costs", Kind.MONEY, LeverDirection.DECREASE, "1000",
            EffortLevel.LOW, "Review as healthcare needs or coverage changes") {
        @Override
        public BigDecimal currentValue(ProjectionInput input) {
            return input.getAnnualHealthcareCosts();
        }

        @Override
        ProjectionInput withValue(ProjectionInput input, BigDecimal value) {
            return input.toBuilder().annualHealthcareCosts(value).build();
        }
    };

    /**
     * How a lever's value is shown to people.
     */
    enum Kind {
        RATE, AGE, MONEY
    }

    private final String key;
    private final String displayName;
    private final Kind kind;
    private final LeverDirection direction;
    private final BigDecimal delta;
    private final EffortLevel effortLevel;
    private final String reviewSuggestion;

    Lever(String key, String displayName, Kind kind, LeverDirection direction, String delta,
          EffortLevel effortLevel, String reviewSuggestion) {
        this.key = key;
        this.displayName = displayName;
        this.kind = kind;
        this.direction = direction;
        this.delta = new BigDecimal(delta);
        this.effortLevel = effortLevel;
        this.reviewSuggestion = reviewSuggestion;
    }

    public abstract BigDecimal currentValue(ProjectionInput input);

    abstract ProjectionInput withValue(ProjectionInput input, BigDecimal value);

    boolean isApplicable(ProjectionInput input, BigDecimal value) {
        return true;
    }

    /**
     * Copy of the input with only this lever moved by its delta, or empty when the move
     * is meaningless for this household (e.g. a rate pushed below zero).
     */
    public Optional<ProjectionInput> perturb(ProjectionInput input) {
        BigDecimal current = currentValue(input);
        BigDecimal moved = direction == LeverDirection.INCREASE ? current.add(delta) : current.subtract(delta);
        if (moved.signum() < 0 || !isApplicable(input, moved)) {
            return Optional.empty();
        }
        return Optional.of(withValue(input, moved));
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public LeverDirection getDirection() {
        return direction;
    }

    public BigDecimal getDelta() {
        return delta;
    }

    /**
     * @return effort for a person to act on this lever; empty for market assumptions nobody controls
     */
    public Optional<EffortLevel> getEffortLevel() {
        return Optional.ofNullable(effortLevel);
    }

    public String getReviewSuggestion() {
        return reviewSuggestion;
    }

    public String formatValue(BigDecimal value) {
        switch (kind) {
            case RATE:
                return percent(value);
            case AGE:
                return "Age " + value.toPlainString();
            default:
                return Money.formatCompact(value);
        }
    }

    public String formatDelta() {
        switch (kind) {
            case RATE:
                return percent(delta);
            case AGE:
                int years = delta.intValueExact();
                return years + (years == 1 ? " year" : " years");
            default:
                return Money.formatCompact(delta);
        }
    }

    private static String percent(BigDecimal rate) {
        return rate.multiply(Money.HUNDRED).setScale(1, RoundingMode.HALF_UP).toPlainString() + "%";
    }
}
