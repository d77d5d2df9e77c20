package com.gillianbc.retirement.service;

import com.gillianbc.retirement.config.ProjectionProperties;
import com.gillianbc.retirement.model.EffortLevel;
import com.gillianbc.retirement.model.Lever;
import com.gillianbc.retirement.model.LeverImpact;
import com.gillianbc.retirement.model.LowFrictionWin;
import com.gillianbc.retirement.model.Money;
import com.gillianbc.retirement.model.ProjectionInput;
import com.gillianbc.retirement.model.ProjectionSummary;
import com.gillianbc.retirement.model.SensitiveAssumption;
import com.gillianbc.retirement.model.SensitivityResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * "What-if" analysis: reruns the projection with one assumption moved at a time and ranks the
 * assumptions by how much they move the ending balance.
 */
@Slf4j
@Service
public class SensitivityService {

    public static final int TOP_LEVER_COUNT = 3;
    public static final int MAX_WINS = 3;

    private static final BigDecimal SAVINGS_BOOST = new BigDecimal("0.10");
    private static final BigDecimal EXPENSE_CUT = new BigDecimal("0.05");

    private final ProjectionService projectionService;
    private final BigDecimal materialityPercent;

    public SensitivityService() {
        this(new ProjectionService(), ProjectionProperties.defaults());
    }

    @Autowired
    public SensitivityService(ProjectionService projectionService, ProjectionProperties properties) {
        this.projectionService = Objects.requireNonNull(projectionService, "projectionService must not be null");
        this.materialityPercent = Objects.requireNonNull(properties, "properties must not be null").materialityPercent();
    }

    public SensitivityResult analyzeSensitivity(ProjectionInput input) {
        Objects.requireNonNull(input, "input must not be null");
        ProjectionSummary baseline = projectionService.runProjection(input).getSummary();
        BigDecimal baselineBalance = baseline.getEndingBalance();
        Integer baselineDepletion = baseline.getYearsUntilDepletion();

        List<LeverImpact> impacts = new ArrayList<>();
        for (Lever lever : Lever.values()) {
            Optional<ProjectionInput> perturbed = lever.perturb(input);
            if (perturbed.isEmpty()) {
                log.debug("Lever {} not applicable, skipped", lever);
                continue;
            }
            ProjectionSummary outcome = projectionService.runProjection(perturbed.get()).getSummary();
            BigDecimal impact = outcome.getEndingBalance().subtract(baselineBalance);
            impacts.add(LeverImpact.builder()
                    .lever(lever)
                    .currentValue(lever.currentValue(input))
                    .testDelta(lever.getDelta())
                    .direction(lever.getDirection())
                    .perturbedBalance(outcome.getEndingBalance())
                    .impactOnBalance(impact)
                    .percentImpact(percentOf(impact, baselineBalance))
                    .perturbedDepletion(outcome.getYearsUntilDepletion())
                    .impactOnDepletion(depletionDelta(baselineDepletion, outcome.getYearsUntilDepletion()))
                    .build());
            log.debug("Lever {} moved ending balance by {}", lever, impact);
        }

        // Plans that run out end at zero whatever the lever, so ties fall back to how far depletion moved.
        // List.sort is stable, so anything still equal keeps lever declaration order.
        impacts.sort(Comparator.comparing((LeverImpact i) -> i.getImpactOnBalance().abs()).reversed()
                .thenComparing(Comparator.comparingInt(
                        (LeverImpact i) -> depletionMovement(baselineDepletion, i.getPerturbedDepletion())).reversed()));

        return SensitivityResult.builder()
                .baselineBalance(baselineBalance)
                .baselineDepletion(baselineDepletion)
                .topLevers(impacts.subList(0, Math.min(TOP_LEVER_COUNT, impacts.size())))
                .allLevers(impacts)
                .build();
    }

    /**
     * Small, actionable changes whose effect is material: measured levers a person controls, plus
     * saving 10% more and spending 5% less. Best three by impact.
     */
    public List<LowFrictionWin> identifyLowFrictionWins(ProjectionInput input, SensitivityResult result) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(result, "result must not be null");
        List<LowFrictionWin> wins = new ArrayList<>();

        for (LeverImpact impact : result.getAllLevers()) {
            Lever lever = impact.getLever();
            Optional<EffortLevel> effort = lever.getEffortLevel();
            if (effort.isEmpty() || impact.getImpactOnBalance().signum() <= 0
                    || !isMaterial(impact.getPercentImpact(), result.getBaselineDepletion(), impact.getPerturbedDepletion())) {
                continue;
            }
            if (lever == Lever.RETIREMENT_AGE && input.getRetirementAge() >= 70) {
                continue;
            }
            wins.add(leverWin(input, impact, effort.get()));
        }

        if (input.getAnnualContribution().signum() > 0 && input.getCurrentAge() < input.getRetirementAge()) {
            BigDecimal increase = input.getAnnualContribution().multiply(SAVINGS_BOOST, Money.MATH_CONTEXT);
            ProjectionInput candidate = input.toBuilder()
                    .annualContribution(input.getAnnualContribution().add(increase))
                    .build();
            candidateWin(candidate, result).ifPresent(impact -> wins.add(LowFrictionWin.builder()
                    .id("increase-savings-10pct")
                    .title("Incremental savings boost")
                    .description("Saving an additional " + Money.formatCompact(increase) + "/year (10% increase)")
                    .effortLevel(EffortLevel.LOW)
                    .potentialImpact(impact)
                    .impactDescription("grows to approximately " + Money.formatCompact(impact) + " by the end of the plan")
                    .uncertaintyCaveat("Assumes consistent contribution over time; market returns may vary")
                    .lever("annualContribution")
                    .delta(Money.round(increase))
                    .build()));
        }

        BigDecimal baseExpenses = input.totalBaseExpenses();
        if (baseExpenses.signum() > 0) {
            BigDecimal keep = BigDecimal.ONE.subtract(EXPENSE_CUT);
            ProjectionInput candidate = input.toBuilder()
                    .annualEssentialExpenses(input.getAnnualEssentialExpenses().multiply(keep, Money.MATH_CONTEXT))
                    .annualDiscretionaryExpenses(input.getAnnualDiscretionaryExpenses().multiply(keep, Money.MATH_CONTEXT))
                    .build();
            BigDecimal reduction = baseExpenses.multiply(EXPENSE_CUT, Money.MATH_CONTEXT);
            candidateWin(candidate, result).ifPresent(impact -> wins.add(LowFrictionWin.builder()
                    .id("reduce-expenses-5pct")
                    .title("Modest expense reduction")
                    .description("Reducing annual expenses by " + Money.formatCompact(reduction) + "/year (5%)")
                    .effortLevel(EffortLevel.LOW)
                    .potentialImpact(impact)
                    .impactDescription("frees up approximately " + Money.formatCompact(impact) + " for retirement")
                    .uncertaintyCaveat("Based on current expense levels; actual savings may vary")
                    .lever("annualExpenses")
                    .delta(Money.round(reduction))
                    .build()));
        }

        wins.sort(Comparator.comparing(LowFrictionWin::getPotentialImpact).reversed());
        return wins.size() > MAX_WINS ? new ArrayList<>(wins.subList(0, MAX_WINS)) : wins;
    }

    /**
     * Scores every measured lever 0..100 against the most influential one.
     */
    public List<SensitiveAssumption> identifySensitiveAssumptions(ProjectionInput input, SensitivityResult result) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(result, "result must not be null");
        BigDecimal maxImpact = BigDecimal.ONE;
        for (LeverImpact impact : result.getAllLevers()) {
            maxImpact = maxImpact.max(impact.getImpactOnBalance().abs());
        }

        List<SensitiveAssumption> assumptions = new ArrayList<>();
        for (LeverImpact impact : result.getAllLevers()) {
            Lever lever = impact.getLever();
            int score = impact.getImpactOnBalance().abs()
                    .multiply(Money.HUNDRED)
                    .divide(maxImpact, 0, RoundingMode.HALF_UP)
                    .intValue();
            assumptions.add(SensitiveAssumption.builder()
                    .assumption(lever)
                    .displayName(lever.getDisplayName())
                    .currentValue(impact.getCurrentValue())
                    .formattedValue(lever.formatValue(impact.getCurrentValue()))
                    .sensitivityScore(score)
                    .explanation(explain(impact))
                    .reviewSuggestion(lever.getReviewSuggestion())
                    .build());
        }
        assumptions.sort(Comparator.comparingInt(SensitiveAssumption::getSensitivityScore).reversed());
        return assumptions;
    }

    /**
     * Years by which depletion moved in either direction. Depletion appearing or disappearing
     * outranks any shift in its timing.
     */
    static int depletionMovement(Integer baseline, Integer perturbed) {
        if (baseline == null && perturbed == null) {
            return 0;
        }
        if (baseline == null || perturbed == null) {
            return Integer.MAX_VALUE;
        }
        return Math.abs(perturbed - baseline);
    }

    /**
     * Change in years until depletion between two runs.
     *
     * @return null when neither run depletes or the change removes depletion altogether
     */
    static Integer depletionDelta(Integer baseline, Integer perturbed) {
        if (baseline == null && perturbed == null) {
            return null;
        }
        if (baseline == null) {
            return perturbed;
        }
        if (perturbed == null) {
            return null;
        }
        return perturbed - baseline;
    }

    private LowFrictionWin leverWin(ProjectionInput input, LeverImpact impact, EffortLevel effort) {
        Lever lever = impact.getLever();
        BigDecimal gain = impact.getImpactOnBalance();
        LowFrictionWin.LowFrictionWinBuilder win = LowFrictionWin.builder()
                .effortLevel(effort)
                .potentialImpact(gain)
                .lever(lever.getKey())
                .delta(impact.getTestDelta());
        switch (lever) {
            case RETIREMENT_AGE:
                return win.id("retire-one-year-later")
                        .title("One additional working year")
                        .description("Working until age " + (input.getRetirementAge() + 1) + " instead of " + input.getRetirementAge())
                        .impactDescription("adds approximately " + Money.formatCompact(gain) + " to retirement funds")
                        .uncertaintyCaveat("Assumes continued employment and contribution levels")
                        .build();
            case CONTRIBUTION_GROWTH_RATE:
                return win.id("escalate-contributions-1pct")
                        .title("Automatic contribution escalation")
                        .description("Raising contributions by an extra " + lever.formatDelta() + " each year")
                        .impactDescription("adds approximately " + Money.formatCompact(gain) + " by the end of the plan")
                        .uncertaintyCaveat("Assumes pay rises keep pace with the higher contributions")
                        .build();
            default:
                return win.id("reduce-" + lever.getKey())
                        .title("Lower " + lever.getDisplayName().toLowerCase())
                        .description("Reducing " + lever.getDisplayName().toLowerCase() + " by " + lever.formatDelta() + "/year")
                        .impactDescription("adds approximately " + Money.formatCompact(gain) + " by the end of the plan")
                        .uncertaintyCaveat("Depends on coverage options available to you")
                        .build();
        }
    }

    private Optional<BigDecimal> candidateWin(ProjectionInput candidate, SensitivityResult result) {
        ProjectionSummary outcome = projectionService.runProjection(candidate).getSummary();
        BigDecimal impact = outcome.getEndingBalance().subtract(result.getBaselineBalance());
        BigDecimal percent = percentOf(impact, result.getBaselineBalance());
        if (impact.signum() <= 0 || !isMaterial(percent, result.getBaselineDepletion(), outcome.getYearsUntilDepletion())) {
            return Optional.empty();
        }
        return Optional.of(impact);
    }

    private boolean isMaterial(BigDecimal percentImpact, Integer baselineDepletion, Integer perturbedDepletion) {
        return percentImpact.compareTo(materialityPercent) >= 0
                || postponesDepletion(baselineDepletion, perturbedDepletion);
    }

    private static boolean postponesDepletion(Integer baseline, Integer perturbed) {
        return baseline != null && (perturbed == null || perturbed > baseline);
    }

    private static BigDecimal percentOf(BigDecimal impact, BigDecimal baseline) {
        if (baseline.signum() == 0) {
            return Money.ZERO;
        }
        return Money.round(impact.multiply(Money.HUNDRED).divide(baseline, Money.MATH_CONTEXT));
    }

    private static String explain(LeverImpact impact) {
        Lever lever = impact.getLever();
        String direction = impact.getImpactOnBalance().signum() > 0 ? "higher" : "lower";
        return "A " + lever.formatDelta() + " " + lever.getDirection().label() + " in "
                + lever.getDisplayName().toLowerCase() + " results in approximately "
                + Money.formatCompact(impact.getImpactOnBalance().abs()) + " " + direction + " ending balance.";
    }
}
