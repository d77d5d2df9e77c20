package com.gillianbc.retirement.service;

import com.gillianbc.retirement.config.ProjectionProperties;
import com.gillianbc.retirement.model.DepletionFeedback;
import com.gillianbc.retirement.model.DepletionTarget;
import com.gillianbc.retirement.model.Money;
import com.gillianbc.retirement.model.PhaseSpendingBreakdown;
import com.gillianbc.retirement.model.ProjectionInput;
import com.gillianbc.retirement.model.ProjectionRecord;
import com.gillianbc.retirement.model.ProjectionResult;
import com.gillianbc.retirement.model.SpendingPhase;
import com.gillianbc.retirement.model.TrajectoryStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares planned spending with what a depletion target can sustain.
 * <p>
 * Sustainable spending is searched for with the projection itself: the flat annual budget
 * (retirement-baseline dollars) that leaves exactly the reserve at the target age.
 */
@Slf4j
@Service
public class DepletionFeedbackService {

    static final int SEARCH_ITERATIONS = 50;
    private static final int MAX_BRACKET_DOUBLINGS = 60;
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final ProjectionService projectionService;
    private final SpendingModel spendingModel;
    private final ReserveCalculator reserveCalculator;
    private final BigDecimal tolerance;

    public DepletionFeedbackService() {
        this(new ProjectionService(), new SpendingModel(), new ReserveCalculator(), ProjectionProperties.defaults());
    }

    @Autowired
    public DepletionFeedbackService(ProjectionService projectionService,
                                    SpendingModel spendingModel,
                                    ReserveCalculator reserveCalculator,
                                    ProjectionProperties properties) {
        this.projectionService = Objects.requireNonNull(projectionService, "projectionService must not be null");
        this.spendingModel = Objects.requireNonNull(spendingModel, "spendingModel must not be null");
        this.reserveCalculator = Objects.requireNonNull(reserveCalculator, "reserveCalculator must not be null");
        this.tolerance = Objects.requireNonNull(properties, "properties must not be null").trajectoryTolerance();
    }

    /**
     * @return empty when the input has no enabled depletion target
     */
    public Optional<DepletionFeedback> calculateDepletionFeedback(ProjectionInput input) {
        Objects.requireNonNull(input, "input must not be null");
        if (!input.hasEnabledDepletionTarget()) {
            return Optional.empty();
        }
        DepletionTarget target = input.getDepletionTarget();
        int targetAge = target.getTargetAge();
        if (targetAge <= 0) {
            return Optional.of(disabled("Target age is not configured"));
        }
        if (targetAge <= input.getRetirementAge()) {
            return Optional.of(disabled("Target age must be after retirement"));
        }

        BigDecimal portfolio = input.getBalancesByType().total();
        BigDecimal reserve = reserveCalculator.reserveAmount(target, portfolio);
        BigDecimal sustainable = sustainableAnnualSpending(input, reserve);
        BigDecimal planned = plannedAnnualSpending(input, targetAge);
        TrajectoryStatus status = trajectoryStatus(sustainable, planned);

        // Follow the plan as entered at least as far as the target age
        ProjectionResult actual = projectionService.runProjection(
                input.toBuilder().maxAge(Math.max(input.getMaxAge(), targetAge)).build());
        BigDecimal projectedReserve = actual.recordAt(targetAge).map(ProjectionRecord::getBalance).orElse(Money.ZERO);
        Integer depletionAge = actual.depletionAge().orElse(null);

        List<String> warnings = new ArrayList<>();
        if (status == TrajectoryStatus.OVERSPENDING && sustainable.signum() > 0) {
            BigDecimal overage = planned.subtract(sustainable).multiply(Money.HUNDRED)
                    .divide(sustainable, 0, RoundingMode.HALF_UP);
            warnings.add("Current spending exceeds sustainable rate by " + overage.toPlainString()
                    + "%. Consider reducing to " + Money.formatWhole(monthly(sustainable)) + "/month.");
        }
        if (status == TrajectoryStatus.UNDERSPENDING && planned.signum() > 0) {
            warnings.add("You could enjoy " + Money.formatWhole(monthly(sustainable.subtract(planned)))
                    + "/month more without risking your goals!");
        }
        if (projectedReserve.compareTo(reserve) < 0) {
            warnings.add("Current trajectory shows reserve shortfall of "
                    + Money.formatWhole(reserve.subtract(projectedReserve)) + " at age " + targetAge + ".");
        }
        if (depletionAge != null && depletionAge < targetAge) {
            warnings.add("Warning: Portfolio depletes at age " + depletionAge
                    + ", before reaching your target age " + targetAge + ".");
        }

        log.debug("Depletion target age {}: sustainable {}, planned {}, status {}", targetAge, sustainable, planned, status);

        return Optional.of(DepletionFeedback.builder()
                .evaluated(true)
                .reserveAmount(reserve)
                .sustainableAnnualSpending(sustainable)
                .sustainableMonthlySpending(monthly(sustainable))
                .plannedAnnualSpending(planned)
                .trajectoryStatus(status)
                .statusMessage(statusMessage(status, target))
                .warningMessages(warnings)
                .phaseBreakdown(phaseBreakdown(input, sustainable, targetAge))
                .projectedReserveAtTarget(projectedReserve)
                .projectedDepletionAge(depletionAge)
                .build());
    }

    /**
     * Largest flat annual budget that still leaves {@code reserve} at the target age, found by bisection.
     */
    BigDecimal sustainableAnnualSpending(ProjectionInput input, BigDecimal reserve) {
        if (endingBalanceSpending(input, BigDecimal.ZERO).compareTo(reserve) <= 0) {
            return Money.ZERO;
        }
        BigDecimal lo = BigDecimal.ZERO;
        BigDecimal hi = input.getBalancesByType().total().max(BigDecimal.valueOf(1000));
        int doublings = 0;
        while (endingBalanceSpending(input, hi).compareTo(reserve) > 0 && doublings < MAX_BRACKET_DOUBLINGS) {
            lo = hi;
            hi = hi.multiply(TWO);
            doublings++;
        }
        for (int i = 0; i < SEARCH_ITERATIONS; i++) {
            BigDecimal mid = lo.add(hi).divide(TWO, Money.MATH_CONTEXT);
            if (endingBalanceSpending(input, mid).compareTo(reserve) > 0) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        log.debug("Sustainable spending search settled at {} after {} bracket doublings", lo, doublings);
        return Money.round(lo);
    }

    private BigDecimal endingBalanceSpending(ProjectionInput input, BigDecimal annualSpending) {
        ProjectionInput flat = input.toBuilder()
                .maxAge(input.getDepletionTarget().getTargetAge())
                .annualEssentialExpenses(annualSpending)
                .annualDiscretionaryExpenses(BigDecimal.ZERO)
                .spendingPhaseConfig(null)
                .depletionTarget(null)
                .reserveFloor(null)
                .build();
        return projectionService.runProjection(flat).getSummary().getEndingBalance();
    }

    /**
     * Average phase-adjusted budget over retirement up to the target age.
     */
    BigDecimal plannedAnnualSpending(ProjectionInput input, int targetAge) {
        BigDecimal total = BigDecimal.ZERO;
        int years = 0;
        for (int age = input.getRetirementAge(); age <= targetAge; age++) {
            total = total.add(spendingModel.expensesAt(input, age).total());
            years++;
        }
        if (years == 0) {
            return Money.round(input.totalBaseExpenses());
        }
        return Money.round(total.divide(BigDecimal.valueOf(years), Money.MATH_CONTEXT));
    }

    TrajectoryStatus trajectoryStatus(BigDecimal sustainable, BigDecimal planned) {
        if (sustainable.signum() <= 0) {
            return TrajectoryStatus.OVERSPENDING;
        }
        BigDecimal ratio = planned.divide(sustainable, Money.MATH_CONTEXT);
        if (ratio.compareTo(BigDecimal.ONE.subtract(tolerance)) <= 0) {
            return TrajectoryStatus.UNDERSPENDING;
        }
        if (ratio.compareTo(BigDecimal.ONE.add(tolerance)) >= 0) {
            return TrajectoryStatus.OVERSPENDING;
        }
        return TrajectoryStatus.ON_TRACK;
    }

    /**
     * Splits the sustainable amount across phases by their average multiplier, weighted by years
     * spent in each phase between retirement and the target age.
     */
    List<PhaseSpendingBreakdown> phaseBreakdown(ProjectionInput input, BigDecimal sustainable, int targetAge) {
        List<PhaseSpendingBreakdown> breakdown = new ArrayList<>();
        if (!input.hasActiveSpendingPhases()) {
            return breakdown;
        }
        List<SpendingPhase> phases = input.getSpendingPhaseConfig().sortedPhases();
        List<SpendingPhase> included = new ArrayList<>();
        List<int[]> spans = new ArrayList<>();
        int totalYears = 0;
        for (int i = 0; i < phases.size(); i++) {
            int start = Math.max(phases.get(i).getStartAge(), input.getRetirementAge());
            int end = i < phases.size() - 1 ? Math.min(phases.get(i + 1).getStartAge(), targetAge) : targetAge;
            if (start < targetAge && start < end) {
                included.add(phases.get(i));
                spans.add(new int[]{start, end});
                totalYears += end - start;
            }
        }
        if (included.isEmpty()) {
            return breakdown;
        }

        BigDecimal weighted = BigDecimal.ZERO;
        for (int i = 0; i < included.size(); i++) {
            int years = spans.get(i)[1] - spans.get(i)[0];
            weighted = weighted.add(averageMultiplier(included.get(i))
                    .multiply(BigDecimal.valueOf(years))
                    .divide(BigDecimal.valueOf(totalYears), Money.MATH_CONTEXT));
        }
        BigDecimal base = weighted.signum() > 0 ? sustainable.divide(weighted, Money.MATH_CONTEXT) : sustainable;

        for (int i = 0; i < included.size(); i++) {
            BigDecimal annual = base.multiply(averageMultiplier(included.get(i)), Money.MATH_CONTEXT);
            breakdown.add(PhaseSpendingBreakdown.builder()
                    .phaseName(included.get(i).getName())
                    .startAge(spans.get(i)[0])
                    .endAge(spans.get(i)[1])
                    .yearsInPhase(spans.get(i)[1] - spans.get(i)[0])
                    .annualSpending(Money.round(annual))
                    .monthlySpending(monthly(annual))
                    .build());
        }
        return breakdown;
    }

    private static BigDecimal averageMultiplier(SpendingPhase phase) {
        return phase.getEssentialMultiplier().add(phase.getDiscretionaryMultiplier()).divide(TWO, Money.MATH_CONTEXT);
    }

    private static BigDecimal monthly(BigDecimal annual) {
        return Money.round(annual.divide(Money.TWELVE, Money.MATH_CONTEXT));
    }

    private static String statusMessage(TrajectoryStatus status, DepletionTarget target) {
        switch (status) {
            case ON_TRACK:
                return "You're on track to spend " + target.getTargetPercentageSpent().stripTrailingZeros().toPlainString()
                        + "% of your portfolio by age " + target.getTargetAge() + ".";
            case UNDERSPENDING:
                return "You're spending below your sustainable rate. You could enjoy more now while still meeting your goals.";
            default:
                return "Your current spending exceeds what's sustainable for your depletion target. Consider adjustments to stay on track.";
        }
    }

    private static DepletionFeedback disabled(String message) {
        return DepletionFeedback.builder()
                .evaluated(false)
                .reserveAmount(Money.ZERO)
                .sustainableAnnualSpending(Money.ZERO)
                .sustainableMonthlySpending(Money.ZERO)
                .plannedAnnualSpending(Money.ZERO)
                .trajectoryStatus(TrajectoryStatus.ON_TRACK)
                .statusMessage(message)
                .projectedReserveAtTarget(Money.ZERO)
                .build();
    }
}
