package com.gillianbc.retirement.service;

import com.gillianbc.retirement.config.ProjectionProperties;
import com.gillianbc.retirement.model.Money;
import com.gillianbc.retirement.model.ProjectionInput;
import com.gillianbc.retirement.model.ProjectionRecord;
import com.gillianbc.retirement.model.ProjectionResult;
import com.gillianbc.retirement.model.SpendingComparison;
import com.gillianbc.retirement.model.SpendingSeries;
import com.gillianbc.retirement.model.YearlySpending;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs the same household with flat spending and with its spending phases, and compares the two.
 */
@Slf4j
@Service
public class SpendingComparisonService {

    /** Cumulative spending closer than this counts as break-even. */
    private static final BigDecimal BREAK_EVEN_MARGIN = BigDecimal.valueOf(100);

    private final ProjectionService projectionService;
    private final int defaultEarlyYears;

    public SpendingComparisonService() {
        this(new ProjectionService(), ProjectionProperties.defaults());
    }

    @Autowired
    public SpendingComparisonService(ProjectionService projectionService, ProjectionProperties properties) {
        this.projectionService = Objects.requireNonNull(projectionService, "projectionService must not be null");
        this.defaultEarlyYears = Objects.requireNonNull(properties, "properties must not be null").spendingComparisonYears();
    }

    public SpendingComparison calculateSpendingComparison(ProjectionInput input) {
        return calculateSpendingComparison(input, defaultEarlyYears);
    }

    public SpendingComparison calculateSpendingComparison(ProjectionInput input, int earlyYearsCount) {
        Objects.requireNonNull(input, "input must not be null");
        if (earlyYearsCount < 1) {
            throw new IllegalArgumentException("earlyYearsCount must be >= 1");
        }
        ProjectionResult flat = projectionService.runProjection(input.toBuilder().spendingPhaseConfig(null).build());
        ProjectionResult phased = projectionService.runProjection(input);

        int retirementAge = input.getRetirementAge();
        List<ProjectionRecord> flatRetired = retired(flat, retirementAge);
        List<ProjectionRecord> phasedRetired = retired(phased, retirementAge);

        BigDecimal earlyBonus = earlySpending(phasedRetired, retirementAge, earlyYearsCount)
                .subtract(earlySpending(flatRetired, retirementAge, earlyYearsCount));

        Integer flatYears = flat.getSummary().getYearsUntilDepletion();
        Integer phasedYears = phased.getSummary().getYearsUntilDepletion();
        int horizon = input.getMaxAge() - retirementAge;
        int longevity = 0;
        if (flatYears != null && phasedYears != null) {
            longevity = phasedYears - flatYears;
        } else if (flatYears != null) {
            longevity = horizon - flatYears;
        } else if (phasedYears != null) {
            longevity = -(horizon - phasedYears);
        }

        log.debug("Spending comparison over {} early years: bonus {}, longevity difference {}", earlyYearsCount, earlyBonus, longevity);

        return SpendingComparison.builder()
                .flatSpending(series(flat, flatRetired, false))
                .phasedSpending(series(phased, phasedRetired, true))
                .earlyYearsBonus(Money.round(earlyBonus))
                .earlyYearsCount(earlyYearsCount)
                .breakEvenAge(breakEvenAge(flatRetired, phasedRetired))
                .longevityDifference(longevity)
                .build();
    }

    private static List<ProjectionRecord> retired(ProjectionResult result, int retirementAge) {
        return result.getRecords().stream()
                .filter(r -> r.getAge() >= retirementAge)
                .collect(Collectors.toList());
    }

    private static BigDecimal earlySpending(List<ProjectionRecord> records, int retirementAge, int years) {
        return records.stream()
                .filter(r -> r.getAge() < retirementAge + years)
                .map(ProjectionRecord::getOutflows)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * First age where cumulative phased spending crosses flat spending, or comes within $100 of it.
     */
    private static Integer breakEvenAge(List<ProjectionRecord> flat, List<ProjectionRecord> phased) {
        BigDecimal flatCumulative = BigDecimal.ZERO;
        BigDecimal phasedCumulative = BigDecimal.ZERO;
        for (int i = 0; i < Math.min(flat.size(), phased.size()); i++) {
            BigDecimal previousDiff = phasedCumulative.subtract(flatCumulative);
            flatCumulative = flatCumulative.add(flat.get(i).getOutflows());
            phasedCumulative = phasedCumulative.add(phased.get(i).getOutflows());
            BigDecimal diff = phasedCumulative.subtract(flatCumulative);

            boolean crossed = (previousDiff.signum() > 0 && diff.signum() <= 0)
                    || (previousDiff.signum() < 0 && diff.signum() >= 0);
            if (crossed || (i > 0 && diff.abs().compareTo(BREAK_EVEN_MARGIN) < 0)) {
                return flat.get(i).getAge();
            }
        }
        return null;
    }

    private static SpendingSeries series(ProjectionResult result, List<ProjectionRecord> retired, boolean withPhases) {
        SpendingSeries.SpendingSeriesBuilder series = SpendingSeries.builder()
                .totalLifetimeSpending(retired.stream()
                        .map(ProjectionRecord::getOutflows)
                        .reduce(BigDecimal.ZERO, BigDecimal::add))
                .depletionAge(result.depletionAge().orElse(null))
                .endingBalance(result.getSummary().getEndingBalance());
        for (ProjectionRecord record : retired) {
            series.year(new YearlySpending(record.getAge(), record.getOutflows(), withPhases ? record.getActivePhaseName() : null));
        }
        return series.build();
    }
}
