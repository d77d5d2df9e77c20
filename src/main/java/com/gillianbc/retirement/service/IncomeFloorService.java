package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.IncomeFloorAnalysis;
import com.gillianbc.retirement.model.IncomeFloorStatus;
import com.gillianbc.retirement.model.IncomeStream;
import com.gillianbc.retirement.model.Money;
import com.gillianbc.retirement.model.ProjectionInput;
import com.gillianbc.retirement.model.YearlyCoverage;
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
 * Safety-first check: does guaranteed income alone pay for essential spending?
 */
@Slf4j
@Service
public class IncomeFloorService {

    /** Ratios below this count as no coverage at all. */
    private static final BigDecimal NEGLIGIBLE_RATIO = new BigDecimal("0.001");

    private final IncomeStreamResolver incomeStreamResolver;
    private final SpendingModel spendingModel;

    public IncomeFloorService() {
        this(new IncomeStreamResolver(), new SpendingModel());
    }

    @Autowired
    public IncomeFloorService(IncomeStreamResolver incomeStreamResolver, SpendingModel spendingModel) {
        this.incomeStreamResolver = Objects.requireNonNull(incomeStreamResolver, "incomeStreamResolver must not be null");
        this.spendingModel = Objects.requireNonNull(spendingModel, "spendingModel must not be null");
    }

    /**
     * @return empty unless there is at least one guaranteed stream and essential expenses are positive
     */
    public Optional<IncomeFloorAnalysis> analyze(ProjectionInput input) {
        Objects.requireNonNull(input, "input must not be null");
        if (!incomeStreamResolver.hasGuaranteedIncome(input.getIncomeStreams())
                || input.getAnnualEssentialExpenses().signum() <= 0) {
            return Optional.empty();
        }

        List<YearlyCoverage> coverage = new ArrayList<>();
        Integer floorEstablishedAge = null;
        for (int age = input.getRetirementAge(); age <= input.getMaxAge(); age++) {
            BigDecimal guaranteed = incomeStreamResolver.guaranteedIncomeAt(input, age);
            BigDecimal essential = spendingModel.essentialExpensesAt(input, age);
            BigDecimal ratio = essential.signum() > 0 ? guaranteed.divide(essential, Money.MATH_CONTEXT) : null;
            boolean fullyCovered = ratio == null || ratio.compareTo(BigDecimal.ONE) >= 0;
            if (fullyCovered && floorEstablishedAge == null) {
                floorEstablishedAge = age;
            }
            coverage.add(YearlyCoverage.builder()
                    .age(age)
                    .year(input.getStartYear() + (age - input.getCurrentAge()))
                    .guaranteedIncome(Money.round(guaranteed))
                    .essentialExpenses(Money.round(essential))
                    .coverageRatio(ratio == null ? null : ratio.setScale(3, RoundingMode.HALF_UP))
                    .fullyCovered(fullyCovered)
                    .status(status(ratio, input.getIncomeStreams(), age))
                    .build());
        }

        int retirementAge = input.getRetirementAge();
        BigDecimal guaranteedAtRetirement = incomeStreamResolver.guaranteedIncomeAt(input, retirementAge);
        BigDecimal essentialAtRetirement = spendingModel.essentialExpensesAt(input, retirementAge);
        BigDecimal ratioAtRetirement = Money.safeDivide(guaranteedAtRetirement, essentialAtRetirement);
        IncomeFloorStatus status = status(essentialAtRetirement.signum() > 0 ? ratioAtRetirement : null,
                input.getIncomeStreams(), retirementAge);

        log.debug("Income floor at {}: ratio {}, status {}, established at {}",
                retirementAge, ratioAtRetirement, status, floorEstablishedAge);

        return Optional.of(IncomeFloorAnalysis.builder()
                .guaranteedIncomeAtRetirement(Money.round(guaranteedAtRetirement))
                .essentialExpensesAtRetirement(Money.round(essentialAtRetirement))
                .coverageRatioAtRetirement(ratioAtRetirement.setScale(3, RoundingMode.HALF_UP))
                .status(status)
                .floorEstablished(floorEstablishedAge != null)
                .floorEstablishedAge(floorEstablishedAge)
                .coverageByAge(coverage)
                .insightStatement(insight(status, floorEstablishedAge, ratioAtRetirement, retirementAge))
                .build());
    }

    /**
     * A guaranteed stream that has yet to start keeps an uncovered year at PARTIAL rather than INSUFFICIENT.
     */
    private static IncomeFloorStatus status(BigDecimal ratio, List<IncomeStream> streams, int age) {
        if (ratio == null || ratio.compareTo(BigDecimal.ONE) >= 0) {
            return IncomeFloorStatus.FULLY_COVERED;
        }
        if (ratio.compareTo(NEGLIGIBLE_RATIO) >= 0 || guaranteedStreamStartsAfter(streams, age)) {
            return IncomeFloorStatus.PARTIAL;
        }
        return IncomeFloorStatus.INSUFFICIENT;
    }

    private static boolean guaranteedStreamStartsAfter(List<IncomeStream> streams, int age) {
        return streams.stream().anyMatch(s -> s.isGuaranteed() && s.getStartAge() > age);
    }

    private static String insight(IncomeFloorStatus status, Integer floorEstablishedAge,
                                  BigDecimal ratio, int retirementAge) {
        int percentCovered = ratio.multiply(Money.HUNDRED).setScale(0, RoundingMode.HALF_UP).intValue();
        if (status == IncomeFloorStatus.FULLY_COVERED || (floorEstablishedAge != null && floorEstablishedAge == retirementAge)) {
            return "Your essential lifestyle is fully covered by guaranteed income from retirement.";
        }
        if (floorEstablishedAge != null) {
            return "Guaranteed income covers " + percentCovered + "% of essential expenses at retirement, "
                    + "and fully covers your essential lifestyle starting at age " + floorEstablishedAge + ".";
        }
        if (status == IncomeFloorStatus.PARTIAL) {
            return "Guaranteed income covers " + percentCovered + "% of essential expenses at retirement.";
        }
        return "Essential expenses exceed guaranteed income throughout retirement. Guaranteed income covers "
                + percentCovered + "% of essential expenses.";
    }
}
