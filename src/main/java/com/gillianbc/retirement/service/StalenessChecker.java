package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.FieldChange;
import com.gillianbc.retirement.model.ProjectionInput;
import com.gillianbc.retirement.model.StalenessResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Tells whether a saved projection's inputs still match the household's current inputs.
 */
@Slf4j
@Component
public class StalenessChecker {

    /** Every input field, in declaration order. */
    static final Map<String, Function<ProjectionInput, Object>> FIELDS = new LinkedHashMap<>();

    static {
        FIELDS.put("currentAge", ProjectionInput::getCurrentAge);
        FIELDS.put("retirementAge", ProjectionInput::getRetirementAge);
        FIELDS.put("maxAge", ProjectionInput::getMaxAge);
        FIELDS.put("startYear", ProjectionInput::getStartYear);
        FIELDS.put("balancesByType", ProjectionInput::getBalancesByType);
        FIELDS.put("annualContribution", ProjectionInput::getAnnualContribution);
        FIELDS.put("contributionAllocation", ProjectionInput::getContributionAllocation);
        FIELDS.put("expectedReturn", ProjectionInput::getExpectedReturn);
        FIELDS.put("inflationRate", ProjectionInput::getInflationRate);
        FIELDS.put("contributionGrowthRate", ProjectionInput::getContributionGrowthRate);
        FIELDS.put("annualEssentialExpenses", ProjectionInput::getAnnualEssentialExpenses);
        FIELDS.put("annualDiscretionaryExpenses", ProjectionInput::getAnnualDiscretionaryExpenses);
        FIELDS.put("annualHealthcareCosts", ProjectionInput::getAnnualHealthcareCosts);
        FIELDS.put("healthcareInflationRate", ProjectionInput::getHealthcareInflationRate);
        FIELDS.put("incomeStreams", ProjectionInput::getIncomeStreams);
        FIELDS.put("annualDebtPayments", ProjectionInput::getAnnualDebtPayments);
        FIELDS.put("debtPayoffAge", ProjectionInput::getDebtPayoffAge);
        FIELDS.put("spendingPhaseConfig", ProjectionInput::getSpendingPhaseConfig);
        FIELDS.put("depletionTarget", ProjectionInput::getDepletionTarget);
        FIELDS.put("reserveFloor", ProjectionInput::getReserveFloor);
        FIELDS.put("rmdConfig", ProjectionInput::getRmdConfig);
    }

    private final CanonicalJson canonicalJson;

    public StalenessChecker() {
        this(new CanonicalJson());
    }

    @Autowired
    public StalenessChecker(CanonicalJson canonicalJson) {
        this.canonicalJson = Objects.requireNonNull(canonicalJson, "canonicalJson must not be null");
    }

    /**
     * Compares the two inputs field by field on their canonical JSON. Income streams are compared
     * regardless of order, and a switched-off phase config or depletion target equals an absent one.
     */
    public StalenessResult checkProjectionStaleness(ProjectionInput stored, ProjectionInput current) {
        Objects.requireNonNull(stored, "stored must not be null");
        Objects.requireNonNull(current, "current must not be null");
        ProjectionInput before = canonicalJson.normalize(stored);
        ProjectionInput after = canonicalJson.normalize(current);

        StalenessResult.StalenessResultBuilder result = StalenessResult.builder();
        boolean stale = false;
        for (Map.Entry<String, Function<ProjectionInput, Object>> field : FIELDS.entrySet()) {
            String previous = canonicalJson.write(field.getValue().apply(before));
            String now = canonicalJson.write(field.getValue().apply(after));
            if (!previous.equals(now)) {
                stale = true;
                result.changedField(field.getKey());
                result.change(new FieldChange(field.getKey(), previous, now));
            }
        }
        StalenessResult staleness = result.stale(stale).build();
        log.debug("Staleness check: stale={}, changed {}", staleness.isStale(), staleness.getChangedFields());
        return staleness;
    }
}
