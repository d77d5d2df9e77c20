package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.ProjectionSummary;
import com.gillianbc.retirement.model.RetirementStatus;
import com.gillianbc.retirement.model.RetirementStatusResult;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Headline status of a projection.
 * <p>
 * On track when the money lasts to the horizon, needs adjustment when it runs out more than
 * 20 years into retirement, at risk otherwise.
 */
@Component
public class RetirementStatusEvaluator {

    static final int COMFORTABLE_RUNWAY_YEARS = 20;

    public RetirementStatusResult evaluate(ProjectionSummary summary, int retirementAge, int maxAge) {
        Objects.requireNonNull(summary, "summary must not be null");
        Integer years = summary.getYearsUntilDepletion();
        if (years == null) {
            return result(RetirementStatus.ON_TRACK,
                    "Your retirement savings are projected to last through age " + maxAge + ".");
        }
        int depletionAge = retirementAge + years;
        if (years > COMFORTABLE_RUNWAY_YEARS) {
            return result(RetirementStatus.NEEDS_ADJUSTMENT,
                    "Funds may run out at age " + depletionAge + ". Consider increasing savings.");
        }
        return result(RetirementStatus.AT_RISK,
                "Funds projected to run out at age " + depletionAge + ". Action recommended.");
    }

    private static RetirementStatusResult result(RetirementStatus status, String description) {
        return new RetirementStatusResult(status, status.getLabel(), description);
    }
}
