package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.IncomeStream;
import com.gillianbc.retirement.model.Money;
import com.gillianbc.retirement.model.ProjectionInput;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Turns a list of income streams into the income that applies at a given age.
 * <p>
 * Inflation-adjusted streams grow from their own start age; the others stay nominal.
 */
@Component
public class IncomeStreamResolver {

    public BigDecimal totalIncomeAt(ProjectionInput input, int age) {
        Objects.requireNonNull(input, "input must not be null");
        return incomeAt(input.getIncomeStreams(), age, input.getInflationRate(), false);
    }

    public BigDecimal guaranteedIncomeAt(ProjectionInput input, int age) {
        Objects.requireNonNull(input, "input must not be null");
        return incomeAt(input.getIncomeStreams(), age, input.getInflationRate(), true);
    }

    public BigDecimal incomeAt(List<IncomeStream> streams, int age, BigDecimal inflationRate, boolean guaranteedOnly) {
        Objects.requireNonNull(streams, "streams must not be null");
        Objects.requireNonNull(inflationRate, "inflationRate must not be null");
        BigDecimal total = BigDecimal.ZERO;
        for (IncomeStream stream : streams) {
            if (guaranteedOnly && !stream.isGuaranteed()) {
                continue;
            }
            total = total.add(amountAt(stream, age, inflationRate));
        }
        return total;
    }

    /**
     * @return the stream's payment at this age, zero outside its start/end range
     */
    public BigDecimal amountAt(IncomeStream stream, int age, BigDecimal inflationRate) {
        if (!stream.isActiveAt(age)) {
            return BigDecimal.ZERO;
        }
        if (!stream.isInflationAdjusted()) {
            return stream.getAnnualAmount();
        }
        return stream.getAnnualAmount()
                .multiply(Money.growthFactor(inflationRate, age - stream.getStartAge()), Money.MATH_CONTEXT);
    }

    public boolean hasGuaranteedIncome(List<IncomeStream> streams) {
        return streams.stream().anyMatch(IncomeStream::isGuaranteed);
    }
}
