package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.Money;
import com.gillianbc.retirement.model.RmdConfig;
import com.gillianbc.retirement.reference.RmdDivisorTable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Required minimum distribution: prior year-end tax-deferred balance divided by the table's
 * distribution period for the holder's age.
 */
@Component
public class RmdCalculator {

    private final RmdDivisorTable divisorTable;

    public RmdCalculator(RmdDivisorTable divisorTable) {
        this.divisorTable = Objects.requireNonNull(divisorTable, "divisorTable must not be null");
    }

    /**
     * @return the divisor in force at this age, or empty when no distribution is required
     */
    public Optional<BigDecimal> distributionPeriod(RmdConfig config, int age) {
        Objects.requireNonNull(config, "config must not be null");
        if (!config.appliesAt(age)) {
            return Optional.empty();
        }
        return divisorTable.divisorFor(age);
    }

    public BigDecimal requiredMinimum(BigDecimal priorYearEndTaxDeferred, BigDecimal distributionPeriod) {
        Objects.requireNonNull(priorYearEndTaxDeferred, "priorYearEndTaxDeferred must not be null");
        Objects.requireNonNull(distributionPeriod, "distributionPeriod must not be null");
        return Money.safeDivide(Money.nonNegative(priorYearEndTaxDeferred), distributionPeriod);
    }
}
