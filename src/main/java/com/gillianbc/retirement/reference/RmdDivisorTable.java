package com.gillianbc.retirement.reference;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Versioned life-expectancy divisors for required minimum distributions.
 */
public interface RmdDivisorTable {

    /**
     * @return label identifying the published table, e.g. "IRS Uniform Lifetime Table (2024)"
     */
    String getVersion();

    /**
     * @return the distribution period for the age, or empty when the table has no entry
     */
    Optional<BigDecimal> divisorFor(int age);
}
