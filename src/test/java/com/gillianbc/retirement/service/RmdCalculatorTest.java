package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.RmdConfig;
import com.gillianbc.retirement.reference.UniformLifetimeTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RmdCalculatorTest {

    private final RmdCalculator calculator = new RmdCalculator(new UniformLifetimeTable());

    @Test
    @DisplayName("No distribution period before the start age")
    void distributionPeriod_beforeStartAge_isEmpty() {
        assertTrue(calculator.distributionPeriod(RmdConfig.defaults(), 72).isEmpty());
    }

    @Test
    @DisplayName("Distribution period at 73 is 26.5")
    void distributionPeriod_atStartAge() {
        assertEquals(new BigDecimal("26.5"), calculator.distributionPeriod(RmdConfig.defaults(), 73).orElseThrow());
    }

    @Test
    @DisplayName("Disabled RMDs have no distribution period")
    void distributionPeriod_disabled_isEmpty() {
        RmdConfig disabled = RmdConfig.builder().enabled(false).build();
        assertTrue(calculator.distributionPeriod(disabled, 80).isEmpty());
    }

    @Test
    @DisplayName("A later configured start age delays distributions")
    void distributionPeriod_customStartAge() {
        RmdConfig seventyFive = RmdConfig.builder().startAge(75).build();
        assertTrue(calculator.distributionPeriod(seventyFive, 74).isEmpty());
        assertEquals(new BigDecimal("24.6"), calculator.distributionPeriod(seventyFive, 75).orElseThrow());
    }

    @Test
    @DisplayName("Required minimum is the prior balance over the period")
    void requiredMinimum_dividesBalance() {
        BigDecimal rmd = calculator.requiredMinimum(new BigDecimal("265000"), new BigDecimal("26.5"));
        assertEquals(0, rmd.compareTo(new BigDecimal("10000")));
    }

    @Test
    @DisplayName("A negative balance requires nothing")
    void requiredMinimum_negativeBalance_isZero() {
        assertEquals(0, calculator.requiredMinimum(new BigDecimal("-5"), new BigDecimal("26.5")).signum());
    }
}
