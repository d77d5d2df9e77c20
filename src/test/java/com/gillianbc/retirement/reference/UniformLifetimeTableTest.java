package com.gillianbc.retirement.reference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UniformLifetimeTableTest {

    private final UniformLifetimeTable table = new UniformLifetimeTable();

    @Test
    @DisplayName("Divisors shrink with age across the whole table")
    void divisorFor_decreasesWithAge() {
        BigDecimal previous = table.divisorFor(UniformLifetimeTable.FIRST_AGE).orElseThrow();
        for (int age = UniformLifetimeTable.FIRST_AGE + 1; age <= UniformLifetimeTable.LAST_AGE; age++) {
            BigDecimal divisor = table.divisorFor(age).orElseThrow();
            assertTrue(divisor.compareTo(previous) < 0, "divisor at " + age);
            previous = divisor;
        }
    }

    @Test
    @DisplayName("Known values at the ends of the table")
    void divisorFor_knownValues() {
        assertEquals(new BigDecimal("26.5"), table.divisorFor(73).orElseThrow());
        assertEquals(new BigDecimal("20.2"), table.divisorFor(80).orElseThrow());
        assertEquals(new BigDecimal("2.0"), table.divisorFor(120).orElseThrow());
    }

    @Test
    @DisplayName("Ages past the table reuse the last divisor; younger ages have none")
    void divisorFor_outsideTable() {
        assertEquals(new BigDecimal("2.0"), table.divisorFor(125).orElseThrow());
        assertFalse(table.divisorFor(72).isPresent());
    }
}
