package com.gillianbc.retirement.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Shared arithmetic settings for money and rates.
 * <p>
 * Intermediate values keep {@link #MATH_CONTEXT} precision; anything handed back to
 * callers is rounded to 2 decimal places with HALF_UP.
 */
public final class Money {

    public static final MathContext MATH_CONTEXT = new MathContext(16, RoundingMode.HALF_UP);
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    public static final BigDecimal TWELVE = BigDecimal.valueOf(12);

    private Money() {
    }

    public static BigDecimal round(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal nonNegative(BigDecimal value) {
        return value.signum() < 0 ? BigDecimal.ZERO : value;
    }

    /**
     * (1 + rate)^years, with years below zero treated as zero.
     */
    public static BigDecimal growthFactor(BigDecimal rate, int years) {
        if (years <= 0) {
            return BigDecimal.ONE;
        }
        return BigDecimal.ONE.add(rate, MATH_CONTEXT).pow(years, MATH_CONTEXT);
    }

    /**
     * Divides without ever throwing: a zero divisor yields zero.
     */
    public static BigDecimal safeDivide(BigDecimal dividend, BigDecimal divisor) {
        if (divisor.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return dividend.divide(divisor, MATH_CONTEXT);
    }

    public static BigDecimal percentOf(BigDecimal amount, BigDecimal percent) {
        return amount.multiply(percent, MATH_CONTEXT).divide(HUNDRED, MATH_CONTEXT);
    }

    /**
     * Compact currency text used in insight messages: $1.2M, $45K, $900.
     */
    public static String formatCompact(BigDecimal value) {
        BigDecimal abs = value.abs();
        if (abs.compareTo(BigDecimal.valueOf(1_000_000)) >= 0) {
            return "$" + value.divide(BigDecimal.valueOf(1_000_000), MATH_CONTEXT).setScale(1, RoundingMode.HALF_UP).toPlainString() + "M";
        }
        if (abs.compareTo(BigDecimal.valueOf(1_000)) >= 0) {
            return "$" + value.divide(BigDecimal.valueOf(1_000), MATH_CONTEXT).setScale(0, RoundingMode.HALF_UP).toPlainString() + "K";
        }
        return "$" + value.setScale(0, RoundingMode.HALF_UP).toPlainString();
    }

    /**
     * Whole-dollar currency text with thousands separators: $1,234.
     */
    public static String formatWhole(BigDecimal value) {
        return String.format("$%,d", value.setScale(0, RoundingMode.HALF_UP).longValue());
    }
}
