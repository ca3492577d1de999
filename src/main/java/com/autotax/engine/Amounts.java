package com.autotax.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Null-tolerant BigDecimal helpers shared by the engine. Calculations stay exact;
 * {@link #display(BigDecimal)} rounds for notes only.
 */
public final class Amounts {

    private Amounts() {}

    public static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    public static BigDecimal nonNegative(BigDecimal value) {
        BigDecimal amount = orZero(value);
        return amount.signum() < 0 ? BigDecimal.ZERO : amount;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    /** Formats a dollar amount for debug notes, e.g. {@code $1200.00}. */
    public static String display(BigDecimal value) {
        return "$" + orZero(value).setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    /** Formats a rate fraction as a percentage for notes, e.g. 0.0625 becomes {@code 6.25%}. */
    public static String displayRate(BigDecimal rate) {
        return orZero(rate).movePointRight(2).stripTrailingZeros().toPlainString() + "%";
    }
}
