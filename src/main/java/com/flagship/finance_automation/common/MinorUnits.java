package com.flagship.finance_automation.common;

import java.math.BigDecimal;

/**
 * Conversions between decimal major-unit amounts (as returned by bank APIs)
 * and the integer minor units used everywhere inside the service.
 *
 * All currencies handled here have two decimal places.
 */
public final class MinorUnits {

    private static final int SCALE = 2;

    private MinorUnits() {
        // Utility class
    }

    /**
     * Converts a major-unit amount to minor units.
     *
     * @throws ArithmeticException if the amount has more than two decimal places
     *                             or does not fit in a long
     */
    public static long fromMajor(BigDecimal majorUnits) {
        if (majorUnits == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return majorUnits.movePointRight(SCALE).longValueExact();
    }

    /**
     * Formats minor units as a plain major-unit string, e.g. 12345 -> "123.45".
     */
    public static String toMajorString(long minorUnits) {
        return BigDecimal.valueOf(minorUnits, SCALE).toPlainString();
    }
}
