package com.phillippitts.shato.util;

import java.math.BigDecimal;

/** Renders numbers the way users expect to read them back: no trailing {@code .0}. */
public final class NumberFormats {

    private NumberFormats() {
        // Utility class - prevent instantiation
    }

    /**
     * Formats a number without exponent and without a fractional part when it is integral.
     *
     * <p>Examples: {@code 5.0 -> "5"}, {@code 10.5 -> "10.5"}, {@code -3 -> "-3"}.
     *
     * @param value number to format (nullable)
     * @return plain representation, {@code "null"} for null
     */
    public static String plain(Number value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (!Double.isFinite(d)) {
                return String.valueOf(d);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (value instanceof BigDecimal big) {
            return big.stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }
}
