package org.pragmatica.arbor.print;

import java.math.BigDecimal;

/**
 * Canonical text of numeric literals.
 */
final class Literals {
    private static final double PLAIN_LOWER = 1e-3;
    private static final double PLAIN_UPPER = 1e7;
    private static final String ZERO = "0.0";

    private Literals() {}

    static String integer(long value) {
        return Long.toString(value);
    }

    /**
     * Always at least one digit on each side of the point, never exponent notation.
     * Negative zero prints as {@code 0.0}.
     */
    static String floating(double value) {
        if (value == 0.0) {
            return ZERO;
        }
        var magnitude = Math.abs(value);
        if (magnitude >= PLAIN_LOWER && magnitude < PLAIN_UPPER) {
            return Double.toString(value);
        }
        var plain = BigDecimal.valueOf(value)
                              .stripTrailingZeros()
                              .toPlainString();
        return plain.indexOf('.') < 0
               ? plain + ".0"
               : plain;
    }
}
