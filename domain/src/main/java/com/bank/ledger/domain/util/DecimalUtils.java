package com.bank.ledger.domain.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Exact decimal helpers shared by every accounting calculation.
 * Nothing in the ledger goes through float or double arithmetic.
 */
public final class DecimalUtils {

    /**
     * Precision used for divisions that do not terminate (28 significant digits)
     */
    public static final MathContext CONTEXT = new MathContext(28, RoundingMode.HALF_EVEN);

    private DecimalUtils() {
    }

    /**
     * Convert textual or numeric input to an exact decimal.
     * Doubles and floats are converted through their shortest string form, so 0.1 stays 0.1.
     *
     * @throws NumberFormatException if the input is not numeric
     */
    public static BigDecimal toDecimal(Object value) {
        if (value == null) {
            throw new NumberFormatException("null is not a number");
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Double || value instanceof Float) {
            return new BigDecimal(value.toString());
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        return new BigDecimal(value.toString().trim());
    }

    /**
     * Same as {@link #toDecimal(Object)} but treats null or blank input as the given default
     */
    public static BigDecimal toDecimalOrDefault(Object value, BigDecimal defaultValue) {
        if (value == null || value.toString().isBlank()) {
            return defaultValue;
        }
        return toDecimal(value);
    }

    /**
     * Divide, returning zero when the denominator is zero.
     * A zero result here means "no volume yet", not a literal zero average.
     */
    public static BigDecimal safeDivide(BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return numerator.divide(denominator, CONTEXT);
    }

    /**
     * Plain text rendering without exponent or trailing zeros
     */
    public static String toPlainText(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }
}
