package com.ksexpr.generator;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Formats non-negative finite doubles as float literals.
 *
 * <p>Formatting policy:
 * <ul>
 *   <li>Zero, and values in {@code [1e-4, 1e16)}, use plain decimal notation:
 *       {@code 0.0001}, {@code 3.141592653589793}, {@code 9999999999999998.0}</li>
 *   <li>All other values use exponential notation without a {@code +} sign:
 *       {@code 1e16}, {@code 9.999999999999999e-5}, {@code 5e-324}</li>
 *   <li>Digits are the shortest decimal that parses back to the same double</li>
 *   <li>A result made only of digits gets a {@code .0} suffix, so that a
 *       whole-valued float is never read back as an integer literal</li>
 * </ul>
 *
 * <p>{@link Double#toString(double)} is not used for the digits because on
 * JDK 17 it does not always produce the shortest form ({@code 4.9E-324}
 * instead of {@code 5e-324}).
 */
public final class FloatLiteralFormatter {

    /** Smallest magnitude written in plain notation (inclusive). */
    static final double PLAIN_LOWER_BOUND = 1e-4;

    /** Largest magnitude written in plain notation (exclusive). */
    static final double PLAIN_UPPER_BOUND = 1e16;

    /** 17 significant digits always identify a double. */
    private static final int MAX_SIGNIFICANT_DIGITS = 17;

    private FloatLiteralFormatter() {}

    /**
     * Formats a float literal.
     *
     * @param value a finite value with a positive sign bit
     * @return the literal text
     * @throws IllegalArgumentException if the value is not finite or is negative
     */
    public static String format(double value) {
        if (!Double.isFinite(value) || Double.doubleToRawLongBits(value) < 0) {
            throw new IllegalArgumentException("Cannot format float literal " + value);
        }

        String formatted = useExponent(value) ? toExponential(value) : toPlain(value);
        if (isAllDigits(formatted)) {
            return formatted + ".0";
        }
        return formatted;
    }

    /**
     * Returns whether a value is written in exponential notation.
     *
     * @param value a non-negative finite value
     * @return true outside {@code [1e-4, 1e16)}, false for zero
     */
    public static boolean useExponent(double value) {
        if (value == 0.0) {
            return false;
        }
        return !(value >= PLAIN_LOWER_BOUND && value < PLAIN_UPPER_BOUND);
    }

    /**
     * Shortest plain decimal form, without a forced fractional part.
     * {@code 13.0} gives {@code "13"}, {@code 0.0001} gives {@code "0.0001"}.
     */
    static String toPlain(double value) {
        if (value == 0.0) {
            return "0";
        }
        return shortestDecimal(value).toPlainString();
    }

    /**
     * Shortest exponential form: {@code <digit>[.<digits>]e<exponent>}.
     */
    static String toExponential(double value) {
        if (value == 0.0) {
            return "0e0";
        }
        BigDecimal decimal = shortestDecimal(value);
        String digits = decimal.unscaledValue().toString();
        // value = digits * 10^-scale = d.ddd * 10^(digits.length - 1 - scale)
        int exponent = digits.length() - 1 - decimal.scale();

        StringBuilder sb = new StringBuilder(digits.length() + 8);
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent);
        return sb.toString();
    }

    /**
     * Finds the decimal with the fewest significant digits that parses back to
     * {@code value}. Among candidates of that length, the one nearest the
     * exact binary value wins.
     *
     * @param value a positive finite value
     * @return the shortest decimal, with trailing zeros stripped
     */
    static BigDecimal shortestDecimal(double value) {
        BigDecimal exact = new BigDecimal(value);
        for (int precision = 1; precision < MAX_SIGNIFICANT_DIGITS; precision++) {
            // HALF_EVEN is the nearest candidate; DOWN and UP cover the case where
            // only the farther neighbour still falls inside the rounding interval
            BigDecimal nearest = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (roundTrips(nearest, value)) {
                return nearest.stripTrailingZeros();
            }
            BigDecimal down = exact.round(new MathContext(precision, RoundingMode.DOWN));
            BigDecimal up = exact.round(new MathContext(precision, RoundingMode.UP));
            boolean downOk = roundTrips(down, value);
            boolean upOk = roundTrips(up, value);
            if (downOk && upOk) {
                BigDecimal closer = exact.subtract(down).compareTo(up.subtract(exact)) <= 0 ? down : up;
                return closer.stripTrailingZeros();
            }
            if (downOk) {
                return down.stripTrailingZeros();
            }
            if (upOk) {
                return up.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(MAX_SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN))
            .stripTrailingZeros();
    }

    private static boolean roundTrips(BigDecimal candidate, double value) {
        return Double.parseDouble(candidate.toString()) == value;
    }

    private static boolean isAllDigits(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch < '0' || ch > '9') {
                return false;
            }
        }
        return true;
    }
}
