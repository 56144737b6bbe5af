package com.ksexpr.types;

import com.ksexpr.exception.InvalidFloatException;
import java.util.Optional;

/**
 * A {@code double} guaranteed finite and non-negative by construction.
 *
 * <p>Float literals in an expression tree never carry a sign: a negative
 * magnitude is a {@code NEGATE} unary expression wrapping a positive literal.
 * This type makes the positive half the only one that can be built.
 *
 * <p>Validation happens once, in {@link #of(double)}:
 * <ul>
 *   <li>NaN (either sign) and both infinities fail with {@link InvalidFloatError#NON_FINITE}</li>
 *   <li>anything with the sign bit set fails with {@link InvalidFloatError#NEGATIVE},
 *       so {@code -0.0} is rejected even though it compares equal to {@code 0.0}</li>
 * </ul>
 * The finiteness check runs first, so a negative NaN reports {@code NON_FINITE}.
 *
 * <p>Equality and hashing use the raw bit pattern. Since NaN and negative zero
 * can never be stored, this agrees with numeric equality and the ordering from
 * {@link #compareTo} is total.
 */
public final class PositiveFiniteDouble implements Comparable<PositiveFiniteDouble> {

    private final double value;

    private PositiveFiniteDouble(double value) {
        this.value = value;
    }

    /**
     * Wraps a raw double.
     *
     * @param value the raw value
     * @return the wrapped value
     * @throws InvalidFloatException if the value is not finite or is negative
     */
    public static PositiveFiniteDouble of(double value) {
        Optional<InvalidFloatError> error = check(value);
        if (error.isPresent()) {
            throw new InvalidFloatException(error.get(), value);
        }
        return new PositiveFiniteDouble(value);
    }

    /**
     * Classifies a raw double without throwing.
     *
     * @param value the raw value
     * @return the reason it would be rejected, or empty if {@link #of(double)} accepts it
     */
    public static Optional<InvalidFloatError> check(double value) {
        if (!Double.isFinite(value)) {
            return Optional.of(InvalidFloatError.NON_FINITE);
        }
        // sign bit, not "< 0": catches -0.0
        if (Double.doubleToRawLongBits(value) < 0) {
            return Optional.of(InvalidFloatError.NEGATIVE);
        }
        return Optional.empty();
    }

    /**
     * Returns the wrapped value exactly as it was passed in.
     *
     * @return the value
     */
    public double value() {
        return value;
    }

    @Override
    public int compareTo(PositiveFiniteDouble other) {
        return Double.compare(value, other.value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PositiveFiniteDouble)) return false;
        PositiveFiniteDouble that = (PositiveFiniteDouble) obj;
        return Double.doubleToRawLongBits(value) == Double.doubleToRawLongBits(that.value);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(Double.doubleToRawLongBits(value));
    }

    @Override
    public String toString() {
        return "PositiveFiniteDouble(" + value + ")";
    }
}
