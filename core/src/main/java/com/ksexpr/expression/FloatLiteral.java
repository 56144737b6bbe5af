package com.ksexpr.expression;

import com.ksexpr.generator.FloatLiteralFormatter;
import com.ksexpr.types.PositiveFiniteDouble;
import java.util.Objects;

/**
 * Floating-point literal.
 *
 * <p>The value is always finite and non-negative, see {@link PositiveFiniteDouble}.
 * Rendering follows {@link FloatLiteralFormatter}: the output always contains a
 * {@code .} or an exponent, so it never reads back as an integer.
 */
public final class FloatLiteral implements Expression {

    private final PositiveFiniteDouble value;

    /**
     * Creates a float literal.
     *
     * @param value the validated value
     */
    public FloatLiteral(PositiveFiniteDouble value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public PositiveFiniteDouble value() {
        return value;
    }

    @Override
    public String toKsy() {
        return FloatLiteralFormatter.format(value.value());
    }

    @Override
    public String toString() {
        return toKsy();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FloatLiteral)) return false;
        FloatLiteral that = (FloatLiteral) obj;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a float literal from a raw double.
     *
     * @param value the raw value
     * @return the literal expression
     * @throws com.ksexpr.exception.InvalidFloatException if the value is not finite or is negative
     */
    public static FloatLiteral of(double value) {
        return new FloatLiteral(PositiveFiniteDouble.of(value));
    }
}
