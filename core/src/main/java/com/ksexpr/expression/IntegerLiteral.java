package com.ksexpr.expression;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Non-negative integer literal of arbitrary size.
 *
 * <p>Negative numbers are represented as {@code UnaryExpression.negate(...)}
 * around a positive literal.
 */
public final class IntegerLiteral implements Expression {

    private final BigInteger value;

    /**
     * Creates an integer literal.
     *
     * @param value the value, must not be negative
     * @throws IllegalArgumentException if the value is negative
     */
    public IntegerLiteral(BigInteger value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException(
                "Integer literal must not be negative, got " + value);
        }
    }

    public BigInteger value() {
        return value;
    }

    @Override
    public String toKsy() {
        return value.toString();
    }

    @Override
    public String toString() {
        return toKsy();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IntegerLiteral)) return false;
        IntegerLiteral that = (IntegerLiteral) obj;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    // ==================== Factory Methods ====================

    public static IntegerLiteral of(long value) {
        return new IntegerLiteral(BigInteger.valueOf(value));
    }

    public static IntegerLiteral of(BigInteger value) {
        return new IntegerLiteral(value);
    }
}
