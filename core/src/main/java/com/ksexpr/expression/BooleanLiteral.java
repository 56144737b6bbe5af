package com.ksexpr.expression;

/**
 * Boolean literal, rendered {@code true} or {@code false}.
 */
public final class BooleanLiteral implements Expression {

    public static final BooleanLiteral TRUE = new BooleanLiteral(true);
    public static final BooleanLiteral FALSE = new BooleanLiteral(false);

    private final boolean value;

    private BooleanLiteral(boolean value) {
        this.value = value;
    }

    public boolean value() {
        return value;
    }

    @Override
    public String toKsy() {
        return Boolean.toString(value);
    }

    @Override
    public String toString() {
        return toKsy();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BooleanLiteral)) return false;
        return value == ((BooleanLiteral) obj).value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }

    public static BooleanLiteral of(boolean value) {
        return value ? TRUE : FALSE;
    }
}
