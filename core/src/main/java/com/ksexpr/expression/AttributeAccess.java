package com.ksexpr.expression;

import java.util.Objects;

/**
 * Field or property access on a value.
 *
 * <p>Examples:
 * <pre>
 *   _io.eof
 *   0.to_s
 *   (-3).to_s                -- the negation renders its own parentheses
 *   record_types::uint64.to_i
 * </pre>
 *
 * <p>No parentheses are added around the base; nodes that need them
 * (unary, binary, conditional) always render their own.
 */
public final class AttributeAccess implements Expression {

    private final Expression value;
    private final String attributeName;

    /**
     * Creates an attribute access.
     *
     * @param value the expression the attribute is read from
     * @param attributeName the attribute identifier
     */
    public AttributeAccess(Expression value, String attributeName) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.attributeName = Objects.requireNonNull(attributeName, "attributeName must not be null");
    }

    public Expression value() {
        return value;
    }

    public String attributeName() {
        return attributeName;
    }

    @Override
    public String toKsy() {
        return value.toKsy() + "." + attributeName;
    }

    @Override
    public String toString() {
        return "AttributeAccess(" + value + "." + attributeName + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AttributeAccess)) return false;
        AttributeAccess that = (AttributeAccess) obj;
        return value.equals(that.value) && attributeName.equals(that.attributeName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, attributeName);
    }

    public static AttributeAccess of(Expression value, String attributeName) {
        return new AttributeAccess(value, attributeName);
    }
}
