package com.ksexpr.expression;

import java.util.Objects;

/**
 * Indexing expression: {@code value[index]}.
 *
 * <p>Examples:
 * <pre>
 *   cont.items[0]
 *   [[1, 300], [(-1), 1]]['1'.to_i][0]
 * </pre>
 *
 * <p>Indices are 0-based in the target language and are passed through as given.
 */
public final class SubscriptExpression implements Expression {

    private final Expression value;
    private final Expression index;

    /**
     * Creates a subscript expression.
     *
     * @param value the indexed container
     * @param index the index
     */
    public SubscriptExpression(Expression value, Expression index) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.index = Objects.requireNonNull(index, "index must not be null");
    }

    public Expression value() {
        return value;
    }

    public Expression index() {
        return index;
    }

    @Override
    public String toKsy() {
        return value.toKsy() + "[" + index.toKsy() + "]";
    }

    @Override
    public String toString() {
        return "SubscriptExpression(" + value + "[" + index + "])";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SubscriptExpression)) return false;
        SubscriptExpression that = (SubscriptExpression) obj;
        return value.equals(that.value) && index.equals(that.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, index);
    }

    public static SubscriptExpression of(Expression value, Expression index) {
        return new SubscriptExpression(value, index);
    }
}
