package com.ksexpr.expression;

import java.util.Objects;

/**
 * Ternary conditional: {@code (cond ? ifTrue : ifFalse)}.
 *
 * <p>Always parenthesized, like unary and binary expressions.
 */
public final class ConditionalExpression implements Expression {

    private final Expression condition;
    private final Expression ifTrue;
    private final Expression ifFalse;

    /**
     * Creates a conditional expression.
     *
     * @param condition the condition
     * @param ifTrue the value when the condition holds
     * @param ifFalse the value otherwise
     */
    public ConditionalExpression(Expression condition, Expression ifTrue, Expression ifFalse) {
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
        this.ifTrue = Objects.requireNonNull(ifTrue, "ifTrue must not be null");
        this.ifFalse = Objects.requireNonNull(ifFalse, "ifFalse must not be null");
    }

    public Expression condition() {
        return condition;
    }

    public Expression ifTrue() {
        return ifTrue;
    }

    public Expression ifFalse() {
        return ifFalse;
    }

    @Override
    public String toKsy() {
        return String.format("(%s ? %s : %s)", condition.toKsy(), ifTrue.toKsy(), ifFalse.toKsy());
    }

    @Override
    public String toString() {
        return String.format("ConditionalExpression(%s ? %s : %s)", condition, ifTrue, ifFalse);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ConditionalExpression)) return false;
        ConditionalExpression that = (ConditionalExpression) obj;
        return condition.equals(that.condition) &&
               ifTrue.equals(that.ifTrue) &&
               ifFalse.equals(that.ifFalse);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, ifTrue, ifFalse);
    }

    public static ConditionalExpression of(Expression condition, Expression ifTrue, Expression ifFalse) {
        return new ConditionalExpression(condition, ifTrue, ifFalse);
    }
}
