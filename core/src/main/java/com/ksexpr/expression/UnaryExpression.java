package com.ksexpr.expression;

import java.util.Objects;

/**
 * Expression representing a prefix unary operation.
 *
 * <p>Unary expressions include:
 * <ul>
 *   <li>Arithmetic negation: -a</li>
 *   <li>Logical negation: not a</li>
 *   <li>Bitwise inversion: ~a</li>
 * </ul>
 *
 * <p>The result is always parenthesized: {@code (-3)}, {@code (not false)},
 * {@code (~mask)}.
 */
public final class UnaryExpression implements Expression {

    /**
     * Unary operators.
     */
    public enum Operator {
        NEGATE("-", "negation"),
        NOT("not ", "logical NOT"),
        INVERT("~", "bitwise NOT");

        private final String symbol;
        private final String description;

        Operator(String symbol, String description) {
            this.symbol = symbol;
            this.description = description;
        }

        /**
         * Returns the token written before the operand, including the
         * trailing space for word operators.
         */
        public String symbol() {
            return symbol;
        }

        public String description() {
            return description;
        }
    }

    private final Operator operator;
    private final Expression operand;

    /**
     * Creates a unary expression.
     *
     * @param operator the operator
     * @param operand the operand
     */
    public UnaryExpression(Operator operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    public Operator operator() {
        return operator;
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public String toKsy() {
        return "(" + operator.symbol() + operand.toKsy() + ")";
    }

    @Override
    public String toString() {
        return "UnaryExpression[" + operator.description() + "](" + operator.symbol() + operand + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnaryExpression)) return false;
        UnaryExpression that = (UnaryExpression) obj;
        return operator == that.operator &&
               Objects.equals(operand, that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    // ==================== Factory Methods ====================

    public static UnaryExpression negate(Expression operand) {
        return new UnaryExpression(Operator.NEGATE, operand);
    }

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(Operator.NOT, operand);
    }

    public static UnaryExpression invert(Expression operand) {
        return new UnaryExpression(Operator.INVERT, operand);
    }
}
