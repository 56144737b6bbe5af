package com.ksexpr.exception;

import com.ksexpr.expression.Expression;

/**
 * Exception thrown when an expression tree cannot be rendered.
 *
 * <p>This signals a defect upstream of the renderer, not a condition to
 * recover from: the tree should have been rejected before it got here.
 *
 * <p>Causes:
 * <ul>
 *   <li>A string literal containing a single quote, which the target grammar
 *       has no way to express</li>
 *   <li>A tree deeper than the configured depth limit</li>
 * </ul>
 *
 * @see com.ksexpr.generator.ExpressionTranslator
 */
public class ExpressionRenderException extends RuntimeException {

    private final Expression failedExpression;

    /**
     * Creates a render exception.
     *
     * @param message the error message
     * @param expression the expression that failed to render
     */
    public ExpressionRenderException(String message, Expression expression) {
        super(message + " (expression type: " + typeName(expression) + ")");
        this.failedExpression = expression;
    }

    /**
     * Returns the expression that failed to render.
     *
     * @return the failed expression, or null if not available
     */
    public Expression getFailedExpression() {
        return failedExpression;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        switch (typeName(failedExpression)) {
            case "StringLiteral":
                return "Failed to render a string literal: single-quoted strings cannot "
                    + "contain a single quote. Validate string values before building "
                    + "the expression tree.";

            default:
                return "Failed to render expression: " + getMessage();
        }
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Expression Rendering Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedExpression != null) {
            sb.append("Failed Expression Type: ").append(failedExpression.getClass().getName()).append("\n");
            sb.append("Expression: ").append(failedExpression).append("\n");
        }

        return sb.toString();
    }

    private static String typeName(Expression expression) {
        return expression != null ? expression.getClass().getSimpleName() : "null";
    }
}
