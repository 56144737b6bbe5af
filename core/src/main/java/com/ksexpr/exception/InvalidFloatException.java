package com.ksexpr.exception;

import com.ksexpr.types.InvalidFloatError;
import java.util.Objects;

/**
 * Exception thrown when a raw {@code double} cannot be used as a float literal.
 *
 * <p>This is a recoverable failure: the caller decides whether to substitute
 * another value, rewrite the literal (e.g. wrap the magnitude in a negation)
 * or report it to the user.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       literal = FloatLiteral.of(raw);
 *   } catch (InvalidFloatException e) {
 *       if (e.getError() == InvalidFloatError.NEGATIVE) {
 *           literal = UnaryExpression.negate(FloatLiteral.of(-raw));
 *       }
 *   }
 * </pre>
 *
 * @see com.ksexpr.types.PositiveFiniteDouble
 */
public class InvalidFloatException extends IllegalArgumentException {

    private final InvalidFloatError error;
    private final double rejectedValue;

    /**
     * Creates an invalid float exception.
     *
     * @param error the classification of the failure
     * @param rejectedValue the raw value that was rejected
     */
    public InvalidFloatException(InvalidFloatError error, double rejectedValue) {
        super("Invalid float literal " + rejectedValue + ": "
            + Objects.requireNonNull(error, "error must not be null").description());
        this.error = error;
        this.rejectedValue = rejectedValue;
    }

    /**
     * Returns why the value was rejected.
     *
     * @return the error classification
     */
    public InvalidFloatError getError() {
        return error;
    }

    /**
     * Returns the raw value that was rejected.
     *
     * @return the rejected value
     */
    public double getRejectedValue() {
        return rejectedValue;
    }
}
