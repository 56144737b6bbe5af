package com.ksexpr.expression;

import com.ksexpr.exception.ExpressionRenderException;
import java.util.Objects;

/**
 * String literal, rendered single-quoted.
 *
 * <p>Kaitai Struct reads everything between single quotes literally: a
 * backslash or a double quote is just part of the text. The flip side is that
 * there is no way to put a single quote inside such a string, so a value
 * containing one cannot be rendered. Construction does not reject it; use
 * {@link #isRepresentable(String)} or
 * {@link ExpressionUtils#findUnrepresentableString(Expression)} to validate
 * before building the tree.
 */
public final class StringLiteral implements Expression {

    private static final char QUOTE = '\'';

    private final String value;

    /**
     * Creates a string literal.
     *
     * @param value the string value
     */
    public StringLiteral(String value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public String value() {
        return value;
    }

    /**
     * Returns whether the given text can be rendered as a string literal.
     *
     * @param value the text
     * @return false if it contains a single quote
     */
    public static boolean isRepresentable(String value) {
        return value.indexOf(QUOTE) < 0;
    }

    /**
     * Wraps the value in single quotes, without any escaping.
     *
     * @return the rendered literal
     * @throws ExpressionRenderException if the value contains a single quote
     */
    @Override
    public String toKsy() {
        if (!isRepresentable(value)) {
            throw new ExpressionRenderException(
                "strings containing a single quote (') not supported yet (got " + value + ")", this);
        }
        return QUOTE + value + QUOTE;
    }

    @Override
    public String toString() {
        return "StringLiteral(" + value + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof StringLiteral)) return false;
        StringLiteral that = (StringLiteral) obj;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    public static StringLiteral of(String value) {
        return new StringLiteral(value);
    }
}
