package com.ksexpr.expression;

/**
 * Base interface for all nodes of a Kaitai Struct expression tree.
 *
 * <p>Expressions describe values computed by a structure description, such as:
 * <ul>
 *   <li>Literals (integers, floats, strings, booleans, lists, enum members)</li>
 *   <li>Names and attribute or method access ({@code _io.eof}, {@code s.substring(2, 7)})</li>
 *   <li>Unary, binary and conditional operations</li>
 *   <li>Indexing ({@code items[0]})</li>
 * </ul>
 *
 * <p>A tree owns its children exclusively and never changes after
 * construction, so it can be rendered any number of times, from any thread.
 * All implementations in this package are {@code final}.
 */
public interface Expression {

    /**
     * Converts this expression to Kaitai Struct expression language syntax.
     *
     * <p>Unary, binary and conditional expressions are always parenthesized,
     * whatever their context, so the output never depends on operator precedence.
     *
     * @return the rendered expression
     * @throws com.ksexpr.exception.ExpressionRenderException if the tree
     *         contains a value the grammar cannot express
     */
    String toKsy();
}
