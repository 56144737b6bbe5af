package com.ksexpr.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Utility methods for walking and inspecting expression trees.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Returns the direct children of an expression, in the order they are rendered.
     *
     * @param expr the expression
     * @return the children, empty for literals and names
     */
    public static List<Expression> children(Expression expr) {
        if (expr instanceof ListLiteral list) {
            return list.elements();
        }
        if (expr instanceof AttributeAccess attr) {
            return List.of(attr.value());
        }
        if (expr instanceof MethodCall call) {
            List<Expression> result = new ArrayList<>(call.arguments().size() + 1);
            result.add(call.value());
            result.addAll(call.arguments());
            return Collections.unmodifiableList(result);
        }
        if (expr instanceof UnaryExpression unary) {
            return List.of(unary.operand());
        }
        if (expr instanceof BinaryExpression bin) {
            return List.of(bin.left(), bin.right());
        }
        if (expr instanceof ConditionalExpression cond) {
            return List.of(cond.condition(), cond.ifTrue(), cond.ifFalse());
        }
        if (expr instanceof SubscriptExpression sub) {
            return List.of(sub.value(), sub.index());
        }
        // IntegerLiteral, FloatLiteral, StringLiteral, BooleanLiteral,
        // EnumMemberReference, NameReference
        return List.of();
    }

    /**
     * Returns the depth of an expression tree. A leaf has depth 1.
     *
     * @param expr the root expression
     * @return the number of nodes on the longest root-to-leaf path
     */
    public static int depth(Expression expr) {
        int deepestChild = 0;
        for (Expression child : children(expr)) {
            deepestChild = Math.max(deepestChild, depth(child));
        }
        return deepestChild + 1;
    }

    /**
     * Returns whether an expression tree is deeper than {@code limit}.
     *
     * <p>Unlike {@link #depth(Expression)}, the walk stops descending once it
     * passes the limit, so the recursion is bounded by {@code limit} rather than
     * by the tree. Use this to reject trees too deep to render safely.
     *
     * @param expr the root expression
     * @param limit the maximum allowed depth, at least 1
     * @return true if some root-to-leaf path has more than {@code limit} nodes
     * @throws IllegalArgumentException if limit is less than 1
     */
    public static boolean exceedsDepth(Expression expr, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        return !fitsWithin(expr, limit);
    }

    private static boolean fitsWithin(Expression expr, int remaining) {
        if (remaining == 0) {
            return false;
        }
        for (Expression child : children(expr)) {
            if (!fitsWithin(child, remaining - 1)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Finds the first string literal that cannot be rendered, searching
     * depth-first, left to right.
     *
     * <p>Run this on trees built from user input before handing them to the
     * translator, which treats such literals as a fatal error.
     *
     * @param expr the root expression
     * @return the offending literal, or empty if every string can be rendered
     */
    public static Optional<StringLiteral> findUnrepresentableString(Expression expr) {
        if (expr instanceof StringLiteral str) {
            return StringLiteral.isRepresentable(str.value()) ? Optional.empty() : Optional.of(str);
        }
        for (Expression child : children(expr)) {
            Optional<StringLiteral> found = findUnrepresentableString(child);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }
}
