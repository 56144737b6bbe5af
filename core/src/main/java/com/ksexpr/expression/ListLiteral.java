package com.ksexpr.expression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing a list literal.
 *
 * <p>Form: {@code [elem1, elem2, elem3]}. Elements may be any expression,
 * including other lists.
 */
public final class ListLiteral implements Expression {

    private final List<Expression> elements;

    /**
     * Creates a list literal.
     *
     * @param elements the list elements (may be empty)
     */
    public ListLiteral(List<? extends Expression> elements) {
        Objects.requireNonNull(elements, "elements must not be null");
        for (Expression element : elements) {
            Objects.requireNonNull(element, "elements must not contain null");
        }
        this.elements = new ArrayList<>(elements);
    }

    /**
     * Returns the list elements.
     *
     * @return an unmodifiable list of element expressions
     */
    public List<Expression> elements() {
        return Collections.unmodifiableList(elements);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * Generates the list literal.
     *
     * @return string in the form "[elem1, elem2, ...]"
     */
    @Override
    public String toKsy() {
        String elementsKsy = elements.stream()
            .map(Expression::toKsy)
            .collect(Collectors.joining(", "));
        return "[" + elementsKsy + "]";
    }

    @Override
    public String toString() {
        return "ListLiteral" + elements;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ListLiteral)) return false;
        ListLiteral that = (ListLiteral) obj;
        return elements.equals(that.elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    public static ListLiteral of(Expression... elements) {
        return new ListLiteral(Arrays.asList(elements));
    }
}
