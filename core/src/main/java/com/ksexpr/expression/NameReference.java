package com.ksexpr.expression;

import java.util.Objects;

/**
 * Reference to a named value in scope: a field, an instance, a parameter or
 * one of the built-ins such as {@code _io}, {@code _parent} or {@code _root}.
 *
 * <p>The name is rendered verbatim.
 */
public final class NameReference implements Expression {

    private final String name;

    public NameReference(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String name() {
        return name;
    }

    @Override
    public String toKsy() {
        return name;
    }

    @Override
    public String toString() {
        return toKsy();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NameReference)) return false;
        return name.equals(((NameReference) obj).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    public static NameReference of(String name) {
        return new NameReference(name);
    }
}
