package com.ksexpr.expression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reference to a named enum constant, scoped by a type/enum path.
 *
 * <p>Examples:
 * <pre>
 *   some_type::port::http      -- enum "port" declared in type "some_type"
 *   record_types::uint64       -- top-level enum
 * </pre>
 */
public final class EnumMemberReference implements Expression {

    /** Separator between path segments and before the label. */
    public static final String SCOPE_SEPARATOR = "::";

    private final List<String> enumPath;
    private final String label;

    /**
     * Creates an enum member reference.
     *
     * @param enumPath the path to the enum, outermost segment first
     * @param label the enum member name
     */
    public EnumMemberReference(List<String> enumPath, String label) {
        Objects.requireNonNull(enumPath, "enumPath must not be null");
        for (String segment : enumPath) {
            Objects.requireNonNull(segment, "enumPath must not contain null segments");
        }
        this.enumPath = new ArrayList<>(enumPath);
        this.label = Objects.requireNonNull(label, "label must not be null");
    }

    /**
     * Returns the enum path.
     *
     * @return an unmodifiable list of path segments
     */
    public List<String> enumPath() {
        return Collections.unmodifiableList(enumPath);
    }

    public String label() {
        return label;
    }

    @Override
    public String toKsy() {
        List<String> parts = new ArrayList<>(enumPath);
        parts.add(label);
        return String.join(SCOPE_SEPARATOR, parts);
    }

    @Override
    public String toString() {
        return toKsy();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EnumMemberReference)) return false;
        EnumMemberReference that = (EnumMemberReference) obj;
        return enumPath.equals(that.enumPath) && label.equals(that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enumPath, label);
    }

    /**
     * Creates an enum member reference from a label and the path leading to it.
     *
     * @param label the member name
     * @param enumPath the path segments, outermost first
     * @return the enum member reference
     */
    public static EnumMemberReference of(String label, String... enumPath) {
        return new EnumMemberReference(Arrays.asList(enumPath), label);
    }
}
