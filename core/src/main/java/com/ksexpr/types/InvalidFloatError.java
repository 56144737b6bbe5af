package com.ksexpr.types;

/**
 * Reasons a raw {@code double} cannot become a {@link PositiveFiniteDouble}.
 */
public enum InvalidFloatError {

    /** The sign bit is set, including negative zero. */
    NEGATIVE("value must not be negative"),

    /** NaN of either sign, or an infinity. */
    NON_FINITE("value must be finite");

    private final String description;

    InvalidFloatError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
