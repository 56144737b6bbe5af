package com.ksexpr.generator;

/**
 * Settings for {@link ExpressionTranslator}.
 *
 * <p>Rendering recurses once per tree level. By default there is no depth
 * limit and callers building very deep trees are responsible for bounding
 * them. Setting a limit makes the translator reject deeper trees with an
 * {@link com.ksexpr.exception.ExpressionRenderException} before rendering.
 *
 * <p>System properties:
 * <ul>
 *   <li>{@code ksexpr.translator.maxDepth} - maximum tree depth, a positive
 *       integer; anything else means unlimited</li>
 * </ul>
 */
public final class TranslatorConfig {

    public static final String PROP_MAX_DEPTH = "ksexpr.translator.maxDepth";

    /** Depth limit value meaning "no limit". */
    public static final int UNLIMITED_DEPTH = 0;

    private static final TranslatorConfig DEFAULTS = new TranslatorConfig(UNLIMITED_DEPTH);

    private final int maxDepth;

    private TranslatorConfig(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Returns the default configuration: no depth limit.
     *
     * @return the defaults
     */
    public static TranslatorConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Reads the configuration from system properties, falling back to the
     * defaults for missing or invalid values.
     *
     * @return the configuration
     */
    public static TranslatorConfig fromSystemProperties() {
        return new TranslatorConfig(getConfiguredMaxDepth());
    }

    /**
     * Returns a copy with the given depth limit.
     *
     * @param maxDepth the maximum depth, or {@link #UNLIMITED_DEPTH}
     * @return the new configuration
     * @throws IllegalArgumentException if maxDepth is negative
     */
    public TranslatorConfig withMaxDepth(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        return new TranslatorConfig(maxDepth);
    }

    public int maxDepth() {
        return maxDepth;
    }

    public boolean hasDepthLimit() {
        return maxDepth != UNLIMITED_DEPTH;
    }

    @Override
    public String toString() {
        return "TranslatorConfig{maxDepth=" + (hasDepthLimit() ? maxDepth : "unlimited") + "}";
    }

    private static int getConfiguredMaxDepth() {
        String value = System.getProperty(PROP_MAX_DEPTH);
        if (value != null) {
            try {
                int depth = Integer.parseInt(value.trim());
                if (depth > 0) {
                    return depth;
                }
            } catch (NumberFormatException e) {
                // Ignore, use default
            }
        }
        return UNLIMITED_DEPTH;
    }
}
