package com.ksexpr.generator;

import com.ksexpr.exception.ExpressionRenderException;
import com.ksexpr.expression.Expression;
import com.ksexpr.expression.ExpressionUtils;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders expression trees as Kaitai Struct expression language text.
 *
 * <p>This is the entry point for callers that build trees for computed
 * fields, conditions or sizes and need the exact text to put in a
 * {@code .ksy} file. Rendering itself is done by the nodes
 * ({@link Expression#toKsy()}); the translator adds argument checks, the
 * optional depth limit and logging.
 *
 * <p>Instances hold no mutable state and may be shared between threads.
 *
 * <p>Example usage:
 * <pre>
 *   Expression expr = SubscriptExpression.of(
 *       AttributeAccess.of(NameReference.of("cont"), "items"),
 *       IntegerLiteral.of(0));
 *   String ksy = new ExpressionTranslator().translate(expr);   // "cont.items[0]"
 * </pre>
 */
public class ExpressionTranslator {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionTranslator.class);

    private final TranslatorConfig config;

    /**
     * Creates a translator configured from system properties.
     */
    public ExpressionTranslator() {
        this(TranslatorConfig.fromSystemProperties());
    }

    /**
     * Creates a translator with the given configuration.
     *
     * @param config the configuration
     */
    public ExpressionTranslator(TranslatorConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        logger.debug("ExpressionTranslator created: {}", config);
    }

    public TranslatorConfig config() {
        return config;
    }

    /**
     * Renders an expression tree.
     *
     * <p>The same tree always renders to the same text.
     *
     * @param expr the root of the tree
     * @return the rendered expression
     * @throws NullPointerException if expr is null
     * @throws ExpressionRenderException if the tree exceeds the depth limit or
     *         contains a string literal with a single quote
     */
    public String translate(Expression expr) {
        Objects.requireNonNull(expr, "expr must not be null");

        if (config.hasDepthLimit() && ExpressionUtils.exceedsDepth(expr, config.maxDepth())) {
            logger.error("Expression tree too deep: maxDepth={}", config.maxDepth());
            throw new ExpressionRenderException(
                "expression tree depth exceeds limit " + config.maxDepth(), expr);
        }

        try {
            String result = expr.toKsy();
            logger.debug("Translated {} -> {}", expr.getClass().getSimpleName(), result);
            return result;
        } catch (ExpressionRenderException e) {
            logger.error("Failed to translate expression: {}", e.getMessage());
            throw e;
        }
    }
}
