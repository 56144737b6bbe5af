package com.ksexpr.generator;

import com.ksexpr.test.TestBase;
import com.ksexpr.test.TestCategories;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for TranslatorConfig defaults and system property parsing.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("TranslatorConfig Tests")
public class TranslatorConfigTest extends TestBase {

    @AfterEach
    void clearProperty() {
        System.clearProperty(TranslatorConfig.PROP_MAX_DEPTH);
    }

    @Test
    @DisplayName("Defaults have no depth limit")
    void testDefaults() {
        TranslatorConfig config = TranslatorConfig.defaults();

        assertThat(config.maxDepth()).isEqualTo(TranslatorConfig.UNLIMITED_DEPTH);
        assertThat(config.hasDepthLimit()).isFalse();
    }

    @Test
    @DisplayName("Missing property means defaults")
    void testMissingProperty() {
        assertThat(TranslatorConfig.fromSystemProperties().hasDepthLimit()).isFalse();
    }

    @Test
    @DisplayName("Positive property value sets the limit")
    void testPropertySet() {
        System.setProperty(TranslatorConfig.PROP_MAX_DEPTH, " 64 ");

        TranslatorConfig config = TranslatorConfig.fromSystemProperties();
        assertThat(config.maxDepth()).isEqualTo(64);
        assertThat(config.hasDepthLimit()).isTrue();
        assertThat(new ExpressionTranslator().config().maxDepth()).isEqualTo(64);
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-5", "deep", ""})
    @DisplayName("Invalid property values fall back to unlimited")
    void testInvalidProperty(String value) {
        System.setProperty(TranslatorConfig.PROP_MAX_DEPTH, value);

        assertThat(TranslatorConfig.fromSystemProperties().maxDepth())
            .isEqualTo(TranslatorConfig.UNLIMITED_DEPTH);
    }

    @Test
    @DisplayName("withMaxDepth returns a new config")
    void testWithMaxDepth() {
        TranslatorConfig base = TranslatorConfig.defaults();
        TranslatorConfig limited = base.withMaxDepth(10);

        assertThat(limited.maxDepth()).isEqualTo(10);
        assertThat(base.hasDepthLimit()).isFalse();
        assertThat(limited.withMaxDepth(TranslatorConfig.UNLIMITED_DEPTH).hasDepthLimit()).isFalse();
        assertThat(limited.toString()).contains("maxDepth=10");
    }

    @Test
    @DisplayName("Negative limit is rejected")
    void testNegativeLimit() {
        assertThatThrownBy(() -> TranslatorConfig.defaults().withMaxDepth(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
