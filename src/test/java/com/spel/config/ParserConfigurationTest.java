package com.spel.config;

import com.spel.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ParserConfiguration and ParserContext.
 */
class ParserConfigurationTest {

    @Test
    @DisplayName("Defaults")
    void defaults() {
        ParserConfiguration config = ParserConfiguration.defaults();

        assertEquals(10_000, config.maximumExpressionLength());
        assertFalse(config.autoGrowCollections());
        assertFalse(config.autoGrowNullReferences());
        assertEquals("#{", config.templatePrefix());
        assertEquals("}", config.templateSuffix());
    }

    @Test
    @DisplayName("withMaximumExpressionLength keeps the other settings")
    void withMaximumExpressionLength() {
        ParserConfiguration config = new ParserConfiguration(100, true, true, "${", "}")
                .withMaximumExpressionLength(7);

        assertEquals(new ParserConfiguration(7, true, true, "${", "}"), config);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, Integer.MIN_VALUE})
    @DisplayName("Non-positive maximum length is rejected")
    void nonPositiveLength(int length) {
        assertThrows(ConfigurationException.class,
                () -> ParserConfiguration.defaults().withMaximumExpressionLength(length));
    }

    @Test
    @DisplayName("Template delimiters must be non-empty")
    void emptyDelimiters() {
        assertThrows(ConfigurationException.class, () -> new ParserConfiguration(10, false, false, "", "}"));
        assertThrows(ConfigurationException.class, () -> new ParserConfiguration(10, false, false, "#{", null));
    }

    @Test
    @DisplayName("Template context carries the configured delimiters")
    void templateContext() {
        ParserContext context = new ParserConfiguration(10, false, false, "<%", "%>").templateContext();

        assertTrue(context.template());
        assertEquals("<%", context.expressionPrefix());
        assertEquals("%>", context.expressionSuffix());
    }

    @Test
    @DisplayName("Predefined parser contexts")
    void predefinedContexts() {
        assertFalse(ParserContext.STANDARD.template());
        assertTrue(ParserContext.TEMPLATE.template());
        assertEquals(ParserContext.TEMPLATE, ParserContext.template("#{", "}"));
    }
}
