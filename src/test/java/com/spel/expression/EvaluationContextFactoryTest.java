package com.spel.expression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EvaluationContextFactory and the default context.
 */
class EvaluationContextFactoryTest {

    private final SpelExpressionParser parser = new SpelExpressionParser();

    @Test
    @DisplayName("JSON object becomes the root object")
    void jsonRoot() {
        EvaluationContext context = EvaluationContextFactory.create(
                "{\"customer\":{\"tier\":\"GOLD\",\"orders\":[10,25,40]},\"active\":true}");

        assertEquals("GOLD", parser.parseExpression("customer.tier").getValue(context));
        assertEquals(List.of(25, 40), parser.parseExpression("customer.orders.?[#this > 20]").getValue(context));
        assertEquals(true, parser.parseExpression("active and customer.tier == 'GOLD'").getValue(context));
    }

    @Test
    @DisplayName("Variables are visible alongside the JSON root")
    void jsonWithVariables() {
        EvaluationContext context = EvaluationContextFactory.create("{\"amount\":120}", Map.of("limit", 100));

        assertEquals(true, parser.parseExpression("amount > #limit").getValue(context));
        assertEquals(100, context.getVariable("limit").orElseThrow());
    }

    @Test
    @DisplayName("Null or blank JSON gives a null root")
    void emptyPayload() {
        assertNull(EvaluationContextFactory.create(null).getRootObject());
        assertNull(EvaluationContextFactory.create("  ", null).getRootObject());
        assertTrue(EvaluationContextFactory.create(null).getVariables().isEmpty());
    }

    @Test
    @DisplayName("Invalid JSON is rejected")
    void invalidJson() {
        assertThrows(IllegalArgumentException.class, () -> EvaluationContextFactory.create("{not json"));
        assertThrows(IllegalArgumentException.class, () -> EvaluationContextFactory.create("[1, 2]"));
    }

    @Test
    @DisplayName("Built contexts are immutable snapshots")
    void immutableContext() {
        EvaluationContext context = EvaluationContext.builder().variable("a", 1).build();

        assertThrows(UnsupportedOperationException.class, () -> context.getVariables().put("b", 2));
        assertNotNull(context.getReferenceResolver());
        assertTrue(context.getVariable("b").isEmpty());
    }
}
