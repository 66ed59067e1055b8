package com.spel.expression;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Factory for creating an EvaluationContext from a JSON payload and a variable map.
 * The parsed JSON object becomes the root object, so nested objects are reached with
 * property chains (e.g. {"customer":{"tier":"GOLD"}} is read by {@code customer.tier}).
 */
public class EvaluationContextFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private EvaluationContextFactory() {
    }

    /**
     * Create an EvaluationContext from a JSON payload.
     *
     * @param jsonPayload JSON object text; null or blank gives a null root
     * @return EvaluationContext with the parsed root object
     */
    public static EvaluationContext create(String jsonPayload) {
        return create(jsonPayload, null);
    }

    /**
     * Create an EvaluationContext from a JSON payload and variables.
     *
     * @param jsonPayload JSON object text; null or blank gives a null root
     * @param variables   Variables visible as {@code #name} - can be null
     * @return EvaluationContext with the parsed root object and variables
     */
    public static EvaluationContext create(String jsonPayload, Map<String, Object> variables) {
        EvaluationContext.Builder builder = EvaluationContext.builder();

        if (jsonPayload != null && !jsonPayload.isBlank()) {
            builder.rootObject(parseJson(jsonPayload));
        }
        builder.variables(variables);

        return builder.build();
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getMessage(), e);
        }
    }
}
