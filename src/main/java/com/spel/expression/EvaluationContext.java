package com.spel.expression;

import com.spel.variable.ReferenceResolver;

import java.util.Map;
import java.util.Optional;

/**
 * Everything an expression is evaluated against: the root object, named variables
 * and the resolver for properties, methods, beans and types.
 * Immutable after creation; assignments made by an expression are visible only
 * within that evaluation.
 */
public interface EvaluationContext {

    /**
     * Object that unqualified names are resolved against. May be null.
     */
    Object getRootObject();

    /**
     * Get a variable ({@code #name}).
     *
     * @param name Variable name (without '#')
     * @return Variable value, or empty if not set or set to null
     */
    Optional<Object> getVariable(String name);

    /**
     * Get all variables.
     */
    Map<String, Object> getVariables();

    ReferenceResolver getReferenceResolver();

    /**
     * Create a new builder.
     */
    static Builder builder() {
        return new DefaultEvaluationContext.Builder();
    }

    /**
     * Builder for EvaluationContext.
     */
    interface Builder {
        Builder rootObject(Object rootObject);
        Builder variable(String name, Object value);
        Builder variables(Map<String, Object> variables);
        Builder referenceResolver(ReferenceResolver resolver);
        EvaluationContext build();
    }
}
