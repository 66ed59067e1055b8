package com.spel.expression;

import com.spel.variable.DefaultReferenceResolver;
import com.spel.variable.ReferenceResolver;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of EvaluationContext.
 * Immutable after construction.
 */
public final class DefaultEvaluationContext implements EvaluationContext {

    private final Object rootObject;
    private final Map<String, Object> variables;
    private final ReferenceResolver referenceResolver;

    private DefaultEvaluationContext(Builder builder) {
        this.rootObject = builder.rootObject;
        this.variables = Collections.unmodifiableMap(new HashMap<>(builder.variables));
        this.referenceResolver = builder.referenceResolver != null
                ? builder.referenceResolver
                : new DefaultReferenceResolver();
    }

    @Override
    public Object getRootObject() {
        return rootObject;
    }

    @Override
    public Optional<Object> getVariable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    @Override
    public Map<String, Object> getVariables() {
        return variables;
    }

    @Override
    public ReferenceResolver getReferenceResolver() {
        return referenceResolver;
    }

    @Override
    public String toString() {
        return "EvaluationContext{" +
                "rootObject=" + rootObject +
                ", variables=" + variables.keySet() +
                ", referenceResolver=" + referenceResolver.getClass().getSimpleName() +
                '}';
    }

    /**
     * Builder for DefaultEvaluationContext.
     */
    public static class Builder implements EvaluationContext.Builder {
        private Object rootObject;
        private ReferenceResolver referenceResolver;
        private final Map<String, Object> variables = new HashMap<>();

        @Override
        public Builder rootObject(Object rootObject) {
            this.rootObject = rootObject;
            return this;
        }

        /**
         * A null value is kept: {@code #name} then evaluates to null instead of failing.
         */
        @Override
        public Builder variable(String name, Object value) {
            if (name != null) {
                this.variables.put(name, value);
            }
            return this;
        }

        @Override
        public Builder variables(Map<String, Object> variables) {
            if (variables != null) {
                this.variables.putAll(variables);
            }
            return this;
        }

        @Override
        public Builder referenceResolver(ReferenceResolver resolver) {
            this.referenceResolver = resolver;
            return this;
        }

        @Override
        public EvaluationContext build() {
            return new DefaultEvaluationContext(this);
        }
    }
}
