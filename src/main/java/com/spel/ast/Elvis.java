package com.spel.ast;

import java.util.List;

/**
 * {@code value ?: fallback}. The fallback is evaluated only when the value is
 * null, empty string, false or numeric zero.
 */
public record Elvis(SpelNode value, SpelNode fallback, int startPosition, int endPosition) implements SpelNode {

    @Override
    public List<SpelNode> children() {
        return List.of(value, fallback);
    }

    @Override
    public Object getValue(ExpressionState state) {
        Object result = value.getValue(state);
        return TypeCoercion.isEmpty(result) ? fallback.getValue(state) : result;
    }

    @Override
    public String toStringAST() {
        return "(" + value.toStringAST() + " ?: " + fallback.toStringAST() + ")";
    }
}
