package com.spel.ast;

import java.util.List;

/**
 * A bare name that evaluates to itself, used for qualified-name parts and inline map keys.
 */
public record Identifier(String name, int startPosition, int endPosition) implements SpelNode {

    @Override
    public List<SpelNode> children() {
        return List.of();
    }

    @Override
    public Object getValue(ExpressionState state) {
        return name;
    }

    @Override
    public String toStringAST() {
        return name;
    }
}
