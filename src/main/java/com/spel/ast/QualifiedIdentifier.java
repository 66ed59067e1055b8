package com.spel.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A dotted name such as {@code java.lang.String}, one identifier per segment.
 */
public record QualifiedIdentifier(List<Identifier> parts, int startPosition, int endPosition) implements SpelNode {

    public QualifiedIdentifier {
        parts = List.copyOf(parts);
    }

    @Override
    public List<SpelNode> children() {
        return List.copyOf(parts);
    }

    @Override
    public Object getValue(ExpressionState state) {
        return toStringAST();
    }

    @Override
    public String toStringAST() {
        return parts.stream().map(Identifier::name).collect(Collectors.joining("."));
    }
}
