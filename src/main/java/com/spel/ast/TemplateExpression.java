package com.spel.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Literal text segments and embedded expressions, concatenated in order.
 */
public record TemplateExpression(List<SpelNode> parts, int startPosition, int endPosition) implements SpelNode {

    public TemplateExpression {
        parts = List.copyOf(parts);
    }

    @Override
    public List<SpelNode> children() {
        return parts;
    }

    @Override
    public Object getValue(ExpressionState state) {
        StringBuilder sb = new StringBuilder();
        for (SpelNode part : parts) {
            sb.append(TypeCoercion.asString(part.getValue(state)));
        }
        return sb.toString();
    }

    @Override
    public String toStringAST() {
        return parts.stream()
                .map(SpelNode::toStringAST)
                .collect(Collectors.joining(" + ", "template[", "]"));
    }
}
