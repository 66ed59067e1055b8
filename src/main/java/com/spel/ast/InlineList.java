package com.spel.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code {a,b,c}}. Evaluates to an unmodifiable list; {@code {}} is the empty list.
 */
public record InlineList(List<SpelNode> elements, int startPosition, int endPosition) implements SpelNode {

    public InlineList {
        elements = List.copyOf(elements);
    }

    @Override
    public List<SpelNode> children() {
        return elements;
    }

    @Override
    public Object getValue(ExpressionState state) {
        List<Object> values = new ArrayList<>(elements.size());
        for (SpelNode element : elements) {
            values.add(element.getValue(state));
        }
        return Collections.unmodifiableList(values);
    }

    @Override
    public String toStringAST() {
        return elements.stream()
                .map(SpelNode::toStringAST)
                .collect(Collectors.joining(",", "{", "}"));
    }
}
