package com.spel.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@code {k1:v1,k2:v2}}. {@code {:}} is the empty map. Entry order is preserved.
 */
public record InlineMap(List<Entry> entries, int startPosition, int endPosition) implements SpelNode {

    /**
     * A key-value pair. Bare identifier keys are {@link Identifier} nodes evaluating to their name.
     */
    public record Entry(SpelNode key, SpelNode value) {
    }

    public InlineMap {
        entries = List.copyOf(entries);
    }

    @Override
    public List<SpelNode> children() {
        List<SpelNode> children = new ArrayList<>(entries.size() * 2);
        for (Entry entry : entries) {
            children.add(entry.key());
            children.add(entry.value());
        }
        return List.copyOf(children);
    }

    @Override
    public Object getValue(ExpressionState state) {
        Map<Object, Object> result = new LinkedHashMap<>();
        for (Entry entry : entries) {
            result.put(entry.key().getValue(state), entry.value().getValue(state));
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String toStringAST() {
        if (entries.isEmpty()) {
            return "{:}";
        }
        return entries.stream()
                .map(entry -> entry.key().toStringAST() + ":" + entry.value().toStringAST())
                .collect(Collectors.joining(",", "{", "}"));
    }
}
