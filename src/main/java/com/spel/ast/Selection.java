package com.spel.ast;

import com.spel.exception.EvaluationErrorKind;
import com.spel.exception.EvaluationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Filters a collection, array or map by a boolean criterion evaluated per element.
 * Map elements are {@link Map.Entry} objects and the result for a map is a map.
 */
public record Selection(boolean nullSafe, Kind kind, SpelNode criteria,
                        int startPosition, int endPosition) implements SpelNode {

    public enum Kind {
        /** {@code ?[...]}: every matching element. */
        ALL("?["),
        /** {@code ^[...]}: the first matching element. */
        FIRST("^["),
        /** {@code $[...]}: the last matching element. */
        LAST("$[");

        private final String opener;

        Kind(String opener) {
            this.opener = opener;
        }

        public String opener() {
            return opener;
        }
    }

    @Override
    public List<SpelNode> children() {
        return List.of(criteria);
    }

    @Override
    public Object getValue(ExpressionState state) {
        Object target = state.getActiveContextObject();
        if (target == null) {
            if (nullSafe) {
                return null;
            }
            throw new EvaluationException(EvaluationErrorKind.NULL_OPERAND, "Cannot select from a null value");
        }

        if (target instanceof Map<?, ?> map) {
            Map<Object, Object> selected = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (matches(entry, state)) {
                    selected.put(entry.getKey(), entry.getValue());
                }
            }
            return switch (kind) {
                case ALL -> Collections.unmodifiableMap(selected);
                case FIRST -> selected.isEmpty() ? null : singleEntry(selected, 0);
                case LAST -> selected.isEmpty() ? null : singleEntry(selected, selected.size() - 1);
            };
        }

        List<Object> elements = TypeCoercion.asList(target);
        if (elements == null) {
            throw new EvaluationException(EvaluationErrorKind.UNSUPPORTED_OPERATION,
                    "Selection is not supported on type '" + target.getClass().getName() + "'");
        }
        List<Object> selected = new ArrayList<>();
        for (Object element : elements) {
            if (matches(element, state)) {
                if (kind == Kind.FIRST) {
                    return element;
                }
                selected.add(element);
            }
        }
        return switch (kind) {
            case ALL -> Collections.unmodifiableList(selected);
            case FIRST -> null;
            case LAST -> selected.isEmpty() ? null : selected.get(selected.size() - 1);
        };
    }

    @Override
    public String toStringAST() {
        return (nullSafe ? "?." : ".") + kind.opener() + criteria.toStringAST() + "]";
    }

    private boolean matches(Object element, ExpressionState state) {
        state.enterScope(element);
        try {
            Object result = criteria.getValue(state);
            if (result instanceof Boolean b) {
                return b;
            }
            throw new EvaluationException(EvaluationErrorKind.TYPE_CONVERSION,
                    "Selection criteria '" + criteria.toStringAST() + "' must evaluate to a boolean, got "
                            + (result == null ? "null" : result.getClass().getName()));
        } finally {
            state.exitScope();
        }
    }

    private static Map<Object, Object> singleEntry(Map<Object, Object> selected, int position) {
        Map.Entry<Object, Object> entry = new ArrayList<>(selected.entrySet()).get(position);
        Map<Object, Object> result = new LinkedHashMap<>();
        result.put(entry.getKey(), entry.getValue());
        return Collections.unmodifiableMap(result);
    }
}
