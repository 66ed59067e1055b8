package com.spel.ast;

import com.spel.exception.EvaluationErrorKind;
import com.spel.exception.EvaluationException;

import java.lang.reflect.Array;
import java.util.List;
import java.util.Map;

/**
 * {@code [index]} applied to the active context object: lists, arrays, strings and maps.
 */
public record Indexer(boolean nullSafe, SpelNode index, int startPosition, int endPosition) implements SpelNode {

    @Override
    public List<SpelNode> children() {
        return List.of(index);
    }

    @Override
    public Object getValue(ExpressionState state) {
        Object target = state.getActiveContextObject();
        if (target == null) {
            if (nullSafe) {
                return null;
            }
            throw new EvaluationException(EvaluationErrorKind.NULL_OPERAND, "Cannot index into a null value");
        }
        Object key = evaluateIndex(state);

        if (target instanceof Map<?, ?> map) {
            return map.get(key);
        }
        if (target instanceof List<?> list) {
            int i = toPosition(key, list.size());
            return list.get(i);
        }
        if (target.getClass().isArray()) {
            int i = toPosition(key, Array.getLength(target));
            return Array.get(target, i);
        }
        if (target instanceof String s) {
            int i = toPosition(key, s.length());
            return String.valueOf(s.charAt(i));
        }
        throw new EvaluationException(EvaluationErrorKind.UNSUPPORTED_OPERATION,
                "Indexing into type '" + target.getClass().getName() + "' is not supported");
    }

    @SuppressWarnings("unchecked")
    void setValue(ExpressionState state, Object value) {
        Object target = state.getActiveContextObject();
        if (target == null) {
            throw new EvaluationException(EvaluationErrorKind.NULL_OPERAND, "Cannot index into a null value");
        }
        Object key = evaluateIndex(state);
        try {
            if (target instanceof Map<?, ?> map) {
                ((Map<Object, Object>) map).put(key, value);
                return;
            }
            if (target instanceof List<?> list) {
                List<Object> elements = (List<Object>) list;
                int i = toIndex(key);
                if (i == elements.size() && state.getConfiguration().autoGrowCollections()) {
                    elements.add(value);
                    return;
                }
                elements.set(toPosition(key, elements.size()), value);
                return;
            }
            if (target.getClass().isArray()) {
                Array.set(target, toPosition(key, Array.getLength(target)), value);
                return;
            }
        } catch (UnsupportedOperationException | IllegalArgumentException e) {
            throw new EvaluationException(EvaluationErrorKind.NOT_ASSIGNABLE,
                    "Cannot assign element [" + key + "] of " + target.getClass().getName(), e);
        }
        throw new EvaluationException(EvaluationErrorKind.NOT_ASSIGNABLE,
                "Elements of type '" + target.getClass().getName() + "' cannot be assigned");
    }

    @Override
    public String toStringAST() {
        return (nullSafe ? "?.[" : "[") + index.toStringAST() + "]";
    }

    private Object evaluateIndex(ExpressionState state) {
        state.pushActiveContextObject(state.getScopeRootObject());
        try {
            return index.getValue(state);
        } finally {
            state.popActiveContextObject();
        }
    }

    private static int toIndex(Object key) {
        if (key instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d) || Double.isInfinite(d)) {
                throw new EvaluationException(EvaluationErrorKind.TYPE_CONVERSION,
                        "Index " + n + " is not an integer");
            }
            long l = n.longValue();
            if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
                throw new EvaluationException(EvaluationErrorKind.INDEX_OUT_OF_BOUNDS,
                        "Index " + l + " out of range");
            }
            return (int) l;
        }
        if (key instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new EvaluationException(EvaluationErrorKind.TYPE_CONVERSION,
                        "Index '" + s + "' is not an integer", e);
            }
        }
        throw new EvaluationException(EvaluationErrorKind.TYPE_CONVERSION,
                "Index of type " + (key == null ? "null" : key.getClass().getName()) + " is not an integer");
    }

    private static int toPosition(Object key, int size) {
        int i = toIndex(key);
        if (i < 0 || i >= size) {
            throw new EvaluationException(EvaluationErrorKind.INDEX_OUT_OF_BOUNDS,
                    "Index " + i + " out of bounds for size " + size);
        }
        return i;
    }
}
