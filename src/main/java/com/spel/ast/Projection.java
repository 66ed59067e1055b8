package com.spel.ast;

import com.spel.exception.EvaluationErrorKind;
import com.spel.exception.EvaluationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * {@code .![expression]}: maps every element of a collection, array or map
 * (as {@link Map.Entry}) to a new list.
 */
public record Projection(boolean nullSafe, SpelNode expression,
                         int startPosition, int endPosition) implements SpelNode {

    @Override
    public List<SpelNode> children() {
        return List.of(expression);
    }

    @Override
    public Object getValue(ExpressionState state) {
        Object target = state.getActiveContextObject();
        if (target == null) {
            if (nullSafe) {
                return null;
            }
            throw new EvaluationException(EvaluationErrorKind.NULL_OPERAND, "Cannot project a null value");
        }

        List<Object> elements = target instanceof Map<?, ?> map
                ? new ArrayList<>(map.entrySet())
                : TypeCoercion.asList(target);
        if (elements == null) {
            throw new EvaluationException(EvaluationErrorKind.UNSUPPORTED_OPERATION,
                    "Projection is not supported on type '" + target.getClass().getName() + "'");
        }

        List<Object> projected = new ArrayList<>(elements.size());
        for (Object element : elements) {
            state.enterScope(element);
            try {
                projected.add(expression.getValue(state));
            } finally {
                state.exitScope();
            }
        }
        return Collections.unmodifiableList(projected);
    }

    @Override
    public String toStringAST() {
        return (nullSafe ? "?." : ".") + "![" + expression.toStringAST() + "]";
    }
}
