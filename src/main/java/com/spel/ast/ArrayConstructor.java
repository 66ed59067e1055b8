package com.spel.ast;

import com.spel.exception.EvaluationErrorKind;
import com.spel.exception.EvaluationException;

import java.util.List;

/**
 * {@code new T[size]...} with explicit dimension sizes. The size expressions are not
 * kept as children; only their rendered text survives, for display.
 *
 * @param typeName    Element type name
 * @param qualifier   The dotted type name as a node
 * @param dimensions  Rendered dimensions, e.g. {@code [(1024 * 1024)][2]}
 * @param initializer Optional {@code {elements}} initializer, null if absent
 */
public record ArrayConstructor(String typeName, QualifiedIdentifier qualifier, String dimensions,
                               InlineList initializer, int startPosition, int endPosition) implements SpelNode {

    @Override
    public List<SpelNode> children() {
        return initializer == null ? List.of(qualifier) : List.of(qualifier, initializer);
    }

    @Override
    public Object getValue(ExpressionState state) {
        if (initializer == null) {
            throw new EvaluationException(EvaluationErrorKind.UNSUPPORTED_OPERATION,
                    "Array 'new " + typeName + dimensions + "' cannot be allocated without an initializer");
        }
        return toArray(initializer, state);
    }

    @Override
    public String toStringAST() {
        if (initializer != null) {
            return "new " + typeName + "[] " + initializer.toStringAST();
        }
        return "new " + typeName + dimensions;
    }

    static Object[] toArray(InlineList elements, ExpressionState state) {
        return ((List<?>) elements.getValue(state)).toArray();
    }
}
