package com.spel.ast;

import com.spel.exception.EvaluationErrorKind;
import com.spel.exception.EvaluationException;

import java.util.List;

/**
 * {@code T(a.b.C)}. Evaluates to the resolved {@link Class}.
 */
public record TypeReference(String typeName, int startPosition, int endPosition) implements SpelNode {

    @Override
    public List<SpelNode> children() {
        return List.of();
    }

    @Override
    public Object getValue(ExpressionState state) {
        return state.getResolver().resolveType(typeName)
                .orElseThrow(() -> new EvaluationException(EvaluationErrorKind.UNRESOLVABLE_REFERENCE,
                        "Type '" + typeName + "' cannot be found"));
    }

    @Override
    public String toStringAST() {
        return "T(" + typeName + ")";
    }
}
