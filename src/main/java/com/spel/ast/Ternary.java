package com.spel.ast;

import com.spel.exception.EvaluationErrorKind;
import com.spel.exception.EvaluationException;

import java.util.List;

/**
 * {@code condition ? ifTrue : ifFalse}. Exactly one branch is evaluated.
 */
public record Ternary(SpelNode condition, SpelNode ifTrue, SpelNode ifFalse,
                      int startPosition, int endPosition) implements SpelNode {

    @Override
    public List<SpelNode> children() {
        return List.of(condition, ifTrue, ifFalse);
    }

    @Override
    public Object getValue(ExpressionState state) {
        Object value = condition.getValue(state);
        if (value == null) {
            throw new EvaluationException(EvaluationErrorKind.NULL_OPERAND,
                    "Ternary condition '" + condition.toStringAST() + "' evaluated to null");
        }
        return TypeCoercion.isTruthy(value) ? ifTrue.getValue(state) : ifFalse.getValue(state);
    }

    @Override
    public String toStringAST() {
        return "(" + condition.toStringAST() + " ? " + ifTrue.toStringAST() + " : " + ifFalse.toStringAST() + ")";
    }
}
