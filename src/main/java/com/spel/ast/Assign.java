package com.spel.ast;

import com.spel.exception.EvaluationErrorKind;
import com.spel.exception.EvaluationException;

import java.util.List;

/**
 * {@code target = value}. Assigns variables, properties and indexed elements, and yields the value.
 */
public record Assign(SpelNode target, SpelNode value, int startPosition, int endPosition) implements SpelNode {

    @Override
    public List<SpelNode> children() {
        return List.of(target, value);
    }

    @Override
    public Object getValue(ExpressionState state) {
        Object newValue = value.getValue(state);
        assignTo(target, state, newValue);
        return newValue;
    }

    @Override
    public String toStringAST() {
        return target.toStringAST() + " = " + value.toStringAST();
    }

    static void assignTo(SpelNode target, ExpressionState state, Object newValue) {
        if (target instanceof VariableReference variable) {
            variable.setValue(state, newValue);
        } else if (target instanceof PropertyOrFieldReference property) {
            property.setValue(state, newValue);
        } else if (target instanceof Indexer indexer) {
            indexer.setValue(state, newValue);
        } else if (target instanceof CompoundExpression compound) {
            compound.setValue(state, newValue);
        } else {
            throw new EvaluationException(EvaluationErrorKind.NOT_ASSIGNABLE,
                    "Cannot assign to '" + target.toStringAST() + "'");
        }
    }
}
