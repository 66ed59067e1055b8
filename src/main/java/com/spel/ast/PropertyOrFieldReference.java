package com.spel.ast;

import com.spel.exception.EvaluationErrorKind;
import com.spel.exception.EvaluationException;

import java.util.List;

/**
 * Reads a property of the active context object.
 *
 * @param nullSafe Whether reached through {@code ?.}, yielding null on a null target
 * @param direct   Whether this is the first segment of a chain ({@code name} rather than {@code .name})
 * @param name     Property name
 */
public record PropertyOrFieldReference(boolean nullSafe, boolean direct, String name,
                                       int startPosition, int endPosition) implements SpelNode {

    @Override
    public List<SpelNode> children() {
        return List.of();
    }

    @Override
    public Object getValue(ExpressionState state) {
        Object target = state.getActiveContextObject();
        if (target == null) {
            if (nullSafe) {
                return null;
            }
            throw new EvaluationException(EvaluationErrorKind.NULL_OPERAND,
                    "Property or field '" + name + "' cannot be found on null");
        }
        if (!state.getResolver().canReadProperty(target, name)) {
            throw new EvaluationException(EvaluationErrorKind.UNRESOLVABLE_REFERENCE,
                    "Property or field '" + name + "' cannot be found on object of type '"
                            + target.getClass().getName() + "'");
        }
        return state.getResolver().readProperty(target, name);
    }

    /**
     * Write the property on the active context object.
     */
    void setValue(ExpressionState state, Object value) {
        Object target = state.getActiveContextObject();
        if (target == null) {
            throw new EvaluationException(EvaluationErrorKind.NULL_OPERAND,
                    "Property or field '" + name + "' cannot be set on null");
        }
        state.getResolver().writeProperty(target, name, value);
    }

    @Override
    public String toStringAST() {
        if (direct) {
            return name;
        }
        return (nullSafe ? "?." : ".") + name;
    }
}
