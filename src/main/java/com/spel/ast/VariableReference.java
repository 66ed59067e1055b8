package com.spel.ast;

import com.spel.exception.EvaluationErrorKind;
import com.spel.exception.EvaluationException;

import java.util.List;

/**
 * {@code #name}. {@code #root} is the root object and {@code #this} the current scope element.
 */
public record VariableReference(String name, int startPosition, int endPosition) implements SpelNode {

    static final String ROOT = "root";
    static final String THIS = "this";

    @Override
    public List<SpelNode> children() {
        return List.of();
    }

    @Override
    public Object getValue(ExpressionState state) {
        if (ROOT.equals(name)) {
            return state.getRootObject();
        }
        if (THIS.equals(name)) {
            return state.getScopeRootObject();
        }
        if (!state.hasVariable(name)) {
            throw new EvaluationException(EvaluationErrorKind.UNRESOLVABLE_REFERENCE,
                    "Variable '" + name + "' is not defined");
        }
        return state.lookupVariable(name);
    }

    void setValue(ExpressionState state, Object value) {
        if (ROOT.equals(name) || THIS.equals(name)) {
            throw new EvaluationException(EvaluationErrorKind.NOT_ASSIGNABLE,
                    "Variable '#" + name + "' cannot be assigned");
        }
        state.setVariable(name, value);
    }

    @Override
    public String toStringAST() {
        return "#" + name;
    }
}
