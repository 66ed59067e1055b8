package com.spel.ast;

import com.spel.exception.EvaluationErrorKind;
import com.spel.exception.EvaluationException;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Invokes a method on the active context object.
 * Arguments evaluate against the current scope root, not the receiver.
 */
public record MethodReference(boolean nullSafe, String name, List<SpelNode> arguments,
                              int startPosition, int endPosition) implements SpelNode {

    public MethodReference {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<SpelNode> children() {
        return arguments;
    }

    @Override
    public Object getValue(ExpressionState state) {
        Object target = state.getActiveContextObject();
        if (target == null) {
            if (nullSafe) {
                return null;
            }
            throw new EvaluationException(EvaluationErrorKind.NULL_OPERAND,
                    "Method call: attempted to call method " + name + "() on null context object");
        }
        return state.getResolver().invokeMethod(target, name, evaluateArguments(arguments, state));
    }

    @Override
    public String toStringAST() {
        return name + renderArguments(arguments);
    }

    static List<Object> evaluateArguments(List<SpelNode> arguments, ExpressionState state) {
        List<Object> values = new ArrayList<>(arguments.size());
        state.pushActiveContextObject(state.getScopeRootObject());
        try {
            for (SpelNode argument : arguments) {
                values.add(argument.getValue(state));
            }
        } finally {
            state.popActiveContextObject();
        }
        return values;
    }

    static String renderArguments(List<SpelNode> arguments) {
        return arguments.stream()
                .map(SpelNode::toStringAST)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
