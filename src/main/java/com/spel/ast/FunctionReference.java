package com.spel.ast;

import com.spel.exception.EvaluationErrorKind;
import com.spel.exception.EvaluationException;
import com.spel.variable.ExpressionFunction;

import java.util.List;

/**
 * {@code #name(args)}: invokes an {@link ExpressionFunction} registered as a variable.
 */
public record FunctionReference(String name, List<SpelNode> arguments,
                                int startPosition, int endPosition) implements SpelNode {

    public FunctionReference {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<SpelNode> children() {
        return arguments;
    }

    @Override
    public Object getValue(ExpressionState state) {
        Object function = state.lookupVariable(name);
        if (!(function instanceof ExpressionFunction expressionFunction)) {
            throw new EvaluationException(EvaluationErrorKind.UNRESOLVABLE_REFERENCE,
                    "Function '" + name + "' is not defined");
        }
        return expressionFunction.invoke(MethodReference.evaluateArguments(arguments, state));
    }

    @Override
    public String toStringAST() {
        return "#" + name + MethodReference.renderArguments(arguments);
    }
}
