package com.spel.variable;

import java.util.List;

/**
 * A function registered as a variable and invoked through {@code #name(args)}.
 */
@FunctionalInterface
public interface ExpressionFunction {

    /**
     * Invoke the function.
     *
     * @param arguments Evaluated arguments, in call order
     * @return Function result, may be null
     */
    Object invoke(List<Object> arguments);
}
