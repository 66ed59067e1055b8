package com.spel.expression;

import com.spel.ast.ExpressionState;
import com.spel.ast.SpelNode;
import com.spel.config.ParserConfiguration;
import com.spel.exception.EvaluationErrorKind;
import com.spel.exception.EvaluationException;

import java.util.Map;

/**
 * A parsed expression. Immutable and safe to evaluate from several threads;
 * every evaluation gets its own {@link ExpressionState}.
 */
public class SpelExpression {

    private final String expressionString;
    private final SpelNode ast;
    private final ParserConfiguration configuration;

    public SpelExpression(String expressionString, SpelNode ast, ParserConfiguration configuration) {
        this.expressionString = expressionString;
        this.ast = ast;
        this.configuration = configuration;
    }

    public String getExpressionString() {
        return expressionString;
    }

    public SpelNode getAST() {
        return ast;
    }

    /**
     * Canonical rendering of the parsed tree.
     */
    public String toStringAST() {
        return ast.toStringAST();
    }

    public ParserConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Evaluate with no root object and no variables.
     */
    public Object getValue() {
        return getValue(EvaluationContext.builder().build());
    }

    public Object getValue(Object rootObject) {
        return getValue(EvaluationContext.builder().rootObject(rootObject).build());
    }

    public Object getValue(EvaluationContext context) {
        ExpressionState state = new ExpressionState(configuration, context.getRootObject(),
                context.getVariables(), context.getReferenceResolver());
        return ast.getValue(state);
    }

    /**
     * Evaluate and convert the result to the requested type.
     *
     * @throws EvaluationException with {@link EvaluationErrorKind#TYPE_CONVERSION} if the
     *                             result cannot be converted
     */
    public <T> T getValue(EvaluationContext context, Class<T> expectedType) {
        return convert(getValue(context), expectedType);
    }

    public <T> T getValue(Object rootObject, Class<T> expectedType) {
        return convert(getValue(rootObject), expectedType);
    }

    private static final Map<Class<?>, Class<?>> BOXED = Map.of(
            int.class, Integer.class,
            long.class, Long.class,
            double.class, Double.class,
            float.class, Float.class,
            short.class, Short.class,
            byte.class, Byte.class,
            boolean.class, Boolean.class,
            char.class, Character.class);

    @SuppressWarnings("unchecked")
    private static <T> T convert(Object value, Class<T> expectedType) {
        if (value == null) {
            if (expectedType.isPrimitive()) {
                throw new EvaluationException(EvaluationErrorKind.TYPE_CONVERSION,
                        "Cannot convert null to primitive type " + expectedType.getName());
            }
            return null;
        }
        Class<?> target = BOXED.getOrDefault(expectedType, expectedType);
        if (target.isInstance(value)) {
            return (T) value;
        }
        if (target == String.class) {
            return (T) value.toString();
        }
        if (value instanceof Number n) {
            Object converted = convertNumber(n, target);
            if (converted != null) {
                return (T) converted;
            }
        }
        if (value instanceof String s && target == Boolean.class
                && ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s))) {
            return (T) Boolean.valueOf(s);
        }
        throw new EvaluationException(EvaluationErrorKind.TYPE_CONVERSION,
                "Cannot convert value of type " + value.getClass().getName() + " to " + expectedType.getName());
    }

    /**
     * Integral targets accept only integral values within their range; null means no conversion applies.
     */
    private static Object convertNumber(Number n, Class<?> target) {
        if (target == Double.class) {
            return n.doubleValue();
        }
        if (target == Float.class) {
            return n.floatValue();
        }
        if (target == Long.class) {
            return integralValue(n, Long.MIN_VALUE, Long.MAX_VALUE, target);
        }
        if (target == Integer.class) {
            return (int) integralValue(n, Integer.MIN_VALUE, Integer.MAX_VALUE, target);
        }
        if (target == Short.class) {
            return (short) integralValue(n, Short.MIN_VALUE, Short.MAX_VALUE, target);
        }
        if (target == Byte.class) {
            return (byte) integralValue(n, Byte.MIN_VALUE, Byte.MAX_VALUE, target);
        }
        return null;
    }

    private static long integralValue(Number n, long min, long max, Class<?> target) {
        long value;
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (d != Math.rint(d) || d < min || d > max) {
                throw new EvaluationException(EvaluationErrorKind.TYPE_CONVERSION,
                        "Cannot convert " + n + " to " + target.getName() + " without loss");
            }
            value = (long) d;
        } else {
            value = n.longValue();
        }
        if (value < min || value > max) {
            throw new EvaluationException(EvaluationErrorKind.TYPE_CONVERSION,
                    "Value " + n + " is out of range for " + target.getName());
        }
        return value;
    }

    @Override
    public String toString() {
        return "SpelExpression{" + expressionString + '}';
    }
}
