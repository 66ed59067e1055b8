package com.spel.ast;

import com.spel.exception.EvaluationErrorKind;
import com.spel.exception.EvaluationException;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Binary operators. Each constant owns its coercion rule; operands are passed
 * unevaluated so the logical operators can short-circuit.
 */
public enum Operator {

    PLUS("+") {
        @Override
        Object apply(SpelNode left, SpelNode right, ExpressionState state) {
            Object l = left.getValue(state);
            Object r = right.getValue(state);
            if (l instanceof String || r instanceof String) {
                return TypeCoercion.asString(l) + TypeCoercion.asString(r);
            }
            return TypeCoercion.arithmetic(l, r, symbol(), Double::sum);
        }
    },

    MINUS("-") {
        @Override
        Object apply(SpelNode left, SpelNode right, ExpressionState state) {
            return TypeCoercion.arithmetic(left.getValue(state), right.getValue(state), symbol(), (l, r) -> l - r);
        }
    },

    MULTIPLY("*") {
        @Override
        Object apply(SpelNode left, SpelNode right, ExpressionState state) {
            return TypeCoercion.arithmetic(left.getValue(state), right.getValue(state), symbol(), (l, r) -> l * r);
        }
    },

    // Division and modulo by zero yield zero
    DIVIDE("/") {
        @Override
        Object apply(SpelNode left, SpelNode right, ExpressionState state) {
            return TypeCoercion.arithmetic(left.getValue(state), right.getValue(state), symbol(),
                    (l, r) -> r == 0 ? 0 : l / r);
        }
    },

    MODULUS("%") {
        @Override
        Object apply(SpelNode left, SpelNode right, ExpressionState state) {
            return TypeCoercion.arithmetic(left.getValue(state), right.getValue(state), symbol(),
                    (l, r) -> r == 0 ? 0 : l % r);
        }
    },

    POWER("^") {
        @Override
        Object apply(SpelNode left, SpelNode right, ExpressionState state) {
            return TypeCoercion.arithmetic(left.getValue(state), right.getValue(state), symbol(), Math::pow);
        }
    },

    EQ("==") {
        @Override
        Object apply(SpelNode left, SpelNode right, ExpressionState state) {
            return TypeCoercion.deepEquals(left.getValue(state), right.getValue(state));
        }
    },

    NE("!=") {
        @Override
        Object apply(SpelNode left, SpelNode right, ExpressionState state) {
            return !TypeCoercion.deepEquals(left.getValue(state), right.getValue(state));
        }
    },

    GT(">") {
        @Override
        Object apply(SpelNode left, SpelNode right, ExpressionState state) {
            return TypeCoercion.compare(left.getValue(state), right.getValue(state), symbol()) > 0;
        }
    },

    GE(">=") {
        @Override
        Object apply(SpelNode left, SpelNode right, ExpressionState state) {
            return TypeCoercion.compare(left.getValue(state), right.getValue(state), symbol()) >= 0;
        }
    },

    LT("<") {
        @Override
        Object apply(SpelNode left, SpelNode right, ExpressionState state) {
            return TypeCoercion.compare(left.getValue(state), right.getValue(state), symbol()) < 0;
        }
    },

    LE("<=") {
        @Override
        Object apply(SpelNode left, SpelNode right, ExpressionState state) {
            return TypeCoercion.compare(left.getValue(state), right.getValue(state), symbol()) <= 0;
        }
    },

    AND("and") {
        @Override
        Object apply(SpelNode left, SpelNode right, ExpressionState state) {
            if (!condition(left.getValue(state), symbol())) {
                return false;
            }
            return condition(right.getValue(state), symbol());
        }
    },

    OR("or") {
        @Override
        Object apply(SpelNode left, SpelNode right, ExpressionState state) {
            if (condition(left.getValue(state), symbol())) {
                return true;
            }
            return condition(right.getValue(state), symbol());
        }
    },

    MATCHES("matches") {
        @Override
        Object apply(SpelNode left, SpelNode right, ExpressionState state) {
            String value = TypeCoercion.asString(left.getValue(state));
            String regex = TypeCoercion.asString(right.getValue(state));
            try {
                return Pattern.compile(regex).matcher(value).matches();
            } catch (PatternSyntaxException e) {
                throw new EvaluationException(EvaluationErrorKind.INVALID_PATTERN,
                        "Invalid regular expression '" + regex + "': " + e.getDescription(), e);
            }
        }
    },

    BETWEEN("between") {
        @Override
        Object apply(SpelNode left, SpelNode right, ExpressionState state) {
            Object value = left.getValue(state);
            List<Object> range = TypeCoercion.asList(right.getValue(state));
            if (range == null || range.size() != 2) {
                throw new EvaluationException(EvaluationErrorKind.TYPE_CONVERSION,
                        "Operator 'between' requires a two-element list {min, max} on the right");
            }
            return TypeCoercion.compareForBetween(value, range.get(0)) >= 0
                    && TypeCoercion.compareForBetween(value, range.get(1)) <= 0;
        }
    },

    INSTANCEOF("instanceof") {
        @Override
        Object apply(SpelNode left, SpelNode right, ExpressionState state) {
            Object value = left.getValue(state);
            Object type = right.getValue(state);
            if (!(type instanceof Class<?> clazz)) {
                throw new EvaluationException(EvaluationErrorKind.TYPE_CONVERSION,
                        "Operator 'instanceof' requires a type on the right, e.g. T(java.lang.String)");
            }
            return clazz.isInstance(value);
        }
    };

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    abstract Object apply(SpelNode left, SpelNode right, ExpressionState state);

    private static boolean condition(Object value, String operator) {
        if (value == null) {
            throw new EvaluationException(EvaluationErrorKind.NULL_OPERAND,
                    "Operator '" + operator + "' does not accept a null operand");
        }
        return TypeCoercion.isTruthy(value);
    }
}
