package com.spel.ast;

import com.spel.exception.EvaluationErrorKind;
import com.spel.exception.EvaluationException;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Value coercion rules shared by the operators.
 */
final class TypeCoercion {

    private TypeCoercion() {
    }

    /**
     * Convert an operand to a double. Numeric strings are accepted.
     */
    static double toDouble(Object value, String operator) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value == null) {
            throw new EvaluationException(EvaluationErrorKind.NULL_OPERAND,
                    "Operator '" + operator + "' does not accept a null operand");
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new EvaluationException(EvaluationErrorKind.TYPE_CONVERSION,
                        "Cannot convert '" + s + "' to a number for operator '" + operator + "'", e);
            }
        }
        throw new EvaluationException(EvaluationErrorKind.TYPE_CONVERSION,
                "Cannot convert value of type " + value.getClass().getName()
                        + " to a number for operator '" + operator + "'");
    }

    /**
     * Like {@link #toDouble} but reports failure as null instead of throwing.
     */
    static Double tryToDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Narrow an arithmetic result to a long when it is exactly integral.
     */
    static Object narrow(double result) {
        if (!Double.isInfinite(result) && (double) (long) result == result) {
            return (long) result;
        }
        return result;
    }

    /**
     * Apply a numeric operation to two operands. Two strings are rejected even if numeric.
     */
    static Object arithmetic(Object left, Object right, String operator, DoubleOperation operation) {
        if (left instanceof String && right instanceof String) {
            throw new EvaluationException(EvaluationErrorKind.TYPE_CONVERSION,
                    "Operator '" + operator + "' cannot be applied to two strings");
        }
        double l = toDouble(left, operator);
        double r = toDouble(right, operator);
        return narrow(operation.apply(l, r));
    }

    static Object negate(Object value) {
        if (value instanceof Integer i) {
            return -i;
        }
        if (value instanceof Long l) {
            return -l;
        }
        if (value instanceof Float f) {
            return -f;
        }
        if (value instanceof Double d) {
            return -d;
        }
        return narrow(-toDouble(value, "-"));
    }

    /**
     * null is false, booleans are themselves, numbers are true unless zero,
     * strings are true unless empty, anything else is true.
     */
    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return true;
    }

    /**
     * Values that make the elvis operator fall back to its default.
     */
    static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String s) {
            return s.isEmpty();
        }
        if (value instanceof Boolean b) {
            return !b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() == 0;
        }
        return false;
    }

    /**
     * Structural equality where numbers compare by value at any depth: lists and arrays
     * element by element, maps by key set and per-key value.
     */
    static boolean deepEquals(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return l.doubleValue() == r.doubleValue();
        }
        if (left instanceof Map<?, ?> l && right instanceof Map<?, ?> r) {
            if (l.size() != r.size() || !l.keySet().equals(r.keySet())) {
                return false;
            }
            for (Map.Entry<?, ?> entry : l.entrySet()) {
                if (!deepEquals(entry.getValue(), r.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if (isSequence(left) && isSequence(right)) {
            List<Object> l = asList(left);
            List<Object> r = asList(right);
            if (l.size() != r.size()) {
                return false;
            }
            for (int i = 0; i < l.size(); i++) {
                if (!deepEquals(l.get(i), r.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.deepEquals(left, right);
    }

    private static boolean isSequence(Object value) {
        return value instanceof List<?> || (value != null && value.getClass().isArray());
    }

    /**
     * Order two values for the relational operators: numerically when both convert,
     * otherwise by natural order when both are mutually comparable.
     */
    @SuppressWarnings("unchecked")
    static int compare(Object left, Object right, String operator) {
        if (left == null || right == null) {
            throw new EvaluationException(EvaluationErrorKind.NULL_OPERAND,
                    "Operator '" + operator + "' does not accept a null operand");
        }
        Double l = tryToDouble(left);
        Double r = tryToDouble(right);
        if (l != null && r != null) {
            return Double.compare(l, r);
        }
        if (left instanceof Comparable<?> && left.getClass().isInstance(right)) {
            return ((Comparable<Object>) left).compareTo(right);
        }
        throw new EvaluationException(EvaluationErrorKind.TYPE_CONVERSION,
                "Cannot compare " + left.getClass().getName() + " with "
                        + right.getClass().getName() + " using '" + operator + "'");
    }

    /**
     * Ordering used by {@code between}: numeric, then string, then rendered text.
     */
    static int compareForBetween(Object left, Object right) {
        if (left == null && right == null) {
            return 0;
        }
        if (left == null) {
            return -1;
        }
        if (right == null) {
            return 1;
        }
        Double l = tryToDouble(left);
        Double r = tryToDouble(right);
        if (l != null && r != null) {
            return Double.compare(l, r);
        }
        if (left instanceof String ls && right instanceof String rs) {
            return ls.compareTo(rs);
        }
        return asString(left).compareTo(asString(right));
    }

    static String asString(Object value) {
        if (value == null) {
            return "null";
        }
        if (value.getClass().isArray()) {
            return Arrays.deepToString(asList(value).toArray());
        }
        return value.toString();
    }

    /**
     * View a collection or array as a list, or null if the value is neither.
     */
    static List<Object> asList(Object value) {
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> result = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                result.add(Array.get(value, i));
            }
            return result;
        }
        return null;
    }

    @FunctionalInterface
    interface DoubleOperation {
        double apply(double left, double right);
    }
}
