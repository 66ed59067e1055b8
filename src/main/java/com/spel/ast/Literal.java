package com.spel.ast;

import java.util.List;

/**
 * A scalar written directly in the source.
 *
 * @param kind  Value kind
 * @param value Integer, Long, Double, Float, String, Boolean, or null for NULL
 */
public record Literal(LiteralKind kind, Object value, int startPosition, int endPosition) implements SpelNode {

    public static Literal ofString(String value, int start, int end) {
        return new Literal(LiteralKind.STRING, value, start, end);
    }

    public static Literal ofBoolean(boolean value, int start, int end) {
        return new Literal(LiteralKind.BOOLEAN, value, start, end);
    }

    public static Literal ofNull(int start, int end) {
        return new Literal(LiteralKind.NULL, null, start, end);
    }

    @Override
    public List<SpelNode> children() {
        return List.of();
    }

    @Override
    public Object getValue(ExpressionState state) {
        return value;
    }

    @Override
    public String toStringAST() {
        return switch (kind) {
            case STRING -> "'" + ((String) value).replace("'", "''") + "'";
            case LONG -> value + "L";
            case FLOAT -> value + "f";
            case NULL -> "null";
            case INT, REAL, BOOLEAN -> String.valueOf(value);
        };
    }
}
