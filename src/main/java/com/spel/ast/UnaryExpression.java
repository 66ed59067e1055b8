package com.spel.ast;

import java.util.List;

/**
 * {@code !operand} or {@code -operand}.
 */
public record UnaryExpression(Kind kind, SpelNode operand, int startPosition, int endPosition) implements SpelNode {

    public enum Kind {
        NOT("!"),
        MINUS("-");

        private final String symbol;

        Kind(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    @Override
    public List<SpelNode> children() {
        return List.of(operand);
    }

    @Override
    public Object getValue(ExpressionState state) {
        Object value = operand.getValue(state);
        return switch (kind) {
            case NOT -> !TypeCoercion.isTruthy(value);
            case MINUS -> TypeCoercion.negate(value);
        };
    }

    @Override
    public String toStringAST() {
        // "- -2" must not render as "--2", which lexes as a decrement
        if (operand instanceof UnaryExpression) {
            return kind.symbol() + "(" + operand.toStringAST() + ")";
        }
        return kind.symbol() + operand.toStringAST();
    }
}
