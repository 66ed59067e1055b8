package com.spel.ast;

import java.util.List;

/**
 * A binary operator application, rendered fully parenthesized: {@code (left op right)}.
 */
public record OperatorExpression(Operator operator, SpelNode left, SpelNode right,
                                 int startPosition, int endPosition) implements SpelNode {

    @Override
    public List<SpelNode> children() {
        return List.of(left, right);
    }

    @Override
    public Object getValue(ExpressionState state) {
        return operator.apply(left, right, state);
    }

    @Override
    public String toStringAST() {
        return "(" + left.toStringAST() + " " + operator.symbol() + " " + right.toStringAST() + ")";
    }
}
