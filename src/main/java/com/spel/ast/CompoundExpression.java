package com.spel.ast;

import java.util.List;

/**
 * A start node followed by one or more trailers, e.g. {@code a.b[0].c()}.
 * Each segment evaluates with the previous segment's value as its active context.
 */
public record CompoundExpression(List<SpelNode> children, int startPosition, int endPosition) implements SpelNode {

    public CompoundExpression {
        children = List.copyOf(children);
    }

    @Override
    public Object getValue(ExpressionState state) {
        Object value = children.get(0).getValue(state);
        for (int i = 1; i < children.size(); i++) {
            state.pushActiveContextObject(value);
            try {
                value = children.get(i).getValue(state);
            } finally {
                state.popActiveContextObject();
            }
        }
        return value;
    }

    /**
     * Evaluate all but the last segment and assign through the last one.
     */
    void setValue(ExpressionState state, Object newValue) {
        Object target = children.get(0).getValue(state);
        for (int i = 1; i < children.size() - 1; i++) {
            state.pushActiveContextObject(target);
            try {
                target = children.get(i).getValue(state);
            } finally {
                state.popActiveContextObject();
            }
        }
        state.pushActiveContextObject(target);
        try {
            Assign.assignTo(children.get(children.size() - 1), state, newValue);
        } finally {
            state.popActiveContextObject();
        }
    }

    @Override
    public String toStringAST() {
        StringBuilder sb = new StringBuilder(renderStart(children.get(0)));
        for (int i = 1; i < children.size(); i++) {
            SpelNode child = children.get(i);
            if (child instanceof MethodReference method) {
                sb.append(method.nullSafe() ? "?." : ".");
            }
            sb.append(child.toStringAST());
        }
        return sb.toString();
    }

    /**
     * Unary and nested compound start nodes are bracketed so trailers stay attached to the whole node.
     */
    private static String renderStart(SpelNode start) {
        if (start instanceof UnaryExpression || start instanceof CompoundExpression) {
            return "(" + start.toStringAST() + ")";
        }
        return start.toStringAST();
    }
}
