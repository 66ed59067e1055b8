package com.spel.ast;

import java.util.List;

/**
 * A node of a parsed expression.
 * <p>
 * The hierarchy is closed: every node kind is one of the permitted records below.
 * Each node owns its children exclusively, never changes after parsing, and
 * implements its own evaluation and canonical rendering.
 */
public sealed interface SpelNode permits
        Literal, Identifier, QualifiedIdentifier,
        PropertyOrFieldReference, VariableReference, FunctionReference,
        BeanReference, TypeReference, MethodReference,
        ConstructorReference, ArrayConstructor,
        CompoundExpression, Indexer, Assign,
        OperatorExpression, UnaryExpression, Ternary, Elvis,
        InlineList, InlineMap, Selection, Projection,
        TemplateExpression {

    /**
     * Offset of the first source character covered by this node.
     */
    int startPosition();

    /**
     * Offset one past the last source character covered by this node.
     */
    int endPosition();

    /**
     * Child nodes in evaluation order.
     */
    List<SpelNode> children();

    /**
     * Evaluate this node.
     *
     * @param state Evaluation state
     * @return Value, may be null
     * @throws com.spel.exception.EvaluationException on coercion or resolution failure
     */
    Object getValue(ExpressionState state);

    /**
     * Render this subtree as canonical expression text. Never fails.
     */
    String toStringAST();
}
