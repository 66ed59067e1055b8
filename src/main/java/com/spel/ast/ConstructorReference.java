package com.spel.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code new T(args)}, or {@code new T[] {elements}} when the single argument is an inline list.
 *
 * @param typeName  Type name as written, with {@code []} dimensions for array forms
 * @param qualifier The dotted type name as a node
 * @param arguments Constructor arguments
 */
public record ConstructorReference(String typeName, QualifiedIdentifier qualifier, List<SpelNode> arguments,
                                   int startPosition, int endPosition) implements SpelNode {

    private static final String DIMENSION = "[]";

    public ConstructorReference {
        arguments = List.copyOf(arguments);
    }

    /**
     * Whether the arguments are one inline list, which switches rendering to array form.
     */
    public boolean isArrayInitializer() {
        return arguments.size() == 1 && arguments.get(0) instanceof InlineList;
    }

    @Override
    public List<SpelNode> children() {
        List<SpelNode> children = new ArrayList<>(arguments.size() + 1);
        children.add(qualifier);
        children.addAll(arguments);
        return List.copyOf(children);
    }

    /**
     * Whether this was written as {@code new T[]...{elements}}. Only that form builds an array;
     * {@code new T({elements})} passes the list to the resolver like any other argument.
     */
    public boolean isArrayForm() {
        return typeName.endsWith(DIMENSION) && isArrayInitializer();
    }

    @Override
    public Object getValue(ExpressionState state) {
        if (isArrayForm()) {
            return ArrayConstructor.toArray((InlineList) arguments.get(0), state);
        }
        List<Object> values = MethodReference.evaluateArguments(arguments, state);
        return state.getResolver().construct(typeName, values);
    }

    @Override
    public String toStringAST() {
        if (isArrayInitializer()) {
            String arrayType = typeName.endsWith(DIMENSION) ? typeName : typeName + DIMENSION;
            return "new " + arrayType + " " + arguments.get(0).toStringAST();
        }
        return "new " + typeName + arguments.stream()
                .map(SpelNode::toStringAST)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
