package com.spel.ast;

/**
 * Renders a tree as indented text, one node per line, for diagnostics.
 * <pre>
 * OperatorExpression (1 + 2)
 *   Literal 1
 *   Literal 2
 * </pre>
 */
public final class AstPrinter {

    private static final String INDENT = "  ";

    private AstPrinter() {
    }

    public static String print(SpelNode node) {
        StringBuilder sb = new StringBuilder();
        print(node, 0, sb);
        return sb.toString();
    }

    private static void print(SpelNode node, int depth, StringBuilder sb) {
        sb.append(INDENT.repeat(depth))
                .append(node.getClass().getSimpleName())
                .append(' ')
                .append(node.toStringAST())
                .append(System.lineSeparator());
        for (SpelNode child : node.children()) {
            print(child, depth + 1, sb);
        }
    }
}
