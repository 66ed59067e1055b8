package com.spel.ast;

import com.spel.expression.SpelExpressionParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AstPrinter.
 */
class AstPrinterTest {

    @Test
    @DisplayName("Prints one indented line per node")
    void printsTree() {
        SpelNode ast = new SpelExpressionParser().parseExpression("1 + a.b").getAST();

        String[] lines = AstPrinter.print(ast).split(System.lineSeparator());

        assertArrayEquals(new String[]{
                "OperatorExpression (1 + a.b)",
                "  Literal 1",
                "  CompoundExpression a.b",
                "    PropertyOrFieldReference a",
                "    PropertyOrFieldReference .b"
        }, lines);
    }

    @Test
    @DisplayName("Leaf node prints a single line")
    void printsLeaf() {
        SpelNode ast = new SpelExpressionParser().parseExpression("'x'").getAST();

        assertEquals("Literal 'x'" + System.lineSeparator(), AstPrinter.print(ast));
    }
}
