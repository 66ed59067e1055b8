package com.spel.ast;

import com.spel.exception.EvaluationErrorKind;
import com.spel.exception.EvaluationException;
import com.spel.expression.SpelExpressionParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for operator evaluation: arithmetic, comparison, logic, ternary and elvis.
 */
class OperatorEvaluationTest {

    private SpelExpressionParser parser;

    @BeforeEach
    void setUp() {
        parser = new SpelExpressionParser();
    }

    private Object eval(String expression) {
        return parser.parseExpression(expression).getValue();
    }

    private EvaluationErrorKind evalErrorKind(String expression) {
        return assertThrows(EvaluationException.class, () -> eval(expression)).getKind();
    }

    // =====================================================================
    // Arithmetic
    // =====================================================================

    @Test
    @DisplayName("Precedence: multiplication before addition, parentheses override")
    void precedence() {
        assertEquals(14L, eval("2 + 3 * 4"));
        assertEquals(20L, eval("(2 + 3) * 4"));
        assertEquals(-4L, eval("1 - 2 - 3"));
    }

    @Test
    @DisplayName("Unary minus applies before power")
    void unaryMinusThenPower() {
        assertEquals(16L, eval("-2 ^ 4"));
        assertEquals(8L, eval("2 ^ 3"));
    }

    @Test
    @DisplayName("Integral results narrow to long, others stay double")
    void resultTypes() {
        assertEquals(4L, eval("8 / 2"));
        assertEquals(3.5, eval("7 / 2"));
        assertEquals(2.5, eval("1.5 + 1"));
        assertEquals(1L, eval("7 % 3"));
        assertEquals(1L, eval("7 mod 3"));
        assertEquals(3L, eval("6 div 2"));
    }

    @Test
    @DisplayName("Division and modulo by zero yield zero")
    void divisionByZero() {
        assertEquals(0L, eval("5 / 0"));
        assertEquals(0L, eval("5 % 0"));
    }

    @Test
    @DisplayName("Unary minus keeps the literal's numeric type")
    void negation() {
        assertEquals(-3, eval("-3"));
        assertEquals(-3L, eval("-3L"));
        assertEquals(-1.5, eval("-1.5"));
        assertEquals(-2.0f, eval("-2f"));
        assertEquals(3, eval("- -3"));
    }

    @Test
    @DisplayName("Plus concatenates when either side is a string")
    void stringConcatenation() {
        assertEquals("a1", eval("'a' + 1"));
        assertEquals("1a", eval("1 + 'a'"));
        assertEquals("anull", eval("'a' + null"));
        assertEquals("ab", eval("'a' + 'b'"));
    }

    @Test
    @DisplayName("Numeric strings take part in arithmetic with numbers")
    void numericStrings() {
        assertEquals(6L, eval("'2' * 3"));
        assertEquals(EvaluationErrorKind.TYPE_CONVERSION, evalErrorKind("'2' - '1'"));
        assertEquals(EvaluationErrorKind.TYPE_CONVERSION, evalErrorKind("'a' * 3"));
    }

    @Test
    @DisplayName("Arithmetic on null is rejected")
    void arithmeticOnNull() {
        assertEquals(EvaluationErrorKind.NULL_OPERAND, evalErrorKind("null * 2"));
        assertEquals(EvaluationErrorKind.NULL_OPERAND, evalErrorKind("-null"));
    }

    @Test
    @DisplayName("Arithmetic on non-numeric values is rejected")
    void arithmeticOnCollections() {
        assertEquals(EvaluationErrorKind.TYPE_CONVERSION, evalErrorKind("{1} * 2"));
    }

    // =====================================================================
    // Literals
    // =====================================================================

    @Test
    @DisplayName("Literal values keep their Java types")
    void literalTypes() {
        assertEquals(42, eval("42"));
        assertEquals(42L, eval("42L"));
        assertEquals(16, eval("0x10"));
        assertEquals(1.5f, eval("1.5f"));
        assertEquals(1.0, eval("1d"));
        assertEquals(Boolean.TRUE, eval("True"));
        assertNull(eval("null"));
    }

    @Test
    @DisplayName("Doubled quotes inside string literals are escapes")
    void stringEscapes() {
        assertEquals("Tony's Pizza", eval("'Tony''s Pizza'"));
        assertEquals("big \"pizza\" parlor", eval("\"big \"\"pizza\"\" parlor\""));
    }

    // =====================================================================
    // Relational
    // =====================================================================

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '`', value = {
            "1 == 1.0          | true",
            "2 - 1 == 1        | true",
            "1L == 1           | true",
            "'a' == 'a'        | true",
            "null == null      | true",
            "'a' != 'b'        | true",
            "1 != 1            | false",
            "{1,2} == {1,2}    | true",
            "3 > 2             | true",
            "3 >= 3            | true",
            "2 < 1.5           | false",
            "2 le 2            | true",
            "'abc' < 'abd'     | true",
            "'10' > 9          | true",
            "3 gt 2 and 1 lt 2 | true"
    })
    @DisplayName("Comparisons")
    void comparisons(String expression, boolean expected) {
        assertEquals(expected, eval(expression));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '`', value = {
            "{1 + 0} == {1}                   | true",
            "{{1 + 0}, 2} == {{1}, 2L}        | true",
            "{a: 1 + 1} == {a: 2}             | true",
            "new int[]{1 + 1, 3} == {2, 3.0}  | true",
            "{1 + 0} != {1}                   | false",
            "{1, 2} == {1, 2, 3}              | false",
            "{a: 1} == {b: 1}                 | false",
            "{1} == {'1'}                     | false"
    })
    @DisplayName("Collections compare numbers by value at every level")
    void collectionEquality(String expression, boolean expected) {
        assertEquals(expected, eval(expression));
    }

    @Test
    @DisplayName("Incomparable or null operands are rejected")
    void invalidComparisons() {
        assertEquals(EvaluationErrorKind.TYPE_CONVERSION, evalErrorKind("1 < 'x'"));
        assertEquals(EvaluationErrorKind.NULL_OPERAND, evalErrorKind("null > 1"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '`', value = {
            "3 between {1,5}         | true",
            "0 between {1,5}         | false",
            "5 between {1,5}         | true",
            "1 between {1,5}         | true",
            "'c' between {'a','c'}   | true",
            "'d' between {'a','c'}   | false",
            "2.5 BETWEEN {2, 3}      | true"
    })
    @DisplayName("between is inclusive on both bounds")
    void between(String expression, boolean expected) {
        assertEquals(expected, eval(expression));
    }

    @Test
    @DisplayName("between needs a two-element list")
    void betweenNeedsRange() {
        assertEquals(EvaluationErrorKind.TYPE_CONVERSION, evalErrorKind("3 between {1}"));
        assertEquals(EvaluationErrorKind.TYPE_CONVERSION, evalErrorKind("3 between 4"));
    }

    @Test
    @DisplayName("matches requires the whole string to match")
    void matches() {
        assertEquals(true, eval("'abc' matches '[a-c]+'"));
        assertEquals(false, eval("'abcd' matches 'abc'"));
        assertEquals(true, eval("'5.00' MATCHES '^-?\\d+(\\.\\d{2})?$'"));
    }

    @Test
    @DisplayName("An invalid pattern is an evaluation error")
    void invalidPattern() {
        EvaluationException e = assertThrows(EvaluationException.class, () -> eval("'a' matches '['"));

        assertEquals(EvaluationErrorKind.INVALID_PATTERN, e.getKind());
        assertNotNull(e.getCause());
    }

    @Test
    @DisplayName("instanceof checks against a type reference")
    void instanceOf() {
        assertEquals(true, eval("'x' instanceof T(String)"));
        assertEquals(false, eval("1 instanceof T(String)"));
        assertEquals(true, eval("1L instanceof T(Number)"));
        assertEquals(EvaluationErrorKind.TYPE_CONVERSION, evalErrorKind("'x' instanceof 'y'"));
    }

    // =====================================================================
    // Logical
    // =====================================================================

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '`', value = {
            "true and false    | false",
            "true && true      | true",
            "false or true     | true",
            "`false || false`  | false",
            "not true          | false",
            "!false            | true",
            "!0                | true",
            "1 and 'x'         | true",
            "'' or 0           | false"
    })
    @DisplayName("Logical operators on truthiness")
    void logical(String expression, boolean expected) {
        assertEquals(expected, eval(expression));
    }

    @Test
    @DisplayName("and/or do not evaluate the right operand when the left decides")
    void shortCircuit() {
        assertEquals(false, eval("false and 'a' matches '['"));
        assertEquals(true, eval("true or 'a' matches '['"));
        assertEquals(EvaluationErrorKind.INVALID_PATTERN, evalErrorKind("true and 'a' matches '['"));
    }

    @Test
    @DisplayName("Logical operators reject null operands")
    void logicalNull() {
        assertEquals(EvaluationErrorKind.NULL_OPERAND, evalErrorKind("null and true"));
        assertEquals(EvaluationErrorKind.NULL_OPERAND, evalErrorKind("false or null"));
    }

    // =====================================================================
    // Ternary and elvis
    // =====================================================================

    @Test
    @DisplayName("Ternary picks a branch by truthiness")
    void ternary() {
        assertEquals("yes", eval("1 > 0 ? 'yes' : 'no'"));
        assertEquals(2, eval("'' ? 1 : 2"));
        assertEquals("b", eval("false ? 'a' : (true ? 'b' : 'c')"));
    }

    @Test
    @DisplayName("Ternary with a null condition fails")
    void ternaryNullCondition() {
        assertEquals(EvaluationErrorKind.NULL_OPERAND, evalErrorKind("null ? 0 : 1"));
    }

    @Test
    @DisplayName("Elvis falls back on null, empty, false and zero")
    void elvis() {
        assertEquals("Dave", eval("null ?: 'Dave'"));
        assertEquals(3, eval("3 ?: 1"));
        assertEquals(10L, eval("(null ?: 1) * 10"));
        assertEquals("x", eval("'' ?: 'x'"));
        assertEquals(5, eval("0 ?: 5"));
        assertEquals(List.of(), eval("{} ?: 'unused'"));
    }

    @Test
    @DisplayName("Elvis does not evaluate the fallback when the value is kept")
    void elvisFallbackNotEvaluated() {
        assertEquals("a", eval("'a' ?: 'b' matches '['"));
    }
}
