package com.spel.config.expression;

import java.util.Map;

/**
 * Lexical constants: operator characters and the textual operator aliases.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Identifiers that are re-kinded as operators by the tokenizer. Sorted for binary search.
     * {@code and}, {@code or}, {@code matches} and {@code instanceof} are read contextually by the parser instead.
     */
    public static final String[] ALTERNATIVE_OPERATOR_NAMES = {
            "BETWEEN", "DIV", "EQ", "GE", "GT", "LE", "LT", "MOD", "NE", "NOT"
    };

    public static final Map<String, TokenKind> ALTERNATIVE_OPERATORS = Map.ofEntries(
            Map.entry("BETWEEN", TokenKind.BETWEEN),
            Map.entry("DIV", TokenKind.DIV),
            Map.entry("EQ", TokenKind.EQ),
            Map.entry("GE", TokenKind.GE),
            Map.entry("GT", TokenKind.GT),
            Map.entry("LE", TokenKind.LE),
            Map.entry("LT", TokenKind.LT),
            Map.entry("MOD", TokenKind.MOD),
            Map.entry("NE", TokenKind.NE),
            Map.entry("NOT", TokenKind.NOT)
    );

    /**
     * Keyword-like identifiers interpreted by the parser.
     */
    public static final class Keywords {
        public static final String AND = "and";
        public static final String OR = "or";
        public static final String MATCHES = "matches";
        public static final String INSTANCEOF = "instanceof";
        public static final String BETWEEN = "between";
        public static final String TRUE = "true";
        public static final String FALSE = "false";
        public static final String NULL = "null";
        public static final String NEW = "new";
        public static final String TYPE = "T";

        private Keywords() {
        }
    }

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char SENTINEL = '\0';
        public static final char PLUS = '+';
        public static final char MINUS = '-';
        public static final char STAR = '*';
        public static final char SLASH = '/';
        public static final char PERCENT = '%';
        public static final char CARET = '^';
        public static final char BANG = '!';
        public static final char EQUALS = '=';
        public static final char AMPERSAND = '&';
        public static final char PIPE = '|';
        public static final char QUESTION = '?';
        public static final char DOLLAR = '$';
        public static final char GREATER = '>';
        public static final char LESS = '<';
        public static final char COLON = ':';
        public static final char DOT = '.';
        public static final char COMMA = ',';
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';
        public static final char LEFT_BRACE = '{';
        public static final char RIGHT_BRACE = '}';
        public static final char HASH = '#';
        public static final char AT = '@';
        public static final char UNDERSCORE = '_';
        public static final char QUOTE_SINGLE = '\'';
        public static final char QUOTE_DOUBLE = '"';
        public static final char BACKSLASH = '\\';

        private Operators() {
        }
    }
}
