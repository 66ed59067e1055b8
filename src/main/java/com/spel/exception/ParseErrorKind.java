package com.spel.exception;

/**
 * Categories of tokenizer and parser failures.
 */
public enum ParseErrorKind {

    // Lexical
    UNSUPPORTED_CHARACTER,
    UNEXPECTED_ESCAPE_CHAR,
    MISSING_CHARACTER,
    NON_TERMINATING_QUOTED_STRING,
    NON_TERMINATING_DOUBLE_QUOTED_STRING,
    NOT_AN_INTEGER,
    NOT_A_LONG,
    NOT_A_REAL,
    REAL_CANNOT_BE_LONG,

    // Grammar
    UNEXPECTED_TOKEN,
    MISSING_TOKEN,
    UNEXPECTED_DATA_AFTER_EXPRESSION,

    // Facade
    EXPRESSION_TOO_LONG,
    EMPTY_EXPRESSION,
    TEMPLATE_SUFFIX_MISSING,
    TEMPLATE_EXPRESSION_EMPTY
}
