package com.spel.ast;

/**
 * Value kinds a {@link Literal} can hold. Hexadecimal literals fold into INT and LONG.
 */
public enum LiteralKind {
    INT,
    LONG,
    REAL,
    FLOAT,
    STRING,
    BOOLEAN,
    NULL
}
