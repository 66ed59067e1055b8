package com.spel.config.expression;

/**
 * Token kinds produced by {@link ExpressionTokenizer}.
 * Kinds without fixed characters carry their text as payload.
 */
public enum TokenKind {

    // Literals
    LITERAL_INT,
    LITERAL_LONG,
    LITERAL_HEXINT,
    LITERAL_HEXLONG,
    LITERAL_STRING,
    LITERAL_REAL,
    LITERAL_REAL_FLOAT,

    // Punctuation
    LPAREN("("),
    RPAREN(")"),
    COMMA(","),
    IDENTIFIER,
    COLON(":"),
    HASH("#"),
    RSQUARE("]"),
    LSQUARE("["),
    LCURLY("{"),
    RCURLY("}"),
    DOT("."),

    // Operators
    PLUS("+"),
    STAR("*"),
    MINUS("-"),
    SELECT_FIRST("^["),
    SELECT_LAST("$["),
    QMARK("?"),
    PROJECT("!["),
    DIV("/"),
    GE(">="),
    GT(">"),
    LE("<="),
    LT("<"),
    EQ("=="),
    NE("!="),
    MOD("%"),
    NOT("!"),
    ASSIGN("="),
    INSTANCEOF("instanceof"),
    MATCHES("matches"),
    BETWEEN("between"),
    SELECT("?["),
    POWER("^"),
    ELVIS("?:"),
    SAFE_NAVI("?."),
    BEAN_REF("@"),
    FACTORY_BEAN_REF("&"),
    SYMBOLIC_OR("||"),
    SYMBOLIC_AND("&&"),
    INC("++"),
    DEC("--");

    private final String tokenChars;

    TokenKind() {
        this("");
    }

    TokenKind(String tokenChars) {
        this.tokenChars = tokenChars;
    }

    /**
     * Whether tokens of this kind carry text beyond the kind itself.
     */
    public boolean hasPayload() {
        return tokenChars.isEmpty();
    }

    public String tokenChars() {
        return tokenChars;
    }

    @Override
    public String toString() {
        return tokenChars.isEmpty() ? name() : name() + "(" + tokenChars + ")";
    }
}
