package com.spel.config.expression;

/**
 * A lexeme produced by the tokenizer.
 *
 * @param kind  Token kind
 * @param data  Source text for payload kinds and textual operators, otherwise null
 * @param start Offset of the first character
 * @param end   Offset one past the last character
 */
public record Token(TokenKind kind, String data, int start, int end) {

    public Token(TokenKind kind, int start, int end) {
        this(kind, null, start, end);
    }

    public boolean isIdentifier() {
        return kind == TokenKind.IDENTIFIER;
    }

    /**
     * Whether this is an identifier spelling the given word, ignoring case.
     */
    public boolean isIdentifier(String word) {
        return kind == TokenKind.IDENTIFIER && data != null && data.equalsIgnoreCase(word);
    }

    /**
     * Same span, re-kinded. Used when the parser reads a keyword-like identifier as an operator.
     */
    public Token as(TokenKind newKind) {
        return new Token(newKind, data, start, end);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[").append(kind);
        if (kind.hasPayload() && data != null) {
            sb.append(':').append(data);
        }
        return sb.append("](").append(start).append(',').append(end).append(')').toString();
    }
}
