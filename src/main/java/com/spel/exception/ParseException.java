package com.spel.exception;

/**
 * Exception thrown when an expression cannot be tokenized or parsed.
 * No partial tree is ever returned alongside it.
 */
public class ParseException extends ExpressionException {

    private final ParseErrorKind kind;
    private final int position;
    private final String expressionString;

    public ParseException(ParseErrorKind kind, String expressionString, int position, String message) {
        super(format(expressionString, position, message));
        this.kind = kind;
        this.position = position;
        this.expressionString = expressionString;
    }

    public ParseException(ParseErrorKind kind, String expressionString, int position, String message,
                          Throwable cause) {
        super(format(expressionString, position, message), cause);
        this.kind = kind;
        this.position = position;
        this.expressionString = expressionString;
    }

    public ParseErrorKind getKind() {
        return kind;
    }

    /**
     * Offset of the offending character or token, or -1 when no position applies.
     */
    public int getPosition() {
        return position;
    }

    public String getExpressionString() {
        return expressionString;
    }

    private static String format(String expressionString, int position, String message) {
        if (position < 0) {
            return "Invalid expression: " + message;
        }
        return "Invalid expression at position " + position + ": " + message + " in '" + expressionString + "'";
    }
}
