package com.spel.exception;

/**
 * Exception thrown when a parsed expression cannot be evaluated.
 * The parsed tree is unaffected, so evaluation may be retried with other inputs.
 */
public class EvaluationException extends ExpressionException {

    private final EvaluationErrorKind kind;

    public EvaluationException(EvaluationErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EvaluationException(EvaluationErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public EvaluationErrorKind getKind() {
        return kind;
    }
}
