package com.spel.exception;

/**
 * Categories of evaluation failures.
 */
public enum EvaluationErrorKind {
    TYPE_CONVERSION,
    INVALID_PATTERN,
    NULL_OPERAND,
    UNRESOLVABLE_REFERENCE,
    INDEX_OUT_OF_BOUNDS,
    NOT_ASSIGNABLE,
    UNSUPPORTED_OPERATION
}
