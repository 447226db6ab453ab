package com.benefits.exception;

/**
 * Reason codes attached to evaluation failures.
 */
public enum EvaluationErrorCode {
    INVALID_RULE,
    INVALID_DATA,
    UNKNOWN_OPERATOR,
    OPERATOR_ERROR,
    MAX_DEPTH_EXCEEDED,
    UNKNOWN
}
