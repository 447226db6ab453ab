package com.benefits.validation;

/**
 * Validation issue classification.
 */
public enum IssueCode {
    INVALID_STRUCTURE,
    UNKNOWN_OPERATOR,
    DISALLOWED_OPERATOR,
    MAX_DEPTH_EXCEEDED,
    MAX_COMPLEXITY_EXCEEDED,
    COMPLEXITY_WARNING,
    MISSING_REQUIRED_VARIABLE
}
