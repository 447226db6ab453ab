package com.benefits.validation;

/**
 * A single validation finding.
 *
 * @param code     Issue classification
 * @param message  Human-readable description
 * @param severity CRITICAL or ERROR make the rule invalid, WARNING does not
 * @param pointer  JSON pointer of the offending node, empty when not tied to one
 */
public record ValidationIssue(IssueCode code, String message, Severity severity, String pointer) {

    public static ValidationIssue critical(IssueCode code, String message, String pointer) {
        return new ValidationIssue(code, message, Severity.CRITICAL, pointer);
    }

    public static ValidationIssue error(IssueCode code, String message) {
        return new ValidationIssue(code, message, Severity.ERROR, "");
    }

    public static ValidationIssue warning(IssueCode code, String message) {
        return new ValidationIssue(code, message, Severity.WARNING, "");
    }

    public boolean isFatal() {
        return severity != Severity.WARNING;
    }
}
