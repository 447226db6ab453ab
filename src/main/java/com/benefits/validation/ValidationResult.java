package com.benefits.validation;

import java.util.List;

/**
 * Outcome of static rule validation.
 *
 * @param valid      No CRITICAL or ERROR issues were found
 * @param errors     Fatal issues
 * @param warnings   Advisory issues
 * @param operators  Distinct operator names in first-seen order, excluding {@code var}
 * @param variables  Distinct variable paths in first-seen order
 * @param complexity Complexity score
 * @param depth      Maximum nesting depth of the JSON form
 */
public record ValidationResult(
        boolean valid,
        List<ValidationIssue> errors,
        List<ValidationIssue> warnings,
        List<String> operators,
        List<String> variables,
        int complexity,
        int depth
) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        operators = List.copyOf(operators);
        variables = List.copyOf(variables);
    }

    static ValidationResult structuralFailure(List<ValidationIssue> errors) {
        return new ValidationResult(false, errors, List.of(), List.of(), List.of(), 0, 0);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
