package com.benefits.evaluation;

/**
 * One checkable sub-condition of a rule and how the data fared against it.
 *
 * @param criterion  Variable path being tested
 * @param met        Whether the comparison held
 * @param value      Value found in the data
 * @param threshold  Value compared against; a two-element list for ranges
 * @param comparison Comparison symbol, e.g. {@code <=}
 * @param message    Plain-language description of the outcome
 */
public record CriterionResult(
        String criterion,
        boolean met,
        Object value,
        Object threshold,
        String comparison,
        String message
) {

    /**
     * Criterion derived from a required field when the rule itself yielded none.
     */
    public static CriterionResult fromField(String field, Object value, boolean met) {
        return new CriterionResult(field, met, value, null, null, null);
    }
}
