package com.benefits.debug;

import java.util.List;

/**
 * The same rule evaluated against two data contexts.
 *
 * @param result1     Result for the first context
 * @param result2     Result for the second context
 * @param same        Whether both results are equal
 * @param differences Top-level fields whose values differ between the contexts
 */
public record EvaluationComparison(Object result1, Object result2, boolean same, List<FieldDifference> differences) {

    public record FieldDifference(String field, Object value1, Object value2) {
    }
}
