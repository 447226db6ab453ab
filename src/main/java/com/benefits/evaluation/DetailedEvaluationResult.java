package com.benefits.evaluation;

import com.benefits.exception.EvaluationErrorCode;
import com.benefits.operator.Values;

import java.util.List;

/**
 * Rule evaluation outcome with a per-criterion breakdown.
 */
public record DetailedEvaluationResult(
        Object result,
        boolean success,
        double executionTimeMillis,
        String error,
        EvaluationErrorCode errorCode,
        List<CriterionResult> criteriaResults,
        String explanation
) {

    public DetailedEvaluationResult {
        criteriaResults = List.copyOf(criteriaResults);
    }

    public boolean passed() {
        return success && Values.truthy(result);
    }

    public List<CriterionResult> failedCriteria() {
        return criteriaResults.stream().filter(c -> !c.met()).toList();
    }
}
