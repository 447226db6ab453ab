package com.benefits.expression;

import com.benefits.exception.EvaluationErrorCode;
import com.benefits.operator.Values;

/**
 * Outcome of a single rule evaluation.
 *
 * @param result              Evaluated value ({@code false} when evaluation failed)
 * @param success             Whether evaluation completed without error
 * @param error               Error message, null on success
 * @param errorCode           Error classification, null on success
 * @param executionTimeMillis Wall time in milliseconds (0 when not measured)
 * @param context             Data context, when captured
 */
public record RuleEvaluationResult(
        Object result,
        boolean success,
        String error,
        EvaluationErrorCode errorCode,
        double executionTimeMillis,
        Object context
) {

    public static RuleEvaluationResult success(Object result, double executionTimeMillis, Object context) {
        return new RuleEvaluationResult(result, true, null, null, executionTimeMillis, context);
    }

    public static RuleEvaluationResult failure(String error, EvaluationErrorCode code,
                                               double executionTimeMillis, Object context) {
        return new RuleEvaluationResult(false, false, error, code, executionTimeMillis, context);
    }

    /**
     * Whether evaluation succeeded and produced a truthy value.
     */
    public boolean passed() {
        return success && Values.truthy(result);
    }
}
