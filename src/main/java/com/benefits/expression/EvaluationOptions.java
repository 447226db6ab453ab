package com.benefits.expression;

/**
 * Options for {@link RuleEvaluator}.
 *
 * @param strict         Propagate evaluation errors instead of returning a failed result
 * @param measureTime    Record execution time
 * @param captureContext Attach the data context to the result
 */
public record EvaluationOptions(boolean strict, boolean measureTime, boolean captureContext) {

    public static EvaluationOptions defaults() {
        return new EvaluationOptions(false, true, false);
    }

    public static EvaluationOptions strictMode() {
        return new EvaluationOptions(true, true, false);
    }

    public EvaluationOptions withCaptureContext(boolean capture) {
        return new EvaluationOptions(strict, measureTime, capture);
    }
}
