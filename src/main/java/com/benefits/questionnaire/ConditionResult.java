package com.benefits.questionnaire;

/**
 * Outcome of a flow condition.
 *
 * @param met                 Condition held; false when evaluation failed
 * @param error               Evaluation error, null when none
 * @param evaluationTimeMillis Evaluation time
 */
public record ConditionResult(boolean met, String error, double evaluationTimeMillis) {
}
