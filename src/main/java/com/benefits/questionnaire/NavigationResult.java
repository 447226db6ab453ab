package com.benefits.questionnaire;

import java.util.List;

/**
 * Outcome of a navigation call. Failures never change navigation state.
 *
 * @param success          Whether navigation succeeded
 * @param targetNodeId     Node navigated to; null when the flow ended
 * @param previousNodeId   Node navigated from
 * @param error            Failure description, null on success
 * @param branchTaken      A conditional branch decided the move
 * @param branchId         Id of that branch
 * @param questionsSkipped Ids of questions passed over because they were hidden or skipped
 */
public record NavigationResult(
        boolean success,
        String targetNodeId,
        String previousNodeId,
        String error,
        boolean branchTaken,
        String branchId,
        List<String> questionsSkipped
) {

    public NavigationResult {
        questionsSkipped = questionsSkipped == null ? List.of() : List.copyOf(questionsSkipped);
    }

    public static NavigationResult moved(String targetNodeId, String previousNodeId) {
        return new NavigationResult(true, targetNodeId, previousNodeId, null, false, null, List.of());
    }

    public static NavigationResult branched(String targetNodeId, String previousNodeId, String branchId) {
        return new NavigationResult(true, targetNodeId, previousNodeId, null, true, branchId, List.of());
    }

    public static NavigationResult failed(String error, String previousNodeId) {
        return new NavigationResult(false, null, previousNodeId, error, false, null, List.of());
    }

    /**
     * Successful result for a terminal node: there is nowhere further to go.
     */
    public static NavigationResult end(String previousNodeId) {
        return new NavigationResult(true, null, previousNodeId, null, false, null, List.of());
    }

    public boolean reachedEnd() {
        return success && targetNodeId == null;
    }

    NavigationResult withTarget(String newTarget, List<String> skipped) {
        return new NavigationResult(success, newTarget, previousNodeId, error, branchTaken, branchId, skipped);
    }
}
