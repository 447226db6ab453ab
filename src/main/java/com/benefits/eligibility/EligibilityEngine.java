package com.benefits.eligibility;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Determines program eligibility for a profile.
 * <p>
 * Returned futures never complete exceptionally: every failure becomes an error result
 * ({@code eligible=false, confidence=0, needsReview=true}).
 */
public interface EligibilityEngine {

    /**
     * Evaluate one program.
     *
     * @param profileId Profile to evaluate
     * @param programId Program to evaluate against
     * @return Result for the program
     */
    CompletableFuture<EligibilityEvaluationResult> evaluateEligibility(String profileId, String programId);

    /**
     * Evaluate several programs. A failure in one program does not affect the others.
     */
    CompletableFuture<BatchEligibilityResult> evaluateMultiplePrograms(String profileId, List<String> programIds);

    /**
     * Evaluate every active program.
     */
    CompletableFuture<BatchEligibilityResult> evaluateAllPrograms(String profileId);
}
