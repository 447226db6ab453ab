package com.benefits.eligibility;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Eligibility outcomes for one profile across several programs.
 *
 * @param profileId       Profile evaluated
 * @param results         Results keyed by program id, in evaluation order
 * @param summary         Counts over the results
 * @param totalTimeMillis Time spent on the whole batch
 */
public record BatchEligibilityResult(
        String profileId,
        Map<String, EligibilityEvaluationResult> results,
        Summary summary,
        double totalTimeMillis
) {

    public BatchEligibilityResult {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public static BatchEligibilityResult of(String profileId, Map<String, EligibilityEvaluationResult> results,
                                            double totalTimeMillis) {
        return new BatchEligibilityResult(profileId, results, Summary.of(results), totalTimeMillis);
    }

    public record Summary(int total, int eligible, int ineligible, int incomplete, int needsReview) {

        static Summary of(Map<String, EligibilityEvaluationResult> results) {
            int eligible = 0;
            int incomplete = 0;
            int needsReview = 0;
            for (EligibilityEvaluationResult result : results.values()) {
                if (result.eligible()) {
                    eligible++;
                }
                if (result.incomplete()) {
                    incomplete++;
                }
                if (result.needsReview()) {
                    needsReview++;
                }
            }
            return new Summary(results.size(), eligible, results.size() - eligible, incomplete, needsReview);
        }
    }
}
