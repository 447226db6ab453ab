package com.benefits.eligibility;

import com.benefits.evaluation.CriterionResult;

import java.time.Instant;
import java.util.List;

/**
 * Eligibility outcome for one profile and one program.
 *
 * @param profileId           Profile evaluated
 * @param programId           Program evaluated
 * @param ruleId              Rule whose outcome explains the result ("error" when evaluation failed)
 * @param ruleVersion         Version of that rule
 * @param eligible            Every active rule passed
 * @param confidence          0 when the explaining rule errored, 50 when data was missing, else 95
 * @param reason              Plain-language reason
 * @param criteriaResults     Criteria of the explaining rule
 * @param missingFields       Required fields absent from the profile
 * @param requiredDocuments   Documents required by the explaining rule
 * @param needsReview         Evaluation errored or data was incomplete
 * @param incomplete          Required data was missing
 * @param evaluatedAt         Evaluation time
 * @param executionTimeMillis Time spent evaluating
 */
public record EligibilityEvaluationResult(
        String profileId,
        String programId,
        String ruleId,
        String ruleVersion,
        boolean eligible,
        int confidence,
        String reason,
        List<CriterionResult> criteriaResults,
        List<String> missingFields,
        List<String> requiredDocuments,
        boolean needsReview,
        boolean incomplete,
        Instant evaluatedAt,
        double executionTimeMillis
) {

    public static final int CONFIDENCE_ERROR = 0;
    public static final int CONFIDENCE_INCOMPLETE = 50;
    public static final int CONFIDENCE_COMPLETE = 95;

    public EligibilityEvaluationResult {
        criteriaResults = criteriaResults == null ? List.of() : List.copyOf(criteriaResults);
        missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
        requiredDocuments = requiredDocuments == null ? List.of() : List.copyOf(requiredDocuments);
    }

    /**
     * Best-effort result for a failed evaluation.
     */
    public static EligibilityEvaluationResult error(String profileId, String programId, String reason,
                                                    Instant evaluatedAt, double executionTimeMillis) {
        return new EligibilityEvaluationResult(profileId, programId, "error", null, false, CONFIDENCE_ERROR,
                reason, List.of(), List.of(), List.of(), true, true, evaluatedAt, executionTimeMillis);
    }

    public boolean isError() {
        return "error".equals(ruleId);
    }
}
