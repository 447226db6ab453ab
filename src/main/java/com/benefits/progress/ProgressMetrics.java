package com.benefits.progress;

/**
 * Snapshot of questionnaire progress.
 *
 * @param totalQuestions                Visible questions
 * @param requiredQuestions             Visible required questions
 * @param answeredQuestions             Visible questions with an answer
 * @param skippedQuestions              Visible questions explicitly skipped
 * @param remainingQuestions            Visible questions neither answered nor skipped
 * @param currentQuestionPosition       1-based position of the current question, 0 if unknown
 * @param progressPercent               Blended progress, 0..100
 * @param requiredProgressPercent       Share of required questions answered, 0..100
 * @param estimatedTimeRemainingSeconds Remaining questions times the average answer time
 */
public record ProgressMetrics(
        int totalQuestions,
        int requiredQuestions,
        int answeredQuestions,
        int skippedQuestions,
        int remainingQuestions,
        int currentQuestionPosition,
        int progressPercent,
        int requiredProgressPercent,
        long estimatedTimeRemainingSeconds
) {
}
