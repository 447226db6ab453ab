package com.benefits.questionnaire;

/**
 * Per-question state within a session.
 */
public record QuestionState(
        String questionId,
        QuestionStatus status,
        Object answer,
        boolean visible,
        boolean visited,
        int visitCount
) {

    public static QuestionState pending(String questionId) {
        return new QuestionState(questionId, QuestionStatus.PENDING, null, true, false, 0);
    }

    public QuestionState withStatus(QuestionStatus newStatus) {
        return new QuestionState(questionId, newStatus, answer, visible, visited, visitCount);
    }

    public QuestionState visit() {
        return new QuestionState(questionId, QuestionStatus.CURRENT, answer, visible, true, visitCount + 1);
    }

    public QuestionState answered(Object value) {
        return new QuestionState(questionId, QuestionStatus.ANSWERED, value, visible, true, visitCount);
    }

    public QuestionState withVisible(boolean isVisible) {
        return new QuestionState(questionId, status, answer, isVisible, visited, visitCount);
    }
}
