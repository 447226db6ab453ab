package com.benefits.questionnaire;

public enum QuestionStatus {
    PENDING,
    CURRENT,
    ANSWERED,
    SKIPPED,
    HIDDEN
}
