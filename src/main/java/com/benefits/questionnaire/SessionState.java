package com.benefits.questionnaire;

public enum SessionState {
    NOT_STARTED,
    IN_PROGRESS,
    PAUSED,
    COMPLETED
}
