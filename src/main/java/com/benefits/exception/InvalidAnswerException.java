package com.benefits.exception;

import java.util.List;

/**
 * Exception thrown when an answer does not fit its question's input type.
 */
public class InvalidAnswerException extends BenefitsException {

    private final String questionId;
    private final List<String> errors;

    public InvalidAnswerException(String questionId, List<String> errors) {
        super("Invalid answer for " + questionId + ": " + String.join("; ", errors));
        this.questionId = questionId;
        this.errors = List.copyOf(errors);
    }

    public String getQuestionId() {
        return questionId;
    }

    public List<String> getErrors() {
        return errors;
    }
}
