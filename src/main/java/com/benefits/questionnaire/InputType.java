package com.benefits.questionnaire;

/**
 * Answer input kinds.
 */
public enum InputType {
    TEXT,
    NUMBER,
    CURRENCY,
    DATE,
    BOOLEAN,
    SELECT,
    MULTISELECT;

    public static InputType fromString(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        return InputType.valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
