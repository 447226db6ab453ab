package com.benefits.questionnaire;

import com.benefits.rule.RuleNode;

import java.util.List;
import java.util.Objects;

/**
 * A question shown to the user.
 *
 * @param id        Question id
 * @param text      Prompt text
 * @param fieldName Answer key in the data context
 * @param inputType Kind of input
 * @param required  Whether an answer is required
 * @param showIf    Visibility condition, null for always visible
 * @param options   Choices for select inputs
 * @param min       Lower bound for numeric inputs, null for none
 * @param max       Upper bound for numeric inputs, null for none
 */
public record Question(
        String id,
        String text,
        String fieldName,
        InputType inputType,
        boolean required,
        RuleNode showIf,
        List<String> options,
        Double min,
        Double max
) {

    public Question {
        Objects.requireNonNull(id, "id");
        inputType = inputType == null ? InputType.TEXT : inputType;
        options = options == null ? List.of() : List.copyOf(options);
    }

    public static Question of(String id, String text, String fieldName, boolean required) {
        return of(id, text, fieldName, InputType.TEXT, required);
    }

    public static Question of(String id, String text, String fieldName, InputType inputType, boolean required) {
        return new Question(id, text, fieldName, inputType, required, null, List.of(), null, null);
    }

    public Question withShowIf(RuleNode condition) {
        return new Question(id, text, fieldName, inputType, required, condition, options, min, max);
    }

    public Question withOptions(List<String> choices) {
        return new Question(id, text, fieldName, inputType, required, showIf, choices, min, max);
    }

    public Question withBounds(Double lower, Double upper) {
        return new Question(id, text, fieldName, inputType, required, showIf, options, lower, upper);
    }
}
