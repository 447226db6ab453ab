package com.benefits.questionnaire;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnswerValidatorTest {

    private static Question required(InputType type) {
        return Question.of("q", "Question", "field", type, true);
    }

    private static Question optional(InputType type) {
        return Question.of("q", "Question", "field", type, false);
    }

    // =====================================================================
    // Missing answers
    // =====================================================================

    @Test
    @DisplayName("Missing answers fail only for required questions")
    void missingAnswers() {
        assertEquals(List.of("This field is required"), AnswerValidator.validate(required(InputType.TEXT), null));
        assertEquals(List.of("This field is required"), AnswerValidator.validate(required(InputType.TEXT), "  "));
        assertEquals(List.of("This field is required"),
                AnswerValidator.validate(required(InputType.MULTISELECT), List.of()));

        assertTrue(AnswerValidator.validate(optional(InputType.NUMBER), null).isEmpty());
        assertTrue(AnswerValidator.validate(optional(InputType.DATE), "").isEmpty());
    }

    // =====================================================================
    // Numbers
    // =====================================================================

    @Test
    @DisplayName("Numbers respect their bounds")
    void numberBounds() {
        Question age = required(InputType.NUMBER).withBounds(0.0, 120.0);

        assertTrue(AnswerValidator.validate(age, 34).isEmpty());
        assertTrue(AnswerValidator.validate(age, 120).isEmpty());
        assertEquals(List.of("Value must be at least 0"), AnswerValidator.validate(age, -1));
        assertEquals(List.of("Value must be at most 120"), AnswerValidator.validate(age, 121.5));
        assertEquals(List.of("Please enter a number"), AnswerValidator.validate(age, "34"));
    }

    @Test
    @DisplayName("Currency defaults to a lower bound of zero")
    void currency() {
        Question income = required(InputType.CURRENCY);

        assertTrue(AnswerValidator.validate(income, 2500.50).isEmpty());
        assertEquals(List.of("Amount must be at least $0"), AnswerValidator.validate(income, -0.01));
        assertEquals(List.of("Please enter an amount"), AnswerValidator.validate(income, Double.NaN));
        assertEquals(List.of("Amount must be at most $1.5"),
                AnswerValidator.validate(income.withBounds(null, 1.5), 2));
    }

    // =====================================================================
    // Other input types
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Dates must parse")
    @ValueSource(strings = {"1990-05-20", "1990-05-20T08:00:00Z", "1990-05-20T08:00:00+02:00"})
    void validDates(String value) {
        assertTrue(AnswerValidator.validate(required(InputType.DATE), value).isEmpty());
    }

    @Test
    @DisplayName("Unparseable dates are rejected")
    void invalidDate() {
        assertEquals(List.of("Please enter a valid date"),
                AnswerValidator.validate(required(InputType.DATE), "next tuesday"));
        assertTrue(AnswerValidator.validate(required(InputType.DATE), LocalDate.of(2000, 1, 1)).isEmpty());
    }

    @Test
    @DisplayName("Booleans and text check the value's type")
    void booleanAndText() {
        assertTrue(AnswerValidator.validate(required(InputType.BOOLEAN), false).isEmpty());
        assertEquals(List.of("Please select an option"), AnswerValidator.validate(required(InputType.BOOLEAN), "true"));
        assertTrue(AnswerValidator.validate(required(InputType.TEXT), "Sam").isEmpty());
        assertEquals(List.of("Please enter text"), AnswerValidator.validate(required(InputType.TEXT), 42));
    }

    @Test
    @DisplayName("Selections must come from the options")
    void selections() {
        Question period = required(InputType.SELECT).withOptions(List.of("monthly", "annual"));
        Question benefits = required(InputType.MULTISELECT).withOptions(List.of("snap", "wic", "tanf"));

        assertTrue(AnswerValidator.validate(period, "annual").isEmpty());
        assertEquals(List.of("Please select a valid option"), AnswerValidator.validate(period, "weekly"));
        assertTrue(AnswerValidator.validate(benefits, List.of("snap", "wic")).isEmpty());
        assertEquals(List.of("Not a valid option: medicaid"),
                AnswerValidator.validate(benefits, List.of("snap", "medicaid")));
        assertEquals(List.of("Please select one or more options"), AnswerValidator.validate(benefits, "snap"));
    }

    @Test
    @DisplayName("Without options any string is a valid selection")
    void openSelect() {
        assertTrue(AnswerValidator.validate(required(InputType.SELECT), "anything").isEmpty());
    }
}
