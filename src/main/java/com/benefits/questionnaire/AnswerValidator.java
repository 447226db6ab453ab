package com.benefits.questionnaire;

import com.benefits.operator.BenefitOperators;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Checks an answer against its question's {@link InputType}.
 * <p>
 * A missing answer (null, blank text or an empty selection) passes for optional questions
 * and fails for required ones. Currency amounts have an implicit lower bound of zero.
 */
public final class AnswerValidator {

    static final String REQUIRED = "This field is required";

    private AnswerValidator() {
    }

    /**
     * @return error messages, empty when the answer is acceptable
     */
    public static List<String> validate(Question question, Object value) {
        if (isEmpty(value)) {
            return question.required() ? List.of(REQUIRED) : List.of();
        }
        List<String> errors = new ArrayList<>();
        switch (question.inputType()) {
            case TEXT -> {
                if (!(value instanceof String)) {
                    errors.add("Please enter text");
                }
            }
            case NUMBER -> checkNumber(value, question.min(), question.max(),
                    "Please enter a number", "Value", "", errors);
            case CURRENCY -> checkNumber(value, question.min() == null ? 0.0 : question.min(), question.max(),
                    "Please enter an amount", "Amount", "$", errors);
            case DATE -> {
                if (!(value instanceof LocalDate) && BenefitOperators.parseDate(value).isEmpty()) {
                    errors.add("Please enter a valid date");
                }
            }
            case BOOLEAN -> {
                if (!(value instanceof Boolean)) {
                    errors.add("Please select an option");
                }
            }
            case SELECT -> {
                if (!(value instanceof String choice) || !allowed(question, choice)) {
                    errors.add("Please select a valid option");
                }
            }
            case MULTISELECT -> {
                if (!(value instanceof Collection<?> choices)) {
                    errors.add("Please select one or more options");
                } else {
                    for (Object choice : choices) {
                        if (!(choice instanceof String text) || !allowed(question, text)) {
                            errors.add("Not a valid option: " + choice);
                        }
                    }
                }
            }
        }
        return errors;
    }

    private static void checkNumber(Object value, Double min, Double max, String typeError,
                                    String label, String unit, List<String> errors) {
        if (!(value instanceof Number number) || Double.isNaN(number.doubleValue())) {
            errors.add(typeError);
            return;
        }
        double amount = number.doubleValue();
        if (min != null && amount < min) {
            errors.add(label + " must be at least " + unit + plain(min));
        }
        if (max != null && amount > max) {
            errors.add(label + " must be at most " + unit + plain(max));
        }
    }

    // Options list empty means any value is accepted.
    private static boolean allowed(Question question, String choice) {
        return question.options().isEmpty() || question.options().contains(choice);
    }

    private static boolean isEmpty(Object value) {
        return value == null
                || value instanceof String text && text.isBlank()
                || value instanceof Collection<?> items && items.isEmpty();
    }

    private static String plain(double bound) {
        return bound == Math.rint(bound) && !Double.isInfinite(bound)
                ? Long.toString((long) bound)
                : Double.toString(bound);
    }
}
