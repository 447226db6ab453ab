package com.benefits.questionnaire;

import com.benefits.rule.RuleNode;

import java.util.List;
import java.util.Objects;

/**
 * Skips a set of questions while its condition holds.
 */
public record SkipRule(String id, RuleNode condition, List<String> questionIds, String description, int priority) {

    public SkipRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(condition, "condition");
        questionIds = questionIds == null ? List.of() : List.copyOf(questionIds);
    }

    public static SkipRule of(String id, RuleNode condition, List<String> questionIds) {
        return new SkipRule(id, condition, questionIds, null, 0);
    }
}
