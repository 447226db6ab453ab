package com.benefits.questionnaire;

import com.benefits.rule.RuleNode;

import java.util.Objects;

/**
 * Conditional transition out of a node. Among true branches the highest priority wins;
 * equal priorities resolve to the first declared.
 */
public record FlowBranch(String id, RuleNode condition, String targetId, int priority, String description) {

    public FlowBranch {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(targetId, "targetId");
    }

    public static FlowBranch of(String id, RuleNode condition, String targetId, int priority) {
        return new FlowBranch(id, condition, targetId, priority, null);
    }
}
