package com.benefits.questionnaire;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Holds skip rules for a flow, ordered by priority (highest first).
 */
public class SkipLogicManager {

    private final FlowEngine engine;
    private final List<SkipRule> rules = new ArrayList<>();

    public SkipLogicManager(FlowEngine engine) {
        this.engine = engine;
    }

    public synchronized void addRule(SkipRule rule) {
        rules.removeIf(existing -> existing.id().equals(rule.id()));
        rules.add(rule);
        rules.sort(Comparator.comparingInt(SkipRule::priority).reversed());
    }

    public synchronized boolean removeRule(String ruleId) {
        return rules.removeIf(rule -> rule.id().equals(ruleId));
    }

    public synchronized List<SkipRule> getRules() {
        return Collections.unmodifiableList(new ArrayList<>(rules));
    }

    /**
     * Union of the question ids of every rule whose condition holds.
     */
    public Set<String> questionsToSkip(Map<String, Object> context) {
        Set<String> skipped = new LinkedHashSet<>();
        for (SkipRule rule : getRules()) {
            if (engine.evaluateCondition(rule.condition(), context).met()) {
                skipped.addAll(rule.questionIds());
            }
        }
        return skipped;
    }

    public boolean shouldSkipQuestion(String questionId, Map<String, Object> context) {
        return questionsToSkip(context).contains(questionId);
    }
}
