package com.benefits.config;

import com.benefits.progress.FlowSection;
import com.benefits.questionnaire.QuestionFlow;
import com.benefits.questionnaire.SkipRule;

import java.util.List;

/**
 * A questionnaire flow together with its skip rules and report sections.
 */
public record FlowDefinition(QuestionFlow flow, List<SkipRule> skipRules, List<FlowSection> sections) {

    public FlowDefinition {
        skipRules = List.copyOf(skipRules);
        sections = List.copyOf(sections);
    }
}
