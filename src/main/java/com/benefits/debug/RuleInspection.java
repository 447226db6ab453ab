package com.benefits.debug;

import java.util.List;
import java.util.Map;

/**
 * Static overview of a rule: structure, validation outcome, usage counts and suggestions.
 */
public record RuleInspection(
        List<String> operators,
        List<String> variables,
        int depth,
        int complexity,
        boolean valid,
        List<String> errors,
        List<String> warnings,
        Map<String, Integer> variableUsage,
        Map<String, Integer> operatorUsage,
        List<String> suggestions
) {
}
