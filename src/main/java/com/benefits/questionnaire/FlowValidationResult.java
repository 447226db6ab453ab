package com.benefits.questionnaire;

import java.util.List;

/**
 * Structural check of a flow.
 *
 * @param valid              No errors were found
 * @param errors             Missing start, dangling targets, missing field names and cycles
 * @param warnings           Unreachable nodes
 * @param orphanedNodes      Nodes not reachable from the start node
 * @param circularReferences Cycles, rendered as {@code a -> b -> a}
 * @param missingTargets     Referenced node ids that do not exist
 */
public record FlowValidationResult(
        boolean valid,
        List<FlowIssue> errors,
        List<FlowIssue> warnings,
        List<String> orphanedNodes,
        List<String> circularReferences,
        List<String> missingTargets
) {

    public FlowValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        orphanedNodes = List.copyOf(orphanedNodes);
        circularReferences = List.copyOf(circularReferences);
        missingTargets = List.copyOf(missingTargets);
    }
}
