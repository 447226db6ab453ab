package com.benefits.questionnaire;

/**
 * A problem found in a flow definition.
 *
 * @param nodeId  Offending node, null for flow-level issues
 * @param message Description
 */
public record FlowIssue(String nodeId, String message) {

    @Override
    public String toString() {
        return nodeId == null ? message : nodeId + ": " + message;
    }
}
