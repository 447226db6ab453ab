package com.benefits.questionnaire;

import java.util.List;
import java.util.Objects;

/**
 * A node of the flow graph holding one question.
 *
 * @param id       Node id
 * @param question Question shown at this node
 * @param nextId   Default successor, null if none
 * @param branches Conditional successors, checked before the default
 * @param terminal Whether the flow ends here
 */
public record FlowNode(String id, Question question, String nextId, List<FlowBranch> branches, boolean terminal) {

    public FlowNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(question, "question");
        branches = branches == null ? List.of() : List.copyOf(branches);
    }

    public static FlowNode of(String id, Question question, String nextId) {
        return new FlowNode(id, question, nextId, List.of(), false);
    }

    public static FlowNode terminal(String id, Question question) {
        return new FlowNode(id, question, null, List.of(), true);
    }

    public FlowNode withBranches(List<FlowBranch> newBranches) {
        return new FlowNode(id, question, nextId, newBranches, terminal);
    }
}
