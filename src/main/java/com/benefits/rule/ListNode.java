package com.benefits.rule;

import java.util.List;

/**
 * Ordered list of rule trees.
 *
 * @param items List elements
 */
public record ListNode(List<RuleNode> items) implements RuleNode {

    public ListNode {
        items = List.copyOf(items);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIST;
    }
}
