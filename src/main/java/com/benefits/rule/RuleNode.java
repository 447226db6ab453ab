package com.benefits.rule;

import java.util.Arrays;
import java.util.List;

/**
 * A node of a declarative rule tree.
 * <p>
 * A rule tree is exactly one of:
 * <ul>
 *   <li>{@link LiteralNode} - a JSON scalar</li>
 *   <li>{@link VarNode} - a reference into the data context ({@code {"var": "a.b"}})</li>
 *   <li>{@link ListNode} - an ordered list of rule trees</li>
 *   <li>{@link OperationNode} - an operator applied to operands ({@code {"op": [..]}})</li>
 * </ul>
 * Trees are immutable. Code that walks a tree switches on {@link #kind()}.
 */
public interface RuleNode {

    /**
     * Get the shape of this node.
     */
    NodeKind kind();

    static LiteralNode literal(Object value) {
        return new LiteralNode(value);
    }

    static VarNode var(String path) {
        return new VarNode(path, null, false);
    }

    static VarNode var(String path, Object defaultValue) {
        return new VarNode(path, new LiteralNode(defaultValue), true);
    }

    static ListNode list(RuleNode... items) {
        return new ListNode(Arrays.asList(items));
    }

    static OperationNode operation(String operator, RuleNode... operands) {
        return new OperationNode(operator, Arrays.asList(operands), false);
    }

    static OperationNode operation(String operator, List<RuleNode> operands) {
        return new OperationNode(operator, operands, false);
    }

    /**
     * Operation whose single operand is written without an enclosing array.
     */
    static OperationNode unary(String operator, RuleNode operand) {
        return new OperationNode(operator, List.of(operand), true);
    }
}
