package com.benefits.rule;

import java.util.List;
import java.util.Objects;

/**
 * Operator applied to zero or more operands.
 *
 * @param operator Operator name (never "var")
 * @param operands Operand trees
 * @param unary    Whether the single operand was written without an enclosing array
 */
public record OperationNode(String operator, List<RuleNode> operands, boolean unary) implements RuleNode {

    public OperationNode {
        Objects.requireNonNull(operator, "operator");
        operands = List.copyOf(operands);
        if (unary && operands.size() != 1) {
            throw new IllegalArgumentException("Unary operation must have exactly one operand");
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OPERATION;
    }

    public RuleNode operand(int index) {
        return operands.get(index);
    }

    public int arity() {
        return operands.size();
    }
}
