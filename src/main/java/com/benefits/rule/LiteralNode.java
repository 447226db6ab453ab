package com.benefits.rule;

/**
 * JSON scalar literal: String, Number, Boolean or null.
 *
 * @param value Literal value, may be null
 */
public record LiteralNode(Object value) implements RuleNode {

    public LiteralNode {
        if (value != null
                && !(value instanceof String)
                && !(value instanceof Number)
                && !(value instanceof Boolean)) {
            throw new IllegalArgumentException("Literal must be a JSON scalar, got " + value.getClass().getName());
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LITERAL;
    }
}
