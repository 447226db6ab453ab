package com.benefits.rule;

/**
 * The closed set of rule tree node shapes.
 */
public enum NodeKind {
    LITERAL,
    VARIABLE,
    LIST,
    OPERATION
}
