package com.benefits.rule;

import java.util.Objects;

/**
 * Variable reference into the data context.
 *
 * @param path         Dot-separated path; empty string refers to the whole data scope
 * @param defaultValue Value used when the path is absent, may be null
 * @param arrayForm    Whether the reference was written as {@code {"var": [path, default]}}
 */
public record VarNode(String path, RuleNode defaultValue, boolean arrayForm) implements RuleNode {

    public VarNode {
        Objects.requireNonNull(path, "path");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.VARIABLE;
    }
}
