package com.benefits.operator;

import com.benefits.rule.RuleNode;

import java.util.Optional;

/**
 * Evaluation state handed to operators: the current data and a way to evaluate sub-trees.
 */
public interface EvaluationScope {

    /**
     * Data that {@code var} references resolve against.
     */
    Object data();

    /**
     * Nesting level of the operation being applied, 0 at the root.
     */
    int depth();

    /**
     * Evaluate a sub-tree against the current data.
     */
    Object evaluate(RuleNode node);

    /**
     * Evaluate a sub-tree against different data, e.g. each item of a {@code map}.
     */
    Object evaluateWith(RuleNode node, Object data);

    /**
     * Resolve a dot path against the current data.
     */
    Optional<Object> resolve(String path);
}
