package com.benefits.expression;

import com.benefits.exception.RuleEvaluationException;
import com.benefits.rule.OperationNode;

import java.util.List;

/**
 * Callbacks fired by {@link RuleInterpreter} while it walks a rule tree.
 * <p>
 * Operations are reported after they complete, so callbacks arrive in post-order.
 */
public interface EvaluationListener {

    EvaluationListener NONE = new EvaluationListener() {
    };

    /**
     * A variable reference was resolved.
     *
     * @param path  Dot path
     * @param value Resolved value (the default when not found, possibly null)
     * @param found Whether the path was present in the data
     * @param depth Nesting level of the reference
     */
    default void onVariable(String path, Object value, boolean found, int depth) {
    }

    /**
     * An operation completed.
     *
     * @param node   Operation node
     * @param values Evaluated argument values, or the plain operand trees for operators
     *               that evaluate their own operands
     * @param result Operation result
     * @param depth  Nesting level, 0 at the root
     * @param nanos  Time spent in the operation including its operands
     */
    default void onOperation(OperationNode node, List<Object> values, Object result, int depth, long nanos) {
    }

    /**
     * An operation failed. Fired once, for the innermost failing operation.
     */
    default void onOperationError(OperationNode node, int depth, RuleEvaluationException error) {
    }
}
