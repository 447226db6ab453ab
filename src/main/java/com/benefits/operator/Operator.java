package com.benefits.operator;

import com.benefits.rule.RuleNode;

import java.util.List;

/**
 * A rule operator.
 * <p>
 * Receives its operands unevaluated so it can short-circuit ({@code and}, {@code or},
 * {@code if}) or re-scope them ({@code map}, {@code filter}, {@code reduce}).
 * Operators that only need argument values implement {@link EagerOperator}.
 */
@FunctionalInterface
public interface Operator {

    /**
     * Apply the operator.
     *
     * @param operands Unevaluated operand trees
     * @param scope    Scope used to evaluate operands
     * @return Operator result (a JSON-compatible value)
     */
    Object apply(List<RuleNode> operands, EvaluationScope scope);
}
