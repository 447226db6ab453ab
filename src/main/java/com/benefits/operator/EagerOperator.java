package com.benefits.operator;

import com.benefits.rule.RuleNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator that works on already evaluated argument values.
 */
@FunctionalInterface
public interface EagerOperator extends Operator {

    Object applyValues(List<Object> args);

    @Override
    default Object apply(List<RuleNode> operands, EvaluationScope scope) {
        List<Object> args = new ArrayList<>(operands.size());
        for (RuleNode operand : operands) {
            args.add(scope.evaluate(operand));
        }
        return applyValues(args);
    }
}
