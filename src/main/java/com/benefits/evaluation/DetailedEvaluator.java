package com.benefits.evaluation;

import com.benefits.exception.EvaluationErrorCode;
import com.benefits.exception.RuleEvaluationException;
import com.benefits.expression.EvaluationListener;
import com.benefits.expression.RuleInterpreter;
import com.benefits.operator.ComparisonOperator;
import com.benefits.operator.EagerOperator;
import com.benefits.operator.StandardOperators;
import com.benefits.operator.Values;
import com.benefits.rule.ListNode;
import com.benefits.rule.NodeKind;
import com.benefits.rule.OperationNode;
import com.benefits.rule.RuleNode;
import com.benefits.rule.VarNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Evaluates a rule while recording a {@link CriterionResult} for every comparison
 * between a variable and a threshold, at any depth.
 * <p>
 * The verdict and the values of every comparison it reached come from one interpreter
 * pass. Comparisons that pass skipped through {@code and}/{@code or}/{@code if}
 * short-circuiting are evaluated on their own afterwards, so the breakdown lists every
 * criterion in rule order. Comparisons under array operators run against each element,
 * so only what the pass saw is reported for them. Never throws.
 */
public class DetailedEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DetailedEvaluator.class);

    static final String EVALUATION_ERROR = "Unable to evaluate eligibility due to an error";

    private final RuleInterpreter interpreter;

    public DetailedEvaluator(RuleInterpreter interpreter) {
        this.interpreter = interpreter;
    }

    public DetailedEvaluationResult evaluateWithDetails(RuleNode rule, Object data) {
        long start = System.nanoTime();
        CriteriaCollector collector = new CriteriaCollector();
        try {
            Object result = interpreter.evaluate(rule, data, collector);
            double elapsed = (System.nanoTime() - start) / 1_000_000.0;
            List<CriterionResult> criteria = new ArrayList<>();
            collectCriteria(rule, data, collector, criteria);
            log.debug("Detailed evaluation: result={}, criteria={}", result, criteria.size());
            return new DetailedEvaluationResult(result, true, elapsed, null, null, criteria,
                    CriterionFormatter.explain(criteria, Values.truthy(result)));
        } catch (RuleEvaluationException e) {
            log.warn("Detailed evaluation failed: {}", e.getMessage());
            return failure(start, e.getMessage(), e.getCode(), collector.criteria());
        } catch (RuntimeException e) {
            log.warn("Detailed evaluation failed unexpectedly", e);
            return failure(start, String.valueOf(e.getMessage()), EvaluationErrorCode.UNKNOWN, collector.criteria());
        }
    }

    private static DetailedEvaluationResult failure(long start, String error, EvaluationErrorCode code,
                                                    List<CriterionResult> criteria) {
        double elapsed = (System.nanoTime() - start) / 1_000_000.0;
        return new DetailedEvaluationResult(false, false, elapsed, error, code, criteria, EVALUATION_ERROR);
    }

    // pre-order over the rule so criteria follow the order they are written in
    private void collectCriteria(RuleNode node, Object data, CriteriaCollector evaluated,
                                 List<CriterionResult> criteria) {
        if (node instanceof ListNode list) {
            for (RuleNode item : list.items()) {
                collectCriteria(item, data, evaluated, criteria);
            }
            return;
        }
        if (!(node instanceof OperationNode operation)) {
            return;
        }
        if (StandardOperators.ARRAY_OPERATORS.contains(operation.operator())) {
            Set<RuleNode> inside = Collections.newSetFromMap(new IdentityHashMap<>());
            addSubtree(operation, inside);
            for (Captured captured : evaluated.captured) {
                if (inside.contains(captured.node())) {
                    criteria.add(captured.criterion());
                }
            }
            return;
        }
        if (isComparison(operation)) {
            List<CriterionResult> reached = evaluated.criteriaFor(operation);
            criteria.addAll(reached.isEmpty() && !evaluated.ran(operation)
                    ? evaluateSkipped(operation, data)
                    : reached);
        }
        for (RuleNode operand : operation.operands()) {
            collectCriteria(operand, data, evaluated, criteria);
        }
    }

    private List<CriterionResult> evaluateSkipped(OperationNode comparison, Object data) {
        CriteriaCollector skipped = new CriteriaCollector();
        try {
            interpreter.evaluate(comparison, data, skipped);
        } catch (RuleEvaluationException e) {
            log.debug("Short-circuited comparison {} could not be evaluated: {}",
                    comparison.operator(), e.getMessage());
            return List.of();
        }
        return skipped.criteriaFor(comparison);
    }

    private static void addSubtree(RuleNode node, Set<RuleNode> nodes) {
        nodes.add(node);
        if (node instanceof OperationNode operation) {
            operation.operands().forEach(operand -> addSubtree(operand, nodes));
        } else if (node instanceof ListNode list) {
            list.items().forEach(item -> addSubtree(item, nodes));
        }
    }

    private boolean isComparison(OperationNode node) {
        return ComparisonOperator.fromSymbol(node.operator()).isPresent()
                && node.arity() >= 2
                && interpreter.getRegistry().find(node.operator()).orElse(null) instanceof EagerOperator;
    }

    public RuleInterpreter getInterpreter() {
        return interpreter;
    }

    private record Captured(OperationNode node, CriterionResult criterion) {
    }

    private final class CriteriaCollector implements EvaluationListener {

        private final List<Captured> captured = new ArrayList<>();
        private final Set<OperationNode> ran = Collections.newSetFromMap(new IdentityHashMap<>());

        List<CriterionResult> criteria() {
            return captured.stream().map(Captured::criterion).toList();
        }

        List<CriterionResult> criteriaFor(OperationNode node) {
            return captured.stream().filter(c -> c.node() == node).map(Captured::criterion).toList();
        }

        boolean ran(OperationNode node) {
            return ran.contains(node);
        }

        @Override
        public void onOperation(OperationNode node, List<Object> values, Object result, int depth, long nanos) {
            if (!isComparison(node)) {
                return;
            }
            ran.add(node);
            ComparisonOperator comparison = ComparisonOperator.fromSymbol(node.operator()).orElseThrow();
            boolean met = Values.truthy(result);
            if (node.arity() == 3 && isRange(comparison)) {
                recordRange(node, values, met);
                return;
            }
            if (isVar(node.operand(0))) {
                record(node, comparison, ((VarNode) node.operand(0)).path(), values.get(0), values.get(1), met);
            } else if (isVar(node.operand(1)) && comparison != ComparisonOperator.IN) {
                record(node, flip(comparison), ((VarNode) node.operand(1)).path(), values.get(1), values.get(0), met);
            }
        }

        private void recordRange(OperationNode node, List<Object> values, boolean met) {
            int subject = node.operator().equals("between") ? 0 : 1;
            if (!isVar(node.operand(subject))) {
                return;
            }
            List<Object> bounds = subject == 0
                    ? listOf(values.get(1), values.get(2))
                    : listOf(values.get(0), values.get(2));
            record(node, ComparisonOperator.BETWEEN, ((VarNode) node.operand(subject)).path(),
                    values.get(subject), bounds, met);
        }

        private void record(OperationNode node, ComparisonOperator operator, String criterion, Object value,
                            Object threshold, boolean met) {
            if (value == null || threshold == null) {
                return;
            }
            captured.add(new Captured(node, new CriterionResult(criterion, met, value, threshold, operator.symbol(),
                    CriterionFormatter.describe(operator, criterion, value, threshold, met))));
        }
    }

    private static boolean isRange(ComparisonOperator operator) {
        return operator == ComparisonOperator.BETWEEN
                || operator == ComparisonOperator.LESS_THAN
                || operator == ComparisonOperator.LESS_THAN_OR_EQUALS;
    }

    private static boolean isVar(RuleNode node) {
        return node.kind() == NodeKind.VARIABLE;
    }

    private static List<Object> listOf(Object low, Object high) {
        List<Object> bounds = new ArrayList<>(2);
        bounds.add(low);
        bounds.add(high);
        return bounds;
    }

    /**
     * Mirror an ordering so the variable reads on the left: {@code 18 < age} becomes {@code age > 18}.
     */
    static ComparisonOperator flip(ComparisonOperator operator) {
        return switch (operator) {
            case LESS_THAN -> ComparisonOperator.GREATER_THAN;
            case LESS_THAN_OR_EQUALS -> ComparisonOperator.GREATER_THAN_OR_EQUALS;
            case GREATER_THAN -> ComparisonOperator.LESS_THAN;
            case GREATER_THAN_OR_EQUALS -> ComparisonOperator.LESS_THAN_OR_EQUALS;
            default -> operator;
        };
    }
}
