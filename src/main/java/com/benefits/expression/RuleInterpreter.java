package com.benefits.expression;

import com.benefits.exception.EvaluationErrorCode;
import com.benefits.exception.RuleEvaluationException;
import com.benefits.operator.EagerOperator;
import com.benefits.operator.EvaluationScope;
import com.benefits.operator.Operator;
import com.benefits.operator.OperatorRegistry;
import com.benefits.rule.ListNode;
import com.benefits.rule.LiteralNode;
import com.benefits.rule.OperationNode;
import com.benefits.rule.RuleNode;
import com.benefits.rule.RuleTreeWriter;
import com.benefits.rule.VarNode;
import com.benefits.variable.DefaultVariableResolver;
import com.benefits.variable.VariableResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates rule trees against a data context.
 * <p>
 * Stateless apart from its operator table: the same instance may evaluate concurrently
 * once registration has finished. Evaluation never mutates the data context. Missing
 * variables resolve to null (or the reference's default) rather than failing.
 */
public class RuleInterpreter {

    private static final Logger log = LoggerFactory.getLogger(RuleInterpreter.class);

    public static final int DEFAULT_MAX_DEPTH = 100;

    private final OperatorRegistry registry;
    private final VariableResolver variableResolver;
    private final int maxDepth;

    public RuleInterpreter(OperatorRegistry registry) {
        this(registry, DEFAULT_MAX_DEPTH);
    }

    public RuleInterpreter(OperatorRegistry registry, int maxDepth) {
        this(registry, DefaultVariableResolver.getInstance(), maxDepth);
    }

    public RuleInterpreter(OperatorRegistry registry, VariableResolver variableResolver, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.registry = registry;
        this.variableResolver = variableResolver;
        this.maxDepth = maxDepth;
    }

    public Object evaluate(RuleNode rule, Object data) {
        return evaluate(rule, data, EvaluationListener.NONE);
    }

    /**
     * Evaluate a rule, reporting each variable and operation to {@code listener}.
     *
     * @throws RuleEvaluationException on unknown operators, operator failures or excessive nesting
     */
    public Object evaluate(RuleNode rule, Object data, EvaluationListener listener) {
        if (rule == null) {
            throw new RuleEvaluationException(EvaluationErrorCode.INVALID_RULE, "Rule must not be null");
        }
        return new Scope(data, 0, new Evaluation(listener)).evaluate(rule);
    }

    public OperatorRegistry getRegistry() {
        return registry;
    }

    public VariableResolver getVariableResolver() {
        return variableResolver;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    private Object evaluateNode(RuleNode node, Object data, int depth, Evaluation evaluation) {
        if (depth > maxDepth) {
            throw new RuleEvaluationException(EvaluationErrorCode.MAX_DEPTH_EXCEEDED,
                    "Rule nesting exceeds maximum depth of " + maxDepth);
        }
        return switch (node.kind()) {
            case LITERAL -> ((LiteralNode) node).value();
            case LIST -> evaluateList((ListNode) node, data, depth, evaluation);
            case VARIABLE -> evaluateVar((VarNode) node, data, depth, evaluation);
            case OPERATION -> evaluateOperation((OperationNode) node, data, depth, evaluation);
        };
    }

    private List<Object> evaluateList(ListNode list, Object data, int depth, Evaluation evaluation) {
        List<Object> values = new ArrayList<>(list.items().size());
        for (RuleNode item : list.items()) {
            values.add(evaluateNode(item, data, depth + 1, evaluation));
        }
        return values;
    }

    private Object evaluateVar(VarNode var, Object data, int depth, Evaluation evaluation) {
        Optional<Object> resolved = variableResolver.resolve(var.path(), data);
        Object value;
        if (resolved.isPresent()) {
            value = resolved.get();
        } else if (var.defaultValue() != null) {
            value = evaluateNode(var.defaultValue(), data, depth + 1, evaluation);
        } else {
            value = null;
        }
        log.trace("var {} -> {}", var.path(), value);
        evaluation.listener.onVariable(var.path(), value, resolved.isPresent(), depth);
        return value;
    }

    private Object evaluateOperation(OperationNode node, Object data, int depth, Evaluation evaluation) {
        Operator operator = registry.find(node.operator()).orElse(null);
        if (operator == null) {
            throw evaluation.report(node, depth, RuleEvaluationException.unknownOperator(node.operator()));
        }

        long start = System.nanoTime();
        Scope childScope = new Scope(data, depth + 1, evaluation);
        List<Object> reported;
        Object result;
        if (operator instanceof EagerOperator eager) {
            List<Object> args = new ArrayList<>(node.arity());
            for (RuleNode operand : node.operands()) {
                args.add(childScope.evaluate(operand));
            }
            reported = args;
            result = invoke(node, depth, evaluation, () -> eager.applyValues(args));
        } else {
            reported = plainOperands(node);
            result = invoke(node, depth, evaluation, () -> operator.apply(node.operands(), childScope));
        }
        long nanos = System.nanoTime() - start;

        if (log.isTraceEnabled()) {
            log.trace("{}{} -> {}", "  ".repeat(depth), node.operator(), result);
        }
        evaluation.listener.onOperation(node, reported, result, depth, nanos);
        return result;
    }

    private Object invoke(OperationNode node, int depth, Evaluation evaluation, OperatorCall call) {
        try {
            return call.call();
        } catch (RuleEvaluationException e) {
            throw evaluation.report(node, depth, e);
        } catch (RuntimeException e) {
            throw evaluation.report(node, depth, new RuleEvaluationException(EvaluationErrorCode.OPERATOR_ERROR,
                    node.operator(), "Operator '" + node.operator() + "' failed: " + e.getMessage(), e));
        }
    }

    private static List<Object> plainOperands(OperationNode node) {
        List<Object> plain = new ArrayList<>(node.arity());
        for (RuleNode operand : node.operands()) {
            plain.add(RuleTreeWriter.toPlain(operand));
        }
        return plain;
    }

    @FunctionalInterface
    private interface OperatorCall {
        Object call();
    }

    /**
     * Per-call state: the listener and the last error already reported to it.
     */
    private static final class Evaluation {

        private final EvaluationListener listener;
        private RuleEvaluationException reported;

        Evaluation(EvaluationListener listener) {
            this.listener = listener == null ? EvaluationListener.NONE : listener;
        }

        RuleEvaluationException report(OperationNode node, int depth, RuleEvaluationException error) {
            if (error != reported) {
                reported = error;
                listener.onOperationError(node, depth, error);
            }
            return error;
        }
    }

    private final class Scope implements EvaluationScope {

        private final Object data;
        private final int depth;
        private final Evaluation evaluation;

        Scope(Object data, int depth, Evaluation evaluation) {
            this.data = data;
            this.depth = depth;
            this.evaluation = evaluation;
        }

        @Override
        public Object data() {
            return data;
        }

        @Override
        public int depth() {
            return depth;
        }

        @Override
        public Object evaluate(RuleNode node) {
            return evaluateNode(node, data, depth, evaluation);
        }

        @Override
        public Object evaluateWith(RuleNode node, Object itemData) {
            return evaluateNode(node, itemData, depth, evaluation);
        }

        @Override
        public Optional<Object> resolve(String path) {
            return variableResolver.resolve(path, data);
        }
    }
}
