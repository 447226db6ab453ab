package com.benefits.debug;

import com.benefits.exception.RuleEvaluationException;
import com.benefits.expression.EvaluationListener;
import com.benefits.expression.RuleInterpreter;
import com.benefits.operator.Values;
import com.benefits.rule.ListNode;
import com.benefits.rule.OperationNode;
import com.benefits.rule.RuleNode;
import com.benefits.rule.VarNode;
import com.benefits.validation.ValidationIssue;
import com.benefits.validation.ValidationResult;
import com.benefits.validation.RuleValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Rule debugging: execution tracing, variable inspection and evaluation comparison.
 */
public class RuleDebugger {

    private static final Logger log = LoggerFactory.getLogger(RuleDebugger.class);

    static final int HIGH_COMPLEXITY = 80;

    private final RuleInterpreter interpreter;
    private final RuleValidator validator;

    public RuleDebugger(RuleInterpreter interpreter, RuleValidator validator) {
        this.interpreter = interpreter;
        this.validator = validator;
    }

    /**
     * Evaluate a rule while recording every variable access and operation.
     * <p>
     * Steps are recorded as they complete, so an operation appears after its operands.
     * On failure the trace up to the failure is kept and an error step is appended.
     */
    public DebugResult debugRule(RuleNode rule, Object data) {
        long start = System.nanoTime();
        Tracer tracer = new Tracer();
        try {
            Object result = interpreter.evaluate(rule, data, tracer);
            return tracer.toResult(result, true, start);
        } catch (RuleEvaluationException e) {
            if (!tracer.errorRecorded) {
                tracer.errorStep(e.getOperator() != null ? e.getOperator() : "evaluation", 0, e);
            }
            tracer.errors.add(e.getMessage());
            log.debug("Debug evaluation failed after {} steps: {}", tracer.trace.size(), e.getMessage());
            return tracer.toResult(null, false, start);
        }
    }

    public VariableInspection inspectVariable(String path, Object data) {
        Optional<Object> value = interpreter.getVariableResolver().resolve(path, data);
        Object resolved = value.orElse(null);
        return new VariableInspection(path, resolved,
                resolved == null ? "undefined" : resolved.getClass().getSimpleName(),
                value.isPresent(), Values.truthy(resolved), Arrays.asList(path.split("\\.")));
    }

    public List<VariableInspection> inspectAllVariables(RuleNode rule, Object data) {
        List<VariableInspection> inspections = new ArrayList<>();
        for (String variable : validator.validate(rule).variables()) {
            inspections.add(inspectVariable(variable, data));
        }
        return inspections;
    }

    /**
     * Static inspection. {@code data} may be null; when present, unused top-level fields
     * are reported as a suggestion.
     */
    public RuleInspection inspectRule(RuleNode rule, Map<String, ?> data) {
        ValidationResult validation = validator.validate(rule);
        Map<String, Integer> variableUsage = new LinkedHashMap<>();
        Map<String, Integer> operatorUsage = new LinkedHashMap<>();
        countUsage(rule, variableUsage, operatorUsage);

        List<String> suggestions = new ArrayList<>();
        if (validation.complexity() > HIGH_COMPLEXITY) {
            suggestions.add("Rule complexity is high - consider breaking into multiple rules");
        }
        if (!validation.warnings().isEmpty()) {
            suggestions.add("Address " + validation.warnings().size() + " validation warnings");
        }
        if (data != null) {
            List<String> unused = data.keySet().stream()
                    .filter(key -> !validation.variables().contains(key))
                    .toList();
            if (!unused.isEmpty()) {
                suggestions.add("Data contains unused fields: " + String.join(", ", unused));
            }
        }

        return new RuleInspection(validation.operators(), validation.variables(), validation.depth(),
                validation.complexity(), validation.valid(),
                validation.errors().stream().map(ValidationIssue::message).toList(),
                validation.warnings().stream().map(ValidationIssue::message).toList(),
                variableUsage, operatorUsage, suggestions);
    }

    /**
     * Evaluate a rule against two contexts and list the top-level fields that differ.
     */
    public EvaluationComparison compareEvaluations(RuleNode rule, Map<String, ?> data1, Map<String, ?> data2) {
        Object result1 = safeEvaluate(rule, data1);
        Object result2 = safeEvaluate(rule, data2);

        Set<String> keys = new LinkedHashSet<>(data1.keySet());
        keys.addAll(data2.keySet());
        List<EvaluationComparison.FieldDifference> differences = new ArrayList<>();
        for (String key : keys) {
            Object value1 = data1.get(key);
            Object value2 = data2.get(key);
            if (!Objects.equals(value1, value2)) {
                differences.add(new EvaluationComparison.FieldDifference(key, value1, value2));
            }
        }
        return new EvaluationComparison(result1, result2, Objects.equals(result1, result2), differences);
    }

    private Object safeEvaluate(RuleNode rule, Object data) {
        try {
            return interpreter.evaluate(rule, data);
        } catch (RuleEvaluationException e) {
            log.debug("Comparison evaluation failed: {}", e.getMessage());
            return null;
        }
    }

    private static void countUsage(RuleNode node, Map<String, Integer> variables, Map<String, Integer> operators) {
        switch (node.kind()) {
            case LITERAL -> {
            }
            case VARIABLE -> variables.merge(((VarNode) node).path(), 1, Integer::sum);
            case LIST -> ((ListNode) node).items().forEach(item -> countUsage(item, variables, operators));
            case OPERATION -> {
                OperationNode operation = (OperationNode) node;
                operators.merge(operation.operator(), 1, Integer::sum);
                operation.operands().forEach(operand -> countUsage(operand, variables, operators));
            }
        }
    }

    private static final class Tracer implements EvaluationListener {

        private final List<TraceStep> trace = new ArrayList<>();
        private final Set<String> variablesAccessed = new LinkedHashSet<>();
        private final Set<String> missingVariables = new LinkedHashSet<>();
        private final Set<String> operatorsUsed = new LinkedHashSet<>();
        private final List<String> errors = new ArrayList<>();
        private int maxDepth;
        private boolean errorRecorded;

        @Override
        public void onVariable(String path, Object value, boolean found, int depth) {
            variablesAccessed.add(path);
            if (!found) {
                missingVariables.add(path);
            }
            maxDepth = Math.max(maxDepth, depth);
            trace.add(new TraceStep(trace.size(), "Access variable: " + path, "var",
                    Collections.singletonList(path), value, depth, 0));
        }

        @Override
        public void onOperation(OperationNode node, List<Object> values, Object result, int depth, long nanos) {
            operatorsUsed.add(node.operator());
            maxDepth = Math.max(maxDepth, depth);
            trace.add(new TraceStep(trace.size(), "Operator: " + node.operator(), node.operator(),
                    values, result, depth, nanos / 1_000_000.0));
        }

        @Override
        public void onOperationError(OperationNode node, int depth, RuleEvaluationException error) {
            operatorsUsed.add(node.operator());
            errorStep(node.operator(), depth, error);
        }

        void errorStep(String operator, int depth, RuleEvaluationException error) {
            errorRecorded = true;
            maxDepth = Math.max(maxDepth, depth);
            trace.add(new TraceStep(trace.size(), "Error in operator: " + operator, operator,
                    List.of(), null, depth, 0));
        }

        DebugResult toResult(Object result, boolean success, long start) {
            List<String> warnings = new ArrayList<>();
            for (String missing : missingVariables) {
                warnings.add("Variable '" + missing + "' is not defined in the data");
            }
            return new DebugResult(result, success, List.copyOf(trace),
                    (System.nanoTime() - start) / 1_000_000.0,
                    Collections.unmodifiableSet(variablesAccessed), Collections.unmodifiableSet(operatorsUsed),
                    maxDepth, List.copyOf(errors), warnings);
        }
    }
}
