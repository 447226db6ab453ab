package com.benefits.expression;

import com.benefits.exception.EvaluationErrorCode;
import com.benefits.exception.RuleEvaluationException;
import com.benefits.rule.RuleNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates rules into {@link RuleEvaluationResult}s.
 * <p>
 * In non-strict mode every failure is converted into {@code success=false}, so one
 * malformed rule cannot block the evaluation of others.
 */
public class RuleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RuleEvaluator.class);

    private final RuleInterpreter interpreter;
    private final EvaluationOptions defaultOptions;

    public RuleEvaluator(RuleInterpreter interpreter) {
        this(interpreter, EvaluationOptions.defaults());
    }

    public RuleEvaluator(RuleInterpreter interpreter, EvaluationOptions defaultOptions) {
        this.interpreter = interpreter;
        this.defaultOptions = defaultOptions;
    }

    public RuleEvaluationResult evaluate(RuleNode rule, Object data) {
        return evaluate(rule, data, defaultOptions);
    }

    /**
     * Evaluate a rule.
     *
     * @throws RuleEvaluationException only in strict mode
     */
    public RuleEvaluationResult evaluate(RuleNode rule, Object data, EvaluationOptions options) {
        long start = options.measureTime() ? System.nanoTime() : 0L;
        Object context = options.captureContext() ? data : null;
        try {
            Object result = interpreter.evaluate(rule, data);
            return RuleEvaluationResult.success(result, elapsed(start, options), context);
        } catch (RuleEvaluationException e) {
            if (options.strict()) {
                throw e;
            }
            log.warn("Rule evaluation failed: {}", e.getMessage());
            return RuleEvaluationResult.failure(e.getMessage(), e.getCode(), elapsed(start, options), context);
        } catch (RuntimeException e) {
            if (options.strict()) {
                throw new RuleEvaluationException(EvaluationErrorCode.UNKNOWN, null, e.getMessage(), e);
            }
            log.warn("Rule evaluation failed unexpectedly", e);
            return RuleEvaluationResult.failure(String.valueOf(e.getMessage()), EvaluationErrorCode.UNKNOWN,
                    elapsed(start, options), context);
        }
    }

    /**
     * Evaluate several rules against the same data, in order.
     */
    public List<RuleEvaluationResult> evaluateAll(List<RuleNode> rules, Object data) {
        List<RuleEvaluationResult> results = new ArrayList<>(rules.size());
        for (RuleNode rule : rules) {
            results.add(evaluate(rule, data));
        }
        return results;
    }

    public EvaluationOptions getDefaultOptions() {
        return defaultOptions;
    }

    public RuleInterpreter getInterpreter() {
        return interpreter;
    }

    static double elapsed(long startNanos, EvaluationOptions options) {
        return options.measureTime() ? (System.nanoTime() - startNanos) / 1_000_000.0 : 0;
    }
}
