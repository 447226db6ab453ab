package com.benefits.operator;

import com.benefits.exception.EvaluationErrorCode;
import com.benefits.exception.RuleEvaluationException;
import com.benefits.rule.RuleNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The base operator set: comparison, logic, arithmetic, string, array and data operators.
 */
public final class StandardOperators {

    private static final Logger log = LoggerFactory.getLogger(StandardOperators.class);

    /**
     * Operators that iterate over a list and evaluate a sub-rule per item.
     */
    public static final Set<String> ARRAY_OPERATORS = Set.of("map", "filter", "reduce", "all", "some", "none");

    private StandardOperators() {
    }

    public static void registerAll(OperatorRegistry registry) {
        registerComparison(registry);
        registerLogic(registry);
        registerArithmetic(registry);
        registerStrings(registry);
        registerArrays(registry);
        registerData(registry);
    }

    // ========== Comparison ==========

    private static void registerComparison(OperatorRegistry registry) {
        registry.register("==", (EagerOperator) args -> Values.looseEquals(arg(args, 0), arg(args, 1)));
        registry.register("===", (EagerOperator) args -> Values.strictEquals(arg(args, 0), arg(args, 1)));
        registry.register("!=", (EagerOperator) args -> !Values.looseEquals(arg(args, 0), arg(args, 1)));
        registry.register("!==", (EagerOperator) args -> !Values.strictEquals(arg(args, 0), arg(args, 1)));
        registry.register(">", (EagerOperator) args -> Values.compare(arg(args, 0), arg(args, 1), Values.Ordering.GREATER));
        registry.register(">=", (EagerOperator) args -> Values.compare(arg(args, 0), arg(args, 1), Values.Ordering.GREATER_OR_EQUAL));
        registry.register("<", (EagerOperator) args -> ordered(args, Values.Ordering.LESS));
        registry.register("<=", (EagerOperator) args -> ordered(args, Values.Ordering.LESS_OR_EQUAL));
    }

    /**
     * {@code <} and {@code <=} take an optional third argument: {@code a < b < c}.
     */
    private static boolean ordered(List<Object> args, Values.Ordering ordering) {
        boolean first = Values.compare(arg(args, 0), arg(args, 1), ordering);
        if (args.size() < 3) {
            return first;
        }
        return first && Values.compare(arg(args, 1), arg(args, 2), ordering);
    }

    // ========== Logic ==========

    private static void registerLogic(OperatorRegistry registry) {
        registry.register("!", (EagerOperator) args -> !Values.truthy(arg(args, 0)));
        registry.register("!!", (EagerOperator) args -> Values.truthy(arg(args, 0)));
        registry.register("and", (operands, scope) -> {
            Object value = null;
            for (RuleNode operand : operands) {
                value = scope.evaluate(operand);
                if (!Values.truthy(value)) {
                    return value;
                }
            }
            return value;
        });
        registry.register("or", (operands, scope) -> {
            Object value = null;
            for (RuleNode operand : operands) {
                value = scope.evaluate(operand);
                if (Values.truthy(value)) {
                    return value;
                }
            }
            return value;
        });
        Operator conditional = (operands, scope) -> {
            int i = 0;
            for (; i + 1 < operands.size(); i += 2) {
                if (Values.truthy(scope.evaluate(operands.get(i)))) {
                    return scope.evaluate(operands.get(i + 1));
                }
            }
            return i < operands.size() ? scope.evaluate(operands.get(i)) : null;
        };
        registry.register("if", conditional);
        registry.register("?:", conditional);
    }

    // ========== Arithmetic ==========

    private static void registerArithmetic(OperatorRegistry registry) {
        registry.register("+", (EagerOperator) args -> {
            double sum = 0;
            for (Object arg : args) {
                sum += Values.toNumber(arg);
            }
            return Values.normalize(sum);
        });
        registry.register("*", (EagerOperator) args -> {
            if (args.isEmpty()) {
                return null;
            }
            double product = 1;
            for (Object arg : args) {
                product *= Values.toNumber(arg);
            }
            return Values.normalize(product);
        });
        registry.register("-", (EagerOperator) args -> {
            if (args.size() == 1) {
                return Values.normalize(-Values.toNumber(args.get(0)));
            }
            return Values.normalize(Values.toNumber(arg(args, 0)) - Values.toNumber(arg(args, 1)));
        });
        registry.register("/", (EagerOperator) args ->
                Values.normalize(Values.toNumber(arg(args, 0)) / Values.toNumber(arg(args, 1))));
        registry.register("%", (EagerOperator) args ->
                Values.normalize(Values.toNumber(arg(args, 0)) % Values.toNumber(arg(args, 1))));
        registry.register("min", (EagerOperator) args -> extreme(args, true));
        registry.register("max", (EagerOperator) args -> extreme(args, false));
    }

    private static Object extreme(List<Object> args, boolean min) {
        if (args.isEmpty()) {
            return null;
        }
        double result = min ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
        for (Object arg : args) {
            double value = Values.toNumber(arg);
            if (Double.isNaN(value)) {
                return null;
            }
            result = min ? Math.min(result, value) : Math.max(result, value);
        }
        return Values.normalize(result);
    }

    // ========== Strings ==========

    private static void registerStrings(OperatorRegistry registry) {
        registry.register("cat", (EagerOperator) args -> {
            StringBuilder sb = new StringBuilder();
            for (Object arg : args) {
                sb.append(Values.toText(arg));
            }
            return sb.toString();
        });
        registry.register("substr", (EagerOperator) StandardOperators::substr);
        registry.register("in", (EagerOperator) args -> ComparisonOperator.contains(arg(args, 1), arg(args, 0)));
    }

    private static String substr(List<Object> args) {
        String source = Values.toText(arg(args, 0));
        int length = source.length();
        int start = (int) Values.toNumber(arg(args, 1));
        if (start < 0) {
            start = Math.max(0, length + start);
        }
        start = Math.min(start, length);
        int end = length;
        if (args.size() > 2) {
            int count = (int) Values.toNumber(args.get(2));
            end = count < 0 ? Math.max(start, length + count) : Math.min(length, start + count);
        }
        return source.substring(start, end);
    }

    // ========== Arrays ==========

    private static void registerArrays(OperatorRegistry registry) {
        registry.register("merge", (EagerOperator) args -> {
            List<Object> merged = new ArrayList<>();
            for (Object arg : args) {
                if (arg instanceof Collection<?> c) {
                    merged.addAll(c);
                } else {
                    merged.add(arg);
                }
            }
            return merged;
        });
        registry.register("map", (operands, scope) -> {
            List<Object> result = new ArrayList<>();
            if (operands.size() < 2) {
                return result;
            }
            for (Object item : Values.asList(scope.evaluate(operands.get(0)))) {
                result.add(scope.evaluateWith(operands.get(1), item));
            }
            return result;
        });
        registry.register("filter", (operands, scope) -> {
            List<Object> result = new ArrayList<>();
            if (operands.size() < 2) {
                return result;
            }
            for (Object item : Values.asList(scope.evaluate(operands.get(0)))) {
                if (Values.truthy(scope.evaluateWith(operands.get(1), item))) {
                    result.add(item);
                }
            }
            return result;
        });
        registry.register("reduce", (operands, scope) -> {
            if (operands.size() < 2) {
                return null;
            }
            Object accumulator = operands.size() > 2 ? scope.evaluate(operands.get(2)) : null;
            for (Object item : Values.asList(scope.evaluate(operands.get(0)))) {
                Map<String, Object> frame = new LinkedHashMap<>();
                frame.put("current", item);
                frame.put("accumulator", accumulator);
                accumulator = scope.evaluateWith(operands.get(1), frame);
            }
            return accumulator;
        });
        registry.register("all", (operands, scope) -> {
            List<?> items = operands.isEmpty() ? List.of() : Values.asList(scope.evaluate(operands.get(0)));
            if (items.isEmpty() || operands.size() < 2) {
                return false;
            }
            for (Object item : items) {
                if (!Values.truthy(scope.evaluateWith(operands.get(1), item))) {
                    return false;
                }
            }
            return true;
        });
        registry.register("some", (operands, scope) -> anyMatch(operands, scope));
        registry.register("none", (operands, scope) -> !anyMatch(operands, scope));
    }

    private static boolean anyMatch(List<RuleNode> operands, EvaluationScope scope) {
        if (operands.size() < 2) {
            return false;
        }
        for (Object item : Values.asList(scope.evaluate(operands.get(0)))) {
            if (Values.truthy(scope.evaluateWith(operands.get(1), item))) {
                return true;
            }
        }
        return false;
    }

    // ========== Data ==========

    private static void registerData(OperatorRegistry registry) {
        registry.register("missing", (operands, scope) -> missing(evaluateAll(operands, scope), scope));
        registry.register("missing_some", (operands, scope) -> {
            List<Object> args = evaluateAll(operands, scope);
            if (args.size() < 2) {
                throw new RuleEvaluationException(EvaluationErrorCode.INVALID_RULE, "missing_some",
                        "missing_some requires a minimum count and a list of paths", null);
            }
            int needed = (int) Values.toNumber(args.get(0));
            List<?> paths = Values.asList(args.get(1));
            List<Object> missing = missing(new ArrayList<>(paths), scope);
            return paths.size() - missing.size() >= needed ? List.of() : missing;
        });
        registry.register("log", (EagerOperator) args -> {
            Object value = arg(args, 0);
            log.info("Rule log: {}", value);
            return value;
        });
    }

    private static List<Object> missing(List<Object> args, EvaluationScope scope) {
        List<?> paths = !args.isEmpty() && args.get(0) instanceof List<?> list ? list : args;
        List<Object> missing = new ArrayList<>();
        for (Object path : paths) {
            String key = Values.toText(path);
            Object value = scope.resolve(key).orElse(null);
            if (value == null || "".equals(value)) {
                missing.add(path);
            }
        }
        return missing;
    }

    private static List<Object> evaluateAll(List<RuleNode> operands, EvaluationScope scope) {
        List<Object> values = new ArrayList<>(operands.size());
        for (RuleNode operand : operands) {
            values.add(scope.evaluate(operand));
        }
        return values;
    }

    static Object arg(List<Object> args, int index) {
        return index < args.size() ? args.get(index) : null;
    }
}
