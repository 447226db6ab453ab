package com.benefits.validation;

import com.benefits.exception.RuleParseException;
import com.benefits.operator.OperatorRegistry;
import com.benefits.operator.StandardOperators;
import com.benefits.rule.ListNode;
import com.benefits.rule.LiteralNode;
import com.benefits.rule.OperationNode;
import com.benefits.rule.RuleNode;
import com.benefits.rule.RuleTreeParser;
import com.benefits.rule.VarNode;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static rule validation. Never evaluates the rule.
 * <p>
 * Complexity scoring, over the JSON form of the rule:
 * <ul>
 *   <li>every object or array at nesting level {@code d} adds {@code 2 * d}</li>
 *   <li>a {@code var} reference adds 0.5</li>
 *   <li>an array operator ({@code map filter reduce all some none}) adds 3</li>
 *   <li>any other operator adds 1</li>
 * </ul>
 * The total is rounded. Complexity and depth limits only produce warnings; structural
 * defects, disallowed operators and missing required variables are fatal.
 */
public class RuleValidator {

    private static final Logger log = LoggerFactory.getLogger(RuleValidator.class);

    private final OperatorRegistry registry;

    public RuleValidator(OperatorRegistry registry) {
        this.registry = registry;
    }

    public ValidationResult validate(RuleNode rule) {
        return validate(rule, ValidationOptions.defaults());
    }

    public ValidationResult validate(RuleNode rule, ValidationOptions options) {
        if (rule == null) {
            return ValidationResult.structuralFailure(List.of(
                    ValidationIssue.critical(IssueCode.INVALID_STRUCTURE, "Rule is missing", "")));
        }
        TreeStats stats = new TreeStats();
        stats.visit(rule, 0);

        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        int complexity = (int) Math.round(stats.complexity);

        checkMetrics(complexity, stats.maxDepth, options, warnings);
        checkOperators(stats.operators, options, errors, warnings);
        for (String required : options.requiredVariables()) {
            if (!stats.variables.contains(required)) {
                errors.add(ValidationIssue.error(IssueCode.MISSING_REQUIRED_VARIABLE,
                        "Required variable \"" + required + "\" not found in rule"));
            }
        }

        ValidationResult result = new ValidationResult(errors.isEmpty(), errors, warnings,
                new ArrayList<>(stats.operators), new ArrayList<>(stats.variables), complexity, stats.maxDepth);
        log.debug("Validated rule: valid={}, complexity={}, depth={}", result.valid(), complexity, stats.maxDepth);
        return result;
    }

    /**
     * Validate a raw JSON rule, reporting structural defects instead of throwing.
     */
    public ValidationResult validate(JsonNode json) {
        return validate(json, ValidationOptions.defaults());
    }

    public ValidationResult validate(JsonNode json, ValidationOptions options) {
        if (json == null || json.isMissingNode()) {
            return ValidationResult.structuralFailure(List.of(
                    ValidationIssue.critical(IssueCode.INVALID_STRUCTURE, "Rule is missing", "")));
        }
        List<ValidationIssue> structural = new ArrayList<>();
        checkStructure(json, "", structural);
        if (!structural.isEmpty()) {
            return ValidationResult.structuralFailure(structural);
        }
        return validate(RuleTreeParser.parse(json), options);
    }

    /**
     * Validate a JSON string. Unparseable input is reported as a structural defect.
     */
    public ValidationResult validate(String json, ValidationOptions options) {
        try {
            return validate(RuleTreeParser.parse(json), options);
        } catch (RuleParseException e) {
            return ValidationResult.structuralFailure(List.of(
                    ValidationIssue.critical(IssueCode.INVALID_STRUCTURE, e.getMessage(), e.getPointer())));
        }
    }

    public List<ValidationResult> validateAll(List<RuleNode> rules, ValidationOptions options) {
        List<ValidationResult> results = new ArrayList<>(rules.size());
        for (RuleNode rule : rules) {
            results.add(validate(rule, options));
        }
        return results;
    }

    public boolean isValid(RuleNode rule) {
        return validate(rule).valid();
    }

    private void checkMetrics(int complexity, int depth, ValidationOptions options, List<ValidationIssue> warnings) {
        if (depth > options.maxDepth()) {
            warnings.add(ValidationIssue.warning(IssueCode.MAX_DEPTH_EXCEEDED,
                    "Rule depth (" + depth + ") exceeds maximum (" + options.maxDepth() + ")"));
        }
        if (complexity > options.maxComplexity()) {
            warnings.add(ValidationIssue.warning(IssueCode.MAX_COMPLEXITY_EXCEEDED,
                    "Rule complexity (" + complexity + ") exceeds maximum (" + options.maxComplexity()
                            + "); consider splitting it into smaller rules"));
        } else if (complexity > options.maxComplexity() * 0.8) {
            warnings.add(ValidationIssue.warning(IssueCode.COMPLEXITY_WARNING,
                    "Rule complexity (" + complexity + ") is approaching maximum"));
        }
    }

    private void checkOperators(Set<String> operators, ValidationOptions options,
                                List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        for (String operator : operators) {
            if (options.disallowedOperators().contains(operator)) {
                errors.add(ValidationIssue.error(IssueCode.DISALLOWED_OPERATOR,
                        "Operator \"" + operator + "\" is disallowed"));
            }
            boolean known = options.allowedOperators() != null
                    ? options.allowedOperators().contains(operator)
                    : registry.contains(operator);
            if (!known) {
                if (options.strict()) {
                    errors.add(ValidationIssue.error(IssueCode.UNKNOWN_OPERATOR,
                            "Unknown operator \"" + operator + "\""));
                } else {
                    warnings.add(ValidationIssue.warning(IssueCode.UNKNOWN_OPERATOR,
                            "Unknown operator \"" + operator + "\" - may be custom"));
                }
            }
        }
    }

    private static void checkStructure(JsonNode json, String pointer, List<ValidationIssue> issues) {
        if (json.isArray()) {
            for (int i = 0; i < json.size(); i++) {
                checkStructure(json.get(i), pointer + "/" + i, issues);
            }
            return;
        }
        if (!json.isObject()) {
            return;
        }
        if (json.size() != 1) {
            issues.add(ValidationIssue.critical(IssueCode.INVALID_STRUCTURE,
                    "Operator object must have exactly one key, found " + json.size(), pointer));
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        Map.Entry<String, JsonNode> entry = fields.next();
        String childPointer = pointer + "/" + entry.getKey().replace("~", "~0").replace("/", "~1");
        JsonNode value = entry.getValue();
        if (RuleTreeParser.VAR.equals(entry.getKey())) {
            boolean validPath = value.isTextual() || value.isNumber() || value.isNull()
                    || (value.isArray() && (value.isEmpty() || value.get(0).isTextual() || value.get(0).isNumber()));
            if (!validPath) {
                issues.add(ValidationIssue.critical(IssueCode.INVALID_STRUCTURE,
                        "Variable reference must be a string path", childPointer));
                return;
            }
        }
        checkStructure(value, childPointer, issues);
    }

    /**
     * Single pass over the tree collecting operators, variables, complexity and depth.
     * Levels mirror the JSON form so both entry points score a rule identically.
     */
    private static final class TreeStats {

        private final Set<String> operators = new LinkedHashSet<>();
        private final Set<String> variables = new LinkedHashSet<>();
        private double complexity;
        private int maxDepth;

        void visit(RuleNode node, int level) {
            switch (node.kind()) {
                case LITERAL -> reach(level);
                case LIST -> visitArray(((ListNode) node).items(), level);
                case VARIABLE -> visitVar((VarNode) node, level);
                case OPERATION -> visitOperation((OperationNode) node, level);
            }
        }

        private void visitArray(List<RuleNode> items, int level) {
            reach(level);
            complexity += level * 2;
            for (RuleNode item : items) {
                visit(item, level + 1);
            }
        }

        private void visitVar(VarNode var, int level) {
            reach(level);
            complexity += level * 2 + 0.5;
            variables.add(var.path());
            if (var.arrayForm()) {
                List<RuleNode> args = new ArrayList<>();
                args.add(new LiteralNode(var.path()));
                if (var.defaultValue() != null) {
                    args.add(var.defaultValue());
                }
                visitArray(args, level + 1);
            } else {
                reach(level + 1);
            }
        }

        private void visitOperation(OperationNode operation, int level) {
            reach(level);
            complexity += level * 2;
            complexity += StandardOperators.ARRAY_OPERATORS.contains(operation.operator()) ? 3 : 1;
            operators.add(operation.operator());
            if (operation.unary()) {
                visit(operation.operand(0), level + 1);
            } else {
                visitArray(operation.operands(), level + 1);
            }
        }

        private void reach(int level) {
            maxDepth = Math.max(maxDepth, level);
        }
    }
}
