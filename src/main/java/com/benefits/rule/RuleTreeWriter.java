package com.benefits.rule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes {@link RuleNode} trees back to their JSON form.
 */
public final class RuleTreeWriter {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private RuleTreeWriter() {
    }

    public static String toJson(RuleNode node) {
        try {
            return objectMapper.writeValueAsString(toPlain(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Rule tree could not be serialized", e);
        }
    }

    public static JsonNode toJsonNode(RuleNode node) {
        return objectMapper.valueToTree(toPlain(node));
    }

    /**
     * Convert to plain maps, lists and scalars.
     */
    public static Object toPlain(RuleNode node) {
        return switch (node.kind()) {
            case LITERAL -> ((LiteralNode) node).value();
            case LIST -> toPlainList(((ListNode) node).items());
            case VARIABLE -> varToPlain((VarNode) node);
            case OPERATION -> operationToPlain((OperationNode) node);
        };
    }

    private static List<Object> toPlainList(List<RuleNode> items) {
        List<Object> result = new ArrayList<>(items.size());
        for (RuleNode item : items) {
            result.add(toPlain(item));
        }
        return result;
    }

    private static Map<String, Object> varToPlain(VarNode var) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (!var.arrayForm()) {
            result.put(RuleTreeParser.VAR, var.path());
            return result;
        }
        List<Object> args = new ArrayList<>();
        args.add(var.path());
        if (var.defaultValue() != null) {
            args.add(toPlain(var.defaultValue()));
        }
        result.put(RuleTreeParser.VAR, args);
        return result;
    }

    private static Map<String, Object> operationToPlain(OperationNode operation) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (operation.unary()) {
            result.put(operation.operator(), toPlain(operation.operand(0)));
        } else {
            result.put(operation.operator(), toPlainList(operation.operands()));
        }
        return result;
    }
}
