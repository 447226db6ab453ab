package com.benefits.rule;

import com.benefits.exception.RuleParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses JSON rule documents into {@link RuleNode} trees.
 * <p>
 * Grammar:
 * <pre>
 *   rule      := literal | list | var | operation
 *   list      := [ rule, ... ]
 *   var       := { "var": "dot.path" } | { "var": [ "dot.path", default ] }
 *   operation := { "operator": [ rule, ... ] } | { "operator": rule }
 * </pre>
 * An object must carry exactly one key.
 */
public final class RuleTreeParser {

    public static final String VAR = "var";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private RuleTreeParser() {
    }

    /**
     * Parse a JSON string.
     *
     * @param json JSON rule document
     * @return Parsed rule tree
     * @throws RuleParseException if the document is not valid JSON or not a well-formed rule
     */
    public static RuleNode parse(String json) {
        if (json == null || json.isBlank()) {
            throw new RuleParseException("", "Rule document is empty");
        }
        try {
            return parse(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new RuleParseException("", "Invalid JSON: " + e.getOriginalMessage());
        }
    }

    /**
     * Parse a Jackson tree.
     */
    public static RuleNode parse(JsonNode json) {
        if (json == null || json.isMissingNode()) {
            throw new RuleParseException("", "Rule document is missing");
        }
        return parseNode(json, "");
    }

    /**
     * Parse a plain Java structure (maps, lists and scalars), e.g. a rule embedded in YAML.
     */
    public static RuleNode fromObject(Object plain) {
        if (plain instanceof RuleNode node) {
            return node;
        }
        if (plain != null && !(plain instanceof Map) && !(plain instanceof List)
                && !(plain instanceof String) && !(plain instanceof Number) && !(plain instanceof Boolean)) {
            throw new RuleParseException("", "Unsupported rule value of type " + plain.getClass().getName());
        }
        return parse(objectMapper.valueToTree(plain));
    }

    private static RuleNode parseNode(JsonNode json, String pointer) {
        if (json.isNull()) {
            return new LiteralNode(null);
        }
        if (json.isTextual()) {
            return new LiteralNode(json.textValue());
        }
        if (json.isBoolean()) {
            return new LiteralNode(json.booleanValue());
        }
        if (json.isNumber()) {
            return new LiteralNode(json.numberValue());
        }
        if (json.isArray()) {
            List<RuleNode> items = new ArrayList<>();
            for (int i = 0; i < json.size(); i++) {
                items.add(parseNode(json.get(i), pointer + "/" + i));
            }
            return new ListNode(items);
        }
        if (json.isObject()) {
            return parseObject(json, pointer);
        }
        throw new RuleParseException(pointer, "Unsupported JSON node " + json.getNodeType());
    }

    private static RuleNode parseObject(JsonNode json, String pointer) {
        if (json.size() != 1) {
            throw new RuleParseException(pointer,
                    "Operator object must have exactly one key, found " + json.size());
        }
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        Map.Entry<String, JsonNode> entry = fields.next();
        String operator = entry.getKey();
        JsonNode value = entry.getValue();
        String childPointer = pointer + "/" + escape(operator);

        if (VAR.equals(operator)) {
            return parseVar(value, childPointer);
        }

        if (value.isArray()) {
            List<RuleNode> operands = new ArrayList<>();
            for (int i = 0; i < value.size(); i++) {
                operands.add(parseNode(value.get(i), childPointer + "/" + i));
            }
            return new OperationNode(operator, operands, false);
        }
        return new OperationNode(operator, List.of(parseNode(value, childPointer)), true);
    }

    private static VarNode parseVar(JsonNode value, String pointer) {
        if (value.isTextual() || value.isNumber()) {
            return new VarNode(value.asText(), null, false);
        }
        if (value.isNull()) {
            return new VarNode("", null, false);
        }
        if (value.isArray()) {
            if (value.isEmpty()) {
                return new VarNode("", null, true);
            }
            JsonNode path = value.get(0);
            if (!path.isTextual() && !path.isNumber()) {
                throw new RuleParseException(pointer + "/0", "Variable path must be a string");
            }
            RuleNode defaultValue = value.size() > 1 ? parseNode(value.get(1), pointer + "/1") : null;
            return new VarNode(path.asText(), defaultValue, true);
        }
        throw new RuleParseException(pointer, "Variable reference must be a string path");
    }

    static String escape(String key) {
        return key.replace("~", "~0").replace("/", "~1");
    }
}
