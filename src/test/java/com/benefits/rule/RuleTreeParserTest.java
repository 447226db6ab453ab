package com.benefits.rule;

import com.benefits.exception.RuleParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuleTreeParserTest {

    // =====================================================================
    // Shapes
    // =====================================================================

    @Test
    @DisplayName("Comparison with var parses into operation, var and literal")
    void parsesComparison() {
        RuleNode node = RuleTreeParser.parse("{\">\": [{\"var\": \"age\"}, 18]}");

        OperationNode op = assertInstanceOf(OperationNode.class, node);
        assertEquals(">", op.operator());
        assertEquals(2, op.arity());
        assertEquals(new VarNode("age", null, false), op.operand(0));
        assertEquals(18, ((LiteralNode) op.operand(1)).value());
        assertFalse(op.unary());
    }

    @Test
    @DisplayName("Non-array operand is stored as a single unary operand")
    void unaryOperand() {
        OperationNode op = (OperationNode) RuleTreeParser.parse("{\"!\": {\"var\": \"flag\"}}");

        assertTrue(op.unary());
        assertEquals(1, op.arity());
        assertEquals(NodeKind.VARIABLE, op.operand(0).kind());
    }

    @Test
    @DisplayName("var with default keeps the array form")
    void varWithDefault() {
        VarNode var = (VarNode) RuleTreeParser.parse("{\"var\": [\"income\", 0]}");

        assertEquals("income", var.path());
        assertTrue(var.arrayForm());
        assertEquals(new LiteralNode(0), var.defaultValue());
    }

    @Test
    @DisplayName("Numeric var path is read as text")
    void numericVarPath() {
        VarNode var = (VarNode) RuleTreeParser.parse("{\"var\": 1}");
        assertEquals("1", var.path());
    }

    @Test
    @DisplayName("Scalars and arrays map to literals and lists")
    void scalarsAndLists() {
        assertEquals(new LiteralNode(true), RuleTreeParser.parse("true"));
        assertEquals(new LiteralNode(null), RuleTreeParser.parse("null"));
        assertEquals(new LiteralNode("x"), RuleTreeParser.parse("\"x\""));

        ListNode list = (ListNode) RuleTreeParser.parse("[1, \"a\", {\"var\": \"b\"}]");
        assertEquals(3, list.items().size());
        assertEquals(NodeKind.VARIABLE, list.items().get(2).kind());
    }

    @Test
    @DisplayName("fromObject accepts YAML-style maps and lists")
    void fromPlainObject() {
        Object plain = Map.of("and", List.of(
                Map.of("==", List.of(Map.of("var", "hasChildren"), true)),
                Map.of("<=", List.of(Map.of("var", "householdIncome"), 3500))));

        OperationNode node = (OperationNode) RuleTreeParser.fromObject(plain);

        assertEquals("and", node.operator());
        assertEquals(2, node.arity());
    }

    // =====================================================================
    // Errors
    // =====================================================================

    @Test
    @DisplayName("Multi-key object is rejected with its pointer")
    void multiKeyObjectRejected() {
        RuleParseException e = assertThrows(RuleParseException.class,
                () -> RuleTreeParser.parse("{\"and\": [true, {\"a\": 1, \"b\": 2}]}"));

        assertEquals("/and/1", e.getPointer());
    }

    @Test
    @DisplayName("Empty object is rejected")
    void emptyObjectRejected() {
        assertThrows(RuleParseException.class, () -> RuleTreeParser.parse("{}"));
    }

    @ParameterizedTest
    @DisplayName("Blank or malformed documents are rejected")
    @ValueSource(strings = {"", "   ", "{\"==\": [1,", "not json"})
    void malformedRejected(String json) {
        assertThrows(RuleParseException.class, () -> RuleTreeParser.parse(json));
    }

    @Test
    @DisplayName("Object var path is rejected")
    void objectVarPathRejected() {
        assertThrows(RuleParseException.class, () -> RuleTreeParser.parse("{\"var\": {\"a\": 1}}"));
    }

    // =====================================================================
    // Writing
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Written JSON parses back to an equal tree")
    @ValueSource(strings = {
            "{\">\":[{\"var\":\"age\"},18]}",
            "{\"!\":{\"var\":\"flag\"}}",
            "{\"var\":[\"a.b\",5]}",
            "{\"if\":[{\"var\":\"x\"},\"yes\",\"no\"]}",
            "[1,2.5,null,\"s\"]"
    })
    void writeThenParse(String json) {
        RuleNode tree = RuleTreeParser.parse(json);

        assertEquals(tree, RuleTreeParser.parse(RuleTreeWriter.toJson(tree)));
    }

    @Test
    @DisplayName("Unary and array var forms are written as they were read")
    void writerPreservesForms() {
        assertEquals("{\"!\":{\"var\":\"flag\"}}",
                RuleTreeWriter.toJson(RuleTreeParser.parse("{\"!\": {\"var\": \"flag\"}}")));
        assertEquals("{\"var\":[\"a\"]}",
                RuleTreeWriter.toJson(RuleTreeParser.parse("{\"var\": [\"a\"]}")));
    }
}
