package com.benefits.debug;

import com.benefits.expression.RuleInterpreter;
import com.benefits.operator.OperatorRegistry;
import com.benefits.rule.RuleNode;
import com.benefits.rule.RuleTreeParser;
import com.benefits.validation.RuleValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RuleDebuggerTest {

    private RuleDebugger debugger;

    @BeforeEach
    void setUp() {
        OperatorRegistry registry = OperatorRegistry.standard();
        debugger = new RuleDebugger(new RuleInterpreter(registry), new RuleValidator(registry));
    }

    // =====================================================================
    // Tracing
    // =====================================================================

    @Test
    @DisplayName("Trace records variable access then the operation")
    void traceSteps() {
        DebugResult result = debugger.debugRule(
                RuleTreeParser.parse("{\">\": [{\"var\": \"age\"}, 18]}"), Map.of("age", 25));

        assertTrue(result.success());
        assertEquals(true, result.result());
        assertEquals(2, result.trace().size());

        TraceStep access = result.trace().get(0);
        assertEquals("Access variable: age", access.description());
        assertEquals(25, access.result());

        TraceStep op = result.trace().get(1);
        assertEquals("Operator: >", op.description());
        assertEquals(List.of(25, 18), op.operands());
        assertEquals(true, op.result());

        assertEquals(Set.of("age"), result.variablesAccessed());
        assertEquals(Set.of(">"), result.operatorsUsed());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    @DisplayName("Undefined variables produce warnings")
    void undefinedVariableWarning() {
        DebugResult result = debugger.debugRule(RuleTreeParser.parse("{\"==\": [{\"var\": \"x\"}, 1]}"), Map.of());

        assertTrue(result.success());
        assertEquals(List.of("Variable 'x' is not defined in the data"), result.warnings());
    }

    @Test
    @DisplayName("Failure keeps the partial trace and adds an error step")
    void failureTrace() {
        DebugResult result = debugger.debugRule(
                RuleTreeParser.parse("{\"and\": [{\"var\": \"a\"}, {\"nope\": []}]}"), Map.of("a", true));

        assertFalse(result.success());
        assertNull(result.result());
        assertEquals(1, result.errors().size());
        TraceStep last = result.trace().get(result.trace().size() - 1);
        assertTrue(last.description().startsWith("Error in operator: "));
        assertEquals("Access variable: a", result.trace().get(0).description());
    }

    @Test
    @DisplayName("Formatted trace starts with a header")
    void formattedTrace() {
        DebugResult result = debugger.debugRule(RuleTreeParser.parse("{\"!\": [true]}"), Map.of());

        String text = DebugTraceFormatter.format(result.trace());
        assertTrue(text.startsWith("Debug Trace:"));
        assertTrue(text.contains("Operator: !"));
    }

    // =====================================================================
    // Inspection
    // =====================================================================

    @Test
    @DisplayName("Variable inspection reports definition and type")
    void inspectVariable() {
        VariableInspection defined = debugger.inspectVariable("household.size", Map.of("household", Map.of("size", 3)));
        assertTrue(defined.defined());
        assertEquals(3, defined.value());
        assertEquals("Integer", defined.type());

        VariableInspection missing = debugger.inspectVariable("nope", Map.of());
        assertFalse(missing.defined());
        assertEquals("undefined", missing.type());
    }

    @Test
    @DisplayName("Rule inspection counts usage and reports unused data fields")
    void inspectRule() {
        RuleNode rule = RuleTreeParser.parse(
                "{\"and\": [{\">\": [{\"var\": \"age\"}, 18]}, {\"<\": [{\"var\": \"age\"}, 65]}]}");

        RuleInspection inspection = debugger.inspectRule(rule, Map.of("age", 30, "zip", "12345"));

        assertTrue(inspection.valid());
        assertEquals(2, inspection.variableUsage().get("age"));
        assertEquals(1, inspection.operatorUsage().get("and"));
        assertTrue(inspection.suggestions().stream().anyMatch(s -> s.contains("zip")));
    }

    @Test
    @DisplayName("Comparison lists differing fields")
    void compareEvaluations() {
        RuleNode rule = RuleTreeParser.parse("{\">=\": [{\"var\": \"age\"}, 18]}");

        EvaluationComparison comparison = debugger.compareEvaluations(rule,
                Map.of("age", 20, "name", "a"), Map.of("age", 10, "name", "a"));

        assertFalse(comparison.same());
        assertEquals(1, comparison.differences().size());
        assertEquals("age", comparison.differences().get(0).field());
    }
}
