package com.benefits.config;

import com.benefits.exception.ConfigurationException;
import com.benefits.expression.RuleInterpreter;
import com.benefits.operator.OperatorRegistry;
import com.benefits.questionnaire.FlowEngine;
import com.benefits.questionnaire.FlowNode;
import com.benefits.questionnaire.InputType;
import com.benefits.questionnaire.Question;
import com.benefits.questionnaire.QuestionFlow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FlowConfigLoaderTest {

    private static final RuleInterpreter INTERPRETER = new RuleInterpreter(OperatorRegistry.standard());

    // =====================================================================
    // Loading
    // =====================================================================

    @Test
    @DisplayName("Loads nodes, questions and branches")
    void loadFlow() {
        FlowDefinition definition = FlowConfigLoader.load("classpath:config/test-flow.yaml");
        QuestionFlow flow = definition.flow();

        assertEquals("test-flow", flow.getId());
        assertEquals("Test flow", flow.getName());
        assertEquals("2.1.0", flow.getVersion());
        assertEquals("first", flow.getStartNodeId());
        assertEquals(3, flow.size());

        FlowNode first = flow.node("first").orElseThrow();
        assertEquals("second", first.nextId());
        assertEquals(1, first.branches().size());
        assertEquals(2, first.branches().get(0).priority());
        assertEquals("last", first.branches().get(0).targetId());
        assertEquals(0.0, first.question().min());
        assertEquals(100.0, first.question().max());

        Question colour = flow.node("second").orElseThrow().question();
        assertEquals(InputType.SELECT, colour.inputType());
        assertEquals(List.of("red", "green"), colour.options());
        assertNotNull(colour.showIf());
        assertFalse(colour.required());
        assertNull(colour.min());

        assertTrue(flow.node("last").orElseThrow().terminal());
    }

    @Test
    @DisplayName("Loaded conditions drive navigation")
    void conditionsEvaluate() {
        FlowEngine engine = new FlowEngine(FlowConfigLoader.load("classpath:config/test-flow.yaml").flow(),
                INTERPRETER);

        assertEquals("last", engine.findNextNode("first", Map.of("score", 80)).targetNodeId());
        assertEquals("second", engine.findNextNode("first", Map.of("score", 10)).targetNodeId());
        assertTrue(engine.validateFlow().valid());
    }

    @Test
    @DisplayName("Skip rules and sections are loaded with defaults")
    void skipRulesAndSections() {
        FlowDefinition definition = FlowConfigLoader.load("classpath:config/test-flow.yaml");

        assertEquals(1, definition.skipRules().size());
        assertEquals(List.of("q2"), definition.skipRules().get(0).questionIds());
        assertEquals(0, definition.skipRules().get(0).priority());

        assertEquals(2, definition.sections().size());
        assertEquals("main", definition.sections().get(0).name());
        assertEquals(0, definition.sections().get(0).order());
        assertEquals(0, definition.sections().get(1).order());
    }

    @Test
    @DisplayName("Bundled questionnaire is a valid flow")
    void bundledFlow() {
        FlowDefinition definition = FlowConfigLoader.load("classpath:questionnaire-flow.yaml");

        FlowEngine engine = new FlowEngine(definition.flow(), INTERPRETER);

        assertTrue(engine.validateFlow().valid(), () -> engine.validateFlow().errors().toString());
        assertFalse(definition.skipRules().isEmpty());
    }

    // =====================================================================
    // Failures
    // =====================================================================

    @Test
    @DisplayName("Missing file fails with a configuration error")
    void missingFile() {
        assertThrows(ConfigurationException.class, () -> FlowConfigLoader.load("classpath:config/nope.yaml"));
    }

    @Test
    @DisplayName("Empty file fails with a configuration error")
    void emptyFile() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> FlowConfigLoader.load("classpath:config/empty.yaml"));
        assertTrue(e.getMessage().contains("empty"));
    }

    @Test
    @DisplayName("Malformed condition names its owner")
    void badCondition() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> FlowConfigLoader.load("classpath:config/bad-condition.yaml"));
        assertTrue(e.getMessage().contains("branch bad"));
    }

    @Test
    @DisplayName("Unknown input type is rejected")
    void badInputType() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> FlowConfigLoader.load("classpath:config/bad-input-type.yaml"));
        assertTrue(e.getMessage().contains("Invalid node 0"));
    }

    @Test
    @DisplayName("Flow without an id is rejected")
    void missingId() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> FlowConfigLoader.parse(Map.of("nodes", List.of())));
        assertEquals("Flow is missing 'id'", e.getMessage());
    }
}
