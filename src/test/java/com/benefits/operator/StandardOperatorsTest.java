package com.benefits.operator;

import com.benefits.exception.EvaluationErrorCode;
import com.benefits.exception.RuleEvaluationException;
import com.benefits.expression.RuleInterpreter;
import com.benefits.rule.RuleTreeParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StandardOperatorsTest {

    private RuleInterpreter interpreter;

    @BeforeEach
    void setUp() {
        interpreter = new RuleInterpreter(OperatorRegistry.standard());
    }

    private Object eval(String rule, Object data) {
        return interpreter.evaluate(RuleTreeParser.parse(rule), data);
    }

    // =====================================================================
    // Comparison
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Comparison operators")
    @CsvSource(delimiter = '|', value = {
            "{\"==\": [1, \"1\"]}             | true",
            "{\"===\": [1, \"1\"]}            | false",
            "{\"!=\": [1, 2]}                 | true",
            "{\"!==\": [1, 1]}                | false",
            "{\">\": [5, 3]}                  | true",
            "{\">=\": [3, 3]}                 | true",
            "{\"<\": [1, 2, 3]}               | true",
            "{\"<\": [1, 5, 3]}               | false",
            "{\"<=\": [1, 1, 3]}              | true",
            "{\"in\": [\"b\", [\"a\", \"b\"]]} | true",
            "{\"in\": [\"ell\", \"hello\"]}   | true"
    })
    void comparisons(String rule, boolean expected) {
        assertEquals(expected, eval(rule, Map.of()));
    }

    // =====================================================================
    // Logic
    // =====================================================================

    @Test
    @DisplayName("and/or return the deciding operand")
    void andOrReturnDecidingValue() {
        assertEquals(0, eval("{\"and\": [1, 0, 2]}", Map.of()));
        assertEquals(2, eval("{\"and\": [1, 2]}", Map.of()));
        assertEquals("a", eval("{\"or\": [0, \"a\", \"b\"]}", Map.of()));
        assertEquals(false, eval("{\"or\": [0, false]}", Map.of()));
    }

    @Test
    @DisplayName("and short-circuits before an unknown operator")
    void andShortCircuits() {
        assertEquals(false, eval("{\"and\": [false, {\"nope\": []}]}", Map.of()));
    }

    @Test
    @DisplayName("if chains condition/value pairs with an optional else")
    void ifChains() {
        String rule = "{\"if\": [{\"<\": [{\"var\": \"t\"}, 0]}, \"freezing\", "
                + "{\"<\": [{\"var\": \"t\"}, 100]}, \"liquid\", \"gas\"]}";

        assertEquals("freezing", eval(rule, Map.of("t", -5)));
        assertEquals("liquid", eval(rule, Map.of("t", 20)));
        assertEquals("gas", eval(rule, Map.of("t", 150)));
        assertNull(eval("{\"if\": [false, 1]}", Map.of()));
    }

    @Test
    @DisplayName("Negation operators")
    void negation() {
        assertEquals(true, eval("{\"!\": [[]]}", Map.of()));
        assertEquals(true, eval("{\"!!\": [\"0\"]}", Map.of()));
    }

    // =====================================================================
    // Arithmetic
    // =====================================================================

    @Test
    @DisplayName("Arithmetic normalizes integral results")
    void arithmetic() {
        assertEquals(6L, eval("{\"+\": [1, 2, 3]}", Map.of()));
        assertEquals(3.5, eval("{\"+\": [1, 2.5]}", Map.of()));
        assertEquals(-4L, eval("{\"-\": [4]}", Map.of()));
        assertEquals(2.5, eval("{\"/\": [5, 2]}", Map.of()));
        assertEquals(1L, eval("{\"%\": [7, 3]}", Map.of()));
        assertEquals(24L, eval("{\"*\": [2, 3, 4]}", Map.of()));
        assertEquals(3L, eval("{\"+\": [\"1\", \"2\"]}", Map.of()));
    }

    @Test
    @DisplayName("min/max ignore nothing and return null on empty input")
    void minMax() {
        assertEquals(1L, eval("{\"min\": [3, 1, 2]}", Map.of()));
        assertEquals(3L, eval("{\"max\": [3, 1, 2]}", Map.of()));
        assertNull(eval("{\"max\": []}", Map.of()));
        assertNull(eval("{\"min\": [1, \"x\"]}", Map.of()));
    }

    // =====================================================================
    // Strings and arrays
    // =====================================================================

    @Test
    @DisplayName("cat and substr")
    void strings() {
        assertEquals("I love pie", eval("{\"cat\": [\"I love\", \" pie\"]}", Map.of()));
        assertEquals("go", eval("{\"substr\": [\"jsonlogic\", -5, 2]}", Map.of()));
        assertEquals("logic", eval("{\"substr\": [\"jsonlogic\", 4]}", Map.of()));
        assertEquals("json", eval("{\"substr\": [\"jsonlogic\", 0, -5]}", Map.of()));
    }

    @Test
    @DisplayName("map, filter and reduce over a data list")
    void arrayOperators() {
        Map<String, Object> data = Map.of("xs", List.of(1, 2, 3, 4));

        assertEquals(List.of(2L, 4L, 6L, 8L), eval("{\"map\": [{\"var\": \"xs\"}, {\"*\": [{\"var\": \"\"}, 2]}]}", data));
        assertEquals(List.of(2, 4), eval("{\"filter\": [{\"var\": \"xs\"}, {\"==\": [{\"%\": [{\"var\": \"\"}, 2]}, 0]}]}", data));
        assertEquals(10L, eval("{\"reduce\": [{\"var\": \"xs\"}, "
                + "{\"+\": [{\"var\": \"current\"}, {\"var\": \"accumulator\"}]}, 0]}", data));
    }

    @Test
    @DisplayName("all is false on an empty list; some and none")
    void quantifiers() {
        Map<String, Object> data = Map.of("xs", List.of(1, 2), "empty", List.of());

        assertEquals(true, eval("{\"all\": [{\"var\": \"xs\"}, {\">\": [{\"var\": \"\"}, 0]}]}", data));
        assertEquals(false, eval("{\"all\": [{\"var\": \"empty\"}, {\">\": [{\"var\": \"\"}, 0]}]}", data));
        assertEquals(true, eval("{\"some\": [{\"var\": \"xs\"}, {\">\": [{\"var\": \"\"}, 1]}]}", data));
        assertEquals(true, eval("{\"none\": [{\"var\": \"xs\"}, {\">\": [{\"var\": \"\"}, 5]}]}", data));
    }

    @Test
    @DisplayName("merge flattens one level")
    void merge() {
        assertEquals(List.of(1, 2, 3, 4), eval("{\"merge\": [[1, 2], 3, [4]]}", Map.of()));
    }

    // =====================================================================
    // Data
    // =====================================================================

    @Test
    @DisplayName("missing lists absent and empty fields")
    void missing() {
        Map<String, Object> data = Map.of("a", 1, "c", "");

        assertEquals(List.of("b", "c"), eval("{\"missing\": [\"a\", \"b\", \"c\"]}", data));
    }

    @Test
    @DisplayName("missing_some is empty once enough fields are present")
    void missingSome() {
        Map<String, Object> data = Map.of("a", 1, "b", 2);

        assertEquals(List.of(), eval("{\"missing_some\": [2, [\"a\", \"b\", \"c\"]]}", data));
        assertEquals(List.of("c"), eval("{\"missing_some\": [3, [\"a\", \"b\", \"c\"]]}", data));
    }

    @Test
    @DisplayName("missing_some without a path list is an invalid rule")
    void missingSomeArity() {
        RuleEvaluationException e = assertThrows(RuleEvaluationException.class,
                () -> eval("{\"missing_some\": [1]}", Map.of()));
        assertEquals(EvaluationErrorCode.INVALID_RULE, e.getCode());
    }

    @Test
    @DisplayName("log returns its operand")
    void logReturnsValue() {
        assertEquals("apple", eval("{\"log\": \"apple\"}", Map.of()));
    }
}
