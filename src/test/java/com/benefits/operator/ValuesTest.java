package com.benefits.operator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValuesTest {

    @Test
    @DisplayName("Truthiness follows JSON-logic rules")
    void truthiness() {
        assertFalse(Values.truthy(null));
        assertFalse(Values.truthy(0));
        assertFalse(Values.truthy(""));
        assertFalse(Values.truthy(List.of()));
        assertFalse(Values.truthy(false));
        assertTrue(Values.truthy("0"));
        assertTrue(Values.truthy(List.of(0)));
        assertTrue(Values.truthy(Map.of()));
        assertTrue(Values.truthy(-1));
    }

    @Test
    @DisplayName("Loose equality coerces numbers and strings")
    void looseEquality() {
        assertTrue(Values.looseEquals(1, "1"));
        assertTrue(Values.looseEquals(1, 1.0));
        assertTrue(Values.looseEquals(true, 1));
        assertFalse(Values.looseEquals(null, 0));
        assertTrue(Values.looseEquals(null, null));
    }

    @Test
    @DisplayName("Strict equality compares type and value")
    void strictEquality() {
        assertFalse(Values.strictEquals(1, "1"));
        assertTrue(Values.strictEquals(1, 1L));
        assertTrue(Values.strictEquals("a", "a"));
    }

    @ParameterizedTest
    @DisplayName("Ordering comparisons")
    @CsvSource({
            "10, 9, true",
            "'10', '9', true",
            "'b', 'a', true",
            "'abc', 'abd', false"
    })
    void ordering(String a, String b, boolean greater) {
        assertEquals(greater, Values.compare(a, b, Values.Ordering.GREATER));
    }

    @Test
    @DisplayName("Comparisons with non-numeric operands are false")
    void nanComparisons() {
        assertFalse(Values.compare("abc", 5, Values.Ordering.GREATER));
        assertFalse(Values.compare("abc", 5, Values.Ordering.LESS_OR_EQUAL));
    }

    @Test
    @DisplayName("Integral results normalize to Long")
    void normalize() {
        assertEquals(4L, Values.normalize(4.0));
        assertEquals(2.5, Values.normalize(2.5));
    }
}
