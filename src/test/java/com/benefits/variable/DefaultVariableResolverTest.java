package com.benefits.variable;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultVariableResolverTest {

    private final VariableResolver resolver = DefaultVariableResolver.getInstance();

    private final Map<String, Object> data = Map.of(
            "age", 34,
            "household", Map.of(
                    "size", 3,
                    "members", List.of(Map.of("age", 8), Map.of("age", 41))));

    @Test
    @DisplayName("Dot paths walk maps and list indexes")
    void nestedPaths() {
        assertEquals(34, resolver.resolve("age", data).orElseThrow());
        assertEquals(3, resolver.resolve("household.size", data).orElseThrow());
        assertEquals(41, resolver.resolve("household.members.1.age", data).orElseThrow());
    }

    @Test
    @DisplayName("Empty path resolves to the data itself")
    void emptyPath() {
        assertSame(data, resolver.resolve("", data).orElseThrow());
    }

    @Test
    @DisplayName("Missing segments, bad indexes and scalars resolve to empty")
    void missing() {
        assertTrue(resolver.resolve("income", data).isEmpty());
        assertTrue(resolver.resolve("household.members.5.age", data).isEmpty());
        assertTrue(resolver.resolve("household.members.first", data).isEmpty());
        assertTrue(resolver.resolve("age.years", data).isEmpty());
        assertTrue(resolver.resolve("a", null).isEmpty());
    }

    @Test
    @DisplayName("Null values count as absent")
    void nullValue() {
        List<Object> withNull = Arrays.asList(1, null);

        assertTrue(resolver.resolve("1", withNull).isEmpty());
    }
}
