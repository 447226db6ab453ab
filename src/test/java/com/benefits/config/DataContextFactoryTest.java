package com.benefits.config;

import com.benefits.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DataContextFactoryTest {

    @Test
    @DisplayName("Parses nested JSON into ordered maps")
    void parse() {
        Map<String, Object> context = DataContextFactory.fromJson("""
                {"age": 34, "income": {"monthly": 2500.5}, "tags": ["a", "b"]}
                """);

        assertEquals(List.of("age", "income", "tags"), List.copyOf(context.keySet()));
        assertEquals(34, context.get("age"));
        assertEquals(Map.of("monthly", 2500.5), context.get("income"));
        assertEquals(List.of("a", "b"), context.get("tags"));
    }

    @Test
    @DisplayName("Blank input yields an empty mutable map")
    void blank() {
        Map<String, Object> context = DataContextFactory.fromJson("  ");

        assertTrue(context.isEmpty());
        context.put("x", 1);
    }

    @Test
    @DisplayName("Non-object JSON is rejected")
    void notAnObject() {
        assertThrows(ConfigurationException.class, () -> DataContextFactory.fromJson("[1, 2]"));
        assertThrows(ConfigurationException.class, () -> DataContextFactory.fromJson("{broken"));
    }

    @Test
    @DisplayName("Overrides win on merge")
    void merge() {
        Map<String, Object> merged = DataContextFactory.merge(Map.of("a", 1, "b", 2), Map.of("b", 3));

        assertEquals(Map.of("a", 1, "b", 3), merged);
    }
}
