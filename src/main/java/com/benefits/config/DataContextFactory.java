package com.benefits.config;

import com.benefits.exception.ConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds data contexts for rule evaluation from JSON documents.
 */
public final class DataContextFactory {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private DataContextFactory() {
    }

    /**
     * Parse a JSON object into a mutable, insertion-ordered map.
     *
     * @throws ConfigurationException if the text is not a JSON object
     */
    public static Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Data context is not a JSON object: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Copy of {@code fields} with every entry of {@code overrides} applied on top.
     */
    public static Map<String, Object> merge(Map<String, Object> fields, Map<String, Object> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(fields);
        merged.putAll(overrides);
        return merged;
    }
}
