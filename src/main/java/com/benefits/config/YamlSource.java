package com.benefits.config;

import com.benefits.exception.ConfigurationException;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Shared YAML reading for the configuration loaders.
 * Supports the {@code classpath:} prefix for classpath resources.
 */
final class YamlSource {

    static final String CLASSPATH_PREFIX = "classpath:";

    private YamlSource() {
    }

    static Map<String, Object> read(String path) {
        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                Yaml yaml = new Yaml();
                Map<String, Object> root = yaml.load(inputStream);
                if (root == null) {
                    throw new ConfigurationException("Configuration file is empty: " + path);
                }
                return root;
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        } catch (ClassCastException e) {
            throw new ConfigurationException("Configuration root must be a mapping: " + path, e);
        }
    }

    static Resource getResource(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(path.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> section(Map<String, Object> root, String key) {
        Object value = root.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new ConfigurationException("'" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> list(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?>)) {
            throw new ConfigurationException("'" + key + "' must be a list");
        }
        return (List<Map<String, Object>>) value;
    }

    static List<String> strings(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> items)) {
            return List.of(value.toString());
        }
        return items.stream().map(String::valueOf).toList();
    }

    static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    static String requireString(Map<String, Object> map, String key, String owner) {
        String value = getString(map, key, null);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(owner + " is missing '" + key + "'");
        }
        return value;
    }

    static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        return Integer.parseInt(value.toString());
    }

    static Double getDouble(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (value instanceof Number) return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Expected a number for '" + key + "' but got: " + value, e);
        }
    }

    static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
