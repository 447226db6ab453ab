package com.benefits.eligibility;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Self-reported household data.
 *
 * @param id     Profile id
 * @param fields Field values keyed by field name
 */
public record UserProfile(String id, Map<String, Object> fields) {

    public UserProfile {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object field(String name) {
        return fields.get(name);
    }
}
