package com.benefits.variable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of VariableResolver.
 */
public class DefaultVariableResolver implements VariableResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultVariableResolver.class);

    private static final DefaultVariableResolver INSTANCE = new DefaultVariableResolver();

    public static DefaultVariableResolver getInstance() {
        return INSTANCE;
    }

    @Override
    public Optional<Object> resolve(String path, Object data) {
        if (path == null || path.isEmpty()) {
            return Optional.ofNullable(data);
        }
        Object current = data;
        for (String segment : path.split("\\.", -1)) {
            if (current == null) {
                return Optional.empty();
            }
            if (current instanceof Map<?, ?> map) {
                current = map.get(segment);
            } else if (current instanceof List<?> list) {
                current = elementAt(list, segment);
            } else {
                log.trace("Path {} descends into scalar at segment {}", path, segment);
                return Optional.empty();
            }
        }
        return Optional.ofNullable(current);
    }

    private static Object elementAt(List<?> list, String segment) {
        try {
            int index = Integer.parseInt(segment);
            return index >= 0 && index < list.size() ? list.get(index) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
