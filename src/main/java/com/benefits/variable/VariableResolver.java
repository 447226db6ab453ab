package com.benefits.variable;

import java.util.Optional;

/**
 * Resolves dot-path variable references against a data context.
 * <p>
 * Paths walk nested maps by key and lists by numeric index, e.g.
 * {@code household.members.0.age}. An empty path refers to the data itself.
 */
public interface VariableResolver {

    /**
     * Resolve a path.
     *
     * @param path Dot-separated path
     * @param data Data context (map, list or scalar)
     * @return Resolved value, or empty when any segment is missing or the value is null
     */
    Optional<Object> resolve(String path, Object data);
}
