package com.benefits.debug;

import java.util.List;

/**
 * A variable looked up in a data context.
 *
 * @param name    Dot path
 * @param value   Resolved value, null if undefined
 * @param type    Simple type name of the value, "undefined" if absent
 * @param defined Whether the path resolved to a non-null value
 * @param truthy  Truthiness of the value
 * @param path    Path segments
 */
public record VariableInspection(String name, Object value, String type, boolean defined, boolean truthy,
                                 List<String> path) {
}
