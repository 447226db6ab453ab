package com.benefits.debug;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Locale;

/**
 * Renders a debug trace as indented text, one block per step.
 */
public final class DebugTraceFormatter {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private DebugTraceFormatter() {
    }

    public static String format(List<TraceStep> trace) {
        StringBuilder sb = new StringBuilder("Debug Trace:\n\n");
        for (TraceStep step : trace) {
            String indent = "  ".repeat(step.level());
            sb.append(indent).append('[').append(step.step()).append("] ").append(step.description());
            if (step.durationMillis() > 0) {
                sb.append(String.format(Locale.ROOT, " (%.2fms)", step.durationMillis()));
            }
            sb.append('\n');
            if (!step.operands().isEmpty()) {
                sb.append(indent).append("    Operands: ").append(toJson(step.operands())).append('\n');
            }
            sb.append(indent).append("    Result: ").append(toJson(step.result())).append("\n\n");
        }
        return sb.toString();
    }

    private static String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
