package com.benefits.debug;

import java.util.List;
import java.util.Set;

/**
 * Result of {@link RuleDebugger#debugRule}.
 */
public record DebugResult(
        Object result,
        boolean success,
        List<TraceStep> trace,
        double totalTimeMillis,
        Set<String> variablesAccessed,
        Set<String> operatorsUsed,
        int maxDepth,
        List<String> errors,
        List<String> warnings
) {
}
