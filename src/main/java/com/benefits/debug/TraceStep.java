package com.benefits.debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One recorded step of a debug trace.
 *
 * @param step           Index in completion order, from 0
 * @param description    What happened, e.g. "Operator: &lt;="
 * @param operator       Operator name ({@code var} for variable access)
 * @param operands       Resolved operand values
 * @param result         Step result, null for error steps
 * @param level          Nesting level, 0 at the root
 * @param durationMillis Time spent, 0 when not measured
 */
public record TraceStep(
        int step,
        String description,
        String operator,
        List<Object> operands,
        Object result,
        int level,
        double durationMillis
) {

    public TraceStep {
        operands = operands == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(operands));
    }
}
