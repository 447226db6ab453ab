package com.benefits.progress;

import java.util.List;
import java.util.Objects;

/**
 * Named group of questions reported on together.
 */
public record FlowSection(String id, String name, List<String> questionIds, int order, boolean required) {

    public FlowSection {
        Objects.requireNonNull(id, "id");
        questionIds = questionIds == null ? List.of() : List.copyOf(questionIds);
    }
}
