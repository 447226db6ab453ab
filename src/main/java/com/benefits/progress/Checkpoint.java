package com.benefits.progress;

import java.time.Instant;
import java.util.Map;

/**
 * Saved questionnaire position and answers.
 *
 * @param id          Checkpoint id
 * @param nodeId      Node current when the checkpoint was taken
 * @param name        Display name
 * @param description Optional description
 * @param answers     Deep copy of the answers at that time
 * @param createdAt   Creation time
 */
public record Checkpoint(
        String id,
        String nodeId,
        String name,
        String description,
        Map<String, Object> answers,
        Instant createdAt
) {
}
