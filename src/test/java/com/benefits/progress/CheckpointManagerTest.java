package com.benefits.progress;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointManagerTest {

    private CheckpointManager manager;

    @BeforeEach
    void setUp() {
        manager = new CheckpointManager(new MutableClock(Instant.parse("2024-06-15T12:00:00Z")), 3);
    }

    // =====================================================================
    // Copy semantics
    // =====================================================================

    @Test
    @DisplayName("Restore returns an equal but independent copy")
    void restoreIsDeepCopy() {
        List<Object> incomes = new ArrayList<>(List.of(1200, 800));
        Map<String, Object> answers = new LinkedHashMap<>();
        answers.put("age", 34);
        answers.put("incomes", incomes);
        Checkpoint checkpoint = manager.createCheckpoint("income", "after income", answers);

        Map<String, Object> restored = manager.restoreCheckpoint(checkpoint.id()).orElseThrow();

        assertEquals(answers, restored);
        assertNotSame(answers, restored);
        assertNotSame(incomes, restored.get("incomes"));
    }

    @Test
    @DisplayName("Changing the source or a restored copy leaves the checkpoint intact")
    void checkpointIsolated() {
        Map<String, Object> answers = new LinkedHashMap<>();
        answers.put("age", 34);
        Checkpoint checkpoint = manager.createCheckpoint("age", "start", answers);

        answers.put("age", 99);
        manager.restoreCheckpoint(checkpoint.id()).orElseThrow().put("age", 12);

        assertEquals(Map.of("age", 34), manager.restoreCheckpoint(checkpoint.id()).orElseThrow());
        assertThrows(UnsupportedOperationException.class, () -> checkpoint.answers().put("x", 1));
    }

    @Test
    @DisplayName("Nested answers of a stored checkpoint cannot be modified")
    @SuppressWarnings("unchecked")
    void nestedAnswersFrozen() {
        Map<String, Object> household = new LinkedHashMap<>();
        household.put("size", 3);
        household.put("members", new ArrayList<>(List.of("adult", "child")));
        manager.createCheckpoint("household", "household", Map.of("household", household));

        Map<String, Object> stored = (Map<String, Object>) manager.getLatestCheckpoint().orElseThrow()
                .answers().get("household");

        assertThrows(UnsupportedOperationException.class, () -> stored.put("size", 99));
        assertThrows(UnsupportedOperationException.class, () -> ((List<Object>) stored.get("members")).add("x"));

        Map<String, Object> restored = manager.restoreCheckpoint("checkpoint-1").orElseThrow();
        Map<String, Object> restoredHousehold = (Map<String, Object>) restored.get("household");
        assertEquals(3, restoredHousehold.get("size"));
        restoredHousehold.put("size", 99);
        ((List<Object>) restoredHousehold.get("members")).add("x");

        Map<String, Object> again = (Map<String, Object>) manager.restoreCheckpoint("checkpoint-1")
                .orElseThrow().get("household");
        assertEquals(3, again.get("size"));
        assertEquals(List.of("adult", "child"), again.get("members"));
    }

    @Test
    @DisplayName("Unknown checkpoint restores nothing")
    void unknown() {
        assertTrue(manager.restoreCheckpoint("checkpoint-42").isEmpty());
        assertTrue(manager.getLatestCheckpoint().isEmpty());
    }

    // =====================================================================
    // Bounds
    // =====================================================================

    @Test
    @DisplayName("Oldest checkpoints are dropped beyond the limit")
    void trimOldest() {
        for (int i = 1; i <= 5; i++) {
            manager.createCheckpoint("n" + i, "cp" + i, Map.of());
        }

        List<Checkpoint> kept = manager.getCheckpoints();
        assertEquals(3, kept.size());
        assertEquals("checkpoint-3", kept.get(0).id());
        assertEquals("checkpoint-5", manager.getLatestCheckpoint().orElseThrow().id());
    }

    @Test
    @DisplayName("Lowering the limit trims immediately")
    void lowerLimit() {
        manager.createCheckpoint("a", "a", Map.of());
        manager.createCheckpoint("b", "b", Map.of());

        manager.setMaxCheckpoints(1);

        assertEquals(1, manager.getCheckpoints().size());
        assertEquals("b", manager.getCheckpoints().get(0).nodeId());
        assertThrows(IllegalArgumentException.class, () -> manager.setMaxCheckpoints(0));
    }

    @Test
    @DisplayName("Clear removes all checkpoints")
    void clear() {
        manager.createCheckpoint("a", "a", Map.of());

        manager.clear();

        assertTrue(manager.getCheckpoints().isEmpty());
    }
}
