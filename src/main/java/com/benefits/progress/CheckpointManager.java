package com.benefits.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps a bounded, creation-ordered list of checkpoints. When the bound is reached the
 * oldest checkpoint is dropped.
 * <p>
 * Stored answers are an unmodifiable deep copy at every nesting level; restoring hands out
 * a fresh mutable deep copy, so neither the caller's map nor a restored map can alter a
 * stored checkpoint.
 */
public class CheckpointManager {

    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);

    public static final int DEFAULT_MAX_CHECKPOINTS = 50;

    private final Clock clock;
    private final List<Checkpoint> checkpoints = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private int maxCheckpoints;

    public CheckpointManager(Clock clock) {
        this(clock, DEFAULT_MAX_CHECKPOINTS);
    }

    public CheckpointManager(Clock clock, int maxCheckpoints) {
        if (maxCheckpoints < 1) {
            throw new IllegalArgumentException("maxCheckpoints must be positive: " + maxCheckpoints);
        }
        this.clock = clock;
        this.maxCheckpoints = maxCheckpoints;
    }

    public Checkpoint createCheckpoint(String nodeId, String name, Map<String, Object> answers) {
        return createCheckpoint(nodeId, name, answers, null);
    }

    public synchronized Checkpoint createCheckpoint(String nodeId, String name, Map<String, Object> answers,
                                                    String description) {
        Checkpoint checkpoint = new Checkpoint(
                "checkpoint-" + sequence.incrementAndGet(),
                nodeId,
                name,
                description,
                frozenCopy(answers),
                clock.instant());
        checkpoints.add(checkpoint);
        trim();
        log.debug("Created checkpoint {} at node {}", checkpoint.id(), nodeId);
        return checkpoint;
    }

    public synchronized Optional<Checkpoint> getCheckpoint(String checkpointId) {
        return checkpoints.stream().filter(c -> c.id().equals(checkpointId)).findFirst();
    }

    public synchronized List<Checkpoint> getCheckpoints() {
        return List.copyOf(checkpoints);
    }

    public synchronized Optional<Checkpoint> getLatestCheckpoint() {
        return checkpoints.isEmpty() ? Optional.empty() : Optional.of(checkpoints.get(checkpoints.size() - 1));
    }

    /**
     * A fresh, mutable copy of the checkpoint's answers; empty if no such checkpoint.
     */
    public Optional<Map<String, Object>> restoreCheckpoint(String checkpointId) {
        return getCheckpoint(checkpointId).map(checkpoint -> deepCopy(checkpoint.answers()));
    }

    public synchronized void clear() {
        checkpoints.clear();
    }

    public synchronized int getMaxCheckpoints() {
        return maxCheckpoints;
    }

    public synchronized void setMaxCheckpoints(int maxCheckpoints) {
        if (maxCheckpoints < 1) {
            throw new IllegalArgumentException("maxCheckpoints must be positive: " + maxCheckpoints);
        }
        this.maxCheckpoints = maxCheckpoints;
        trim();
    }

    private void trim() {
        while (checkpoints.size() > maxCheckpoints) {
            Checkpoint dropped = checkpoints.remove(0);
            log.debug("Dropped checkpoint {}", dropped.id());
        }
    }

    static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            for (Map.Entry<String, Object> entry : source.entrySet()) {
                copy.put(entry.getKey(), copyValue(entry.getValue(), false));
            }
        }
        return copy;
    }

    static Map<String, Object> frozenCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            for (Map.Entry<String, Object> entry : source.entrySet()) {
                copy.put(entry.getKey(), copyValue(entry.getValue(), true));
            }
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value, boolean frozen) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(entry.getKey(), copyValue(entry.getValue(), frozen));
            }
            return frozen ? Collections.unmodifiableMap(copy) : copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(copyValue(item, frozen));
            }
            return frozen ? Collections.unmodifiableList(copy) : copy;
        }
        return value;
    }
}
