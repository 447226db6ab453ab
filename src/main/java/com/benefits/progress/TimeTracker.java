package com.benefits.progress;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tracks time spent in a questionnaire, excluding paused periods.
 */
public class TimeTracker {

    private final Clock clock;
    private final Map<String, Duration> questionTimes = new LinkedHashMap<>();

    private Instant startedAt;
    private Instant pausedAt;
    private Duration pausedTotal = Duration.ZERO;

    public TimeTracker(Clock clock) {
        this.clock = clock;
    }

    public synchronized void start() {
        startedAt = clock.instant();
        pausedAt = null;
        pausedTotal = Duration.ZERO;
    }

    public synchronized void pause() {
        if (startedAt != null && pausedAt == null) {
            pausedAt = clock.instant();
        }
    }

    public synchronized void resume() {
        if (pausedAt != null) {
            pausedTotal = pausedTotal.plus(Duration.between(pausedAt, clock.instant()));
            pausedAt = null;
        }
    }

    public synchronized boolean isPaused() {
        return pausedAt != null;
    }

    /**
     * Add time spent on a question; repeated visits accumulate.
     */
    public synchronized void recordQuestionTime(String questionId, Duration spent) {
        questionTimes.merge(questionId, spent, Duration::plus);
    }

    public synchronized Duration getElapsedTime() {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        Instant end = pausedAt != null ? pausedAt : clock.instant();
        return Duration.between(startedAt, end).minus(pausedTotal);
    }

    public synchronized Optional<Duration> getQuestionTime(String questionId) {
        return Optional.ofNullable(questionTimes.get(questionId));
    }

    public synchronized Duration getAverageQuestionTime() {
        if (questionTimes.isEmpty()) {
            return Duration.ZERO;
        }
        Duration total = Duration.ZERO;
        for (Duration spent : questionTimes.values()) {
            total = total.plus(spent);
        }
        return total.dividedBy(questionTimes.size());
    }

    public synchronized void reset() {
        startedAt = null;
        pausedAt = null;
        pausedTotal = Duration.ZERO;
        questionTimes.clear();
    }
}
