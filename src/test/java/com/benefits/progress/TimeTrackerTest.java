package com.benefits.progress;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TimeTrackerTest {

    private MutableClock clock;
    private TimeTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-15T12:00:00Z"));
        tracker = new TimeTracker(clock);
    }

    @Test
    @DisplayName("Elapsed time is zero before start")
    void notStarted() {
        clock.advance(Duration.ofMinutes(5));

        assertEquals(Duration.ZERO, tracker.getElapsedTime());
    }

    @Test
    @DisplayName("Paused periods are excluded from elapsed time")
    void pauseExcluded() {
        tracker.start();
        clock.advance(Duration.ofSeconds(30));
        tracker.pause();
        assertTrue(tracker.isPaused());
        clock.advance(Duration.ofMinutes(10));
        assertEquals(Duration.ofSeconds(30), tracker.getElapsedTime());

        tracker.resume();
        clock.advance(Duration.ofSeconds(15));

        assertFalse(tracker.isPaused());
        assertEquals(Duration.ofSeconds(45), tracker.getElapsedTime());
    }

    @Test
    @DisplayName("Question times accumulate across visits")
    void questionTimes() {
        tracker.recordQuestionTime("q1", Duration.ofSeconds(10));
        tracker.recordQuestionTime("q1", Duration.ofSeconds(5));
        tracker.recordQuestionTime("q2", Duration.ofSeconds(25));

        assertEquals(Duration.ofSeconds(15), tracker.getQuestionTime("q1").orElseThrow());
        assertTrue(tracker.getQuestionTime("q3").isEmpty());
        assertEquals(Duration.ofSeconds(20), tracker.getAverageQuestionTime());
    }

    @Test
    @DisplayName("Reset clears everything")
    void reset() {
        tracker.start();
        tracker.recordQuestionTime("q1", Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(10));

        tracker.reset();

        assertEquals(Duration.ZERO, tracker.getElapsedTime());
        assertEquals(Duration.ZERO, tracker.getAverageQuestionTime());
    }
}
