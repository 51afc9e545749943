package com.agentdaemon.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class HeartbeatTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Nested
    @DisplayName("next(): streak counters")
    class Streaks {

        @Test
        @DisplayName("completed increments successes and clears failures")
        void completed() {
            Heartbeat prev = new Heartbeat(1, T0, HeartbeatStatus.ERROR, 10, 0, 2);
            Heartbeat hb = Heartbeat.next(prev, 2, HeartbeatStatus.COMPLETED, 15, T0);
            assertEquals(1, hb.consecutiveSuccesses());
            assertEquals(0, hb.consecutiveFailures());
        }

        @Test
        @DisplayName("error increments failures and clears successes")
        void error() {
            Heartbeat prev = new Heartbeat(1, T0, HeartbeatStatus.COMPLETED, 10, 4, 0);
            Heartbeat hb = Heartbeat.next(prev, 2, HeartbeatStatus.ERROR, 15, T0);
            assertEquals(0, hb.consecutiveSuccesses());
            assertEquals(1, hb.consecutiveFailures());
        }

        @Test
        @DisplayName("running carries both counters forward")
        void running() {
            Heartbeat prev = new Heartbeat(1, T0, HeartbeatStatus.ERROR, 10, 0, 2);
            Heartbeat hb = Heartbeat.next(prev, 2, HeartbeatStatus.RUNNING, 0, T0);
            assertEquals(2, hb.consecutiveFailures());
            assertEquals(3, Heartbeat.next(hb, 2, HeartbeatStatus.ERROR, 5, T0).consecutiveFailures());
        }

        @Test
        @DisplayName("alive starts a new streak")
        void alive() {
            Heartbeat prev = new Heartbeat(1, T0, HeartbeatStatus.ERROR, 10, 0, 3);
            Heartbeat hb = Heartbeat.next(prev, 1, HeartbeatStatus.ALIVE, 0, T0);
            assertEquals(0, hb.consecutiveFailures());
            assertEquals(0, hb.consecutiveSuccesses());
        }

        @Test
        @DisplayName("first heartbeat starts from zero and negative durations clamp to zero")
        void first() {
            Heartbeat hb = Heartbeat.next(null, 0, HeartbeatStatus.COMPLETED, -5, T0);
            assertEquals(1, hb.consecutiveSuccesses());
            assertEquals(0, hb.cycleDurationMs());
        }
    }

    @Test
    @DisplayName("ageAt() is never negative")
    void ageNeverNegative() {
        Heartbeat hb = new Heartbeat(1, T0, HeartbeatStatus.ALIVE, 0, 0, 0);
        assertEquals(Duration.ofSeconds(30), hb.ageAt(T0.plusSeconds(30)));
        assertEquals(Duration.ZERO, hb.ageAt(T0.minusSeconds(30)));
    }
}
