package com.agentdaemon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Timestamped record of cycle liveness or outcome.
 *
 * <p>Streak counters are derived from the <em>previous</em> heartbeat when the record is
 * built and never change afterwards:
 * <ul>
 *   <li>{@code completed}: successes + 1, failures reset to 0</li>
 *   <li>{@code error}: failures + 1, successes reset to 0</li>
 *   <li>{@code running}: both carried forward (a cycle start is not an outcome)</li>
 *   <li>{@code alive}: both reset to 0 (fresh start or finished recovery)</li>
 * </ul>
 */
public record Heartbeat(
    @JsonProperty("cycle")                 long cycle,
    @JsonProperty("timestamp")             Instant timestamp,
    @JsonProperty("status")                HeartbeatStatus status,
    @JsonProperty("cycle_duration_ms")     long cycleDurationMs,
    @JsonProperty("consecutive_successes") int consecutiveSuccesses,
    @JsonProperty("consecutive_failures")  int consecutiveFailures
) {

    /**
     * Builds the heartbeat that follows {@code previous}.
     *
     * @param previous   last recorded heartbeat, or {@code null} when none exists yet
     * @param cycle      cycle number the heartbeat refers to
     * @param status     outcome being recorded
     * @param durationMs elapsed cycle time; 0 for {@code alive}/{@code running}
     * @param at         emission time
     */
    public static Heartbeat next(Heartbeat previous, long cycle, HeartbeatStatus status,
                                 long durationMs, Instant at) {
        int prevSuccesses = previous != null ? previous.consecutiveSuccesses() : 0;
        int prevFailures  = previous != null ? previous.consecutiveFailures()  : 0;

        int successes;
        int failures;
        switch (status) {
            case COMPLETED -> { successes = prevSuccesses + 1; failures = 0; }
            case ERROR     -> { successes = 0; failures = prevFailures + 1; }
            case RUNNING   -> { successes = prevSuccesses; failures = prevFailures; }
            default        -> { successes = 0; failures = 0; }
        }
        return new Heartbeat(cycle, at, status, Math.max(0L, durationMs), successes, failures);
    }

    /** Age of this heartbeat relative to {@code now}; never negative. */
    public Duration ageAt(Instant now) {
        Duration age = Duration.between(timestamp, now);
        return age.isNegative() ? Duration.ZERO : age;
    }
}
