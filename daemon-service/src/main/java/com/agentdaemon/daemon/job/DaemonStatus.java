package com.agentdaemon.daemon.job;

import com.agentdaemon.common.model.ContinuityMode;
import com.agentdaemon.common.model.ContinuityStatus;
import com.agentdaemon.common.model.Heartbeat;
import com.agentdaemon.common.model.StateSnapshot;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Read-only view of the daemon for the status endpoint.
 *
 * @param runningSince start of the cycle currently in flight, {@code null} when idle
 * @param uptimeMs     time since {@code startedAt}, 0 when never started
 */
public record DaemonStatus(
    @JsonProperty("enabled")          boolean enabled,
    @JsonProperty("running")          boolean running,
    @JsonProperty("healthy")          boolean healthy,
    @JsonProperty("startedAt")        Instant startedAt,
    @JsonProperty("totalCyclesRun")   long totalCyclesRun,
    @JsonProperty("cycleIntervalMs")  long cycleIntervalMs,
    @JsonProperty("watchdogEnabled")  boolean watchdogEnabled,
    @JsonProperty("lastHeartbeat")    Heartbeat lastHeartbeat,
    @JsonProperty("lastSnapshot")     SnapshotRef lastSnapshot,
    @JsonProperty("recoveryCount")    int recoveryCount,
    @JsonProperty("lastRecovery")     Instant lastRecovery,
    @JsonProperty("rebirthCount")     int rebirthCount,
    @JsonProperty("continuityStatus") ContinuityStatus continuityStatus,
    @JsonProperty("continuityMode")   ContinuityMode continuityMode,
    @JsonProperty("runningSince")     Instant runningSince,
    @JsonProperty("uptimeMs")         long uptimeMs
) {

    public record SnapshotRef(
        @JsonProperty("id")        String id,
        @JsonProperty("cycle")     long cycle,
        @JsonProperty("timestamp") Instant timestamp
    ) {
        public static SnapshotRef of(StateSnapshot snapshot) {
            return new SnapshotRef(snapshot.id(), snapshot.cycle(), snapshot.timestamp());
        }
    }
}
