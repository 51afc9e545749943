package com.agentdaemon.daemon.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Resolved daemon configuration.
 *
 * @param cycleInterval       time between cycle ticks
 * @param watchdogInterval    time between watchdog checks
 * @param heartbeatTimeout    heartbeat age beyond which the loop counts as stalled
 * @param snapshotEveryCycles snapshot cadence in completed cycles
 * @param snapshotPath        the single snapshot file
 * @param firstCycleDelay     delay before the first cycle after {@code start()}
 */
public record DaemonSettings(
    Duration cycleInterval,
    Duration watchdogInterval,
    Duration heartbeatTimeout,
    int snapshotEveryCycles,
    Path snapshotPath,
    Duration firstCycleDelay
) {

    public static final long DEFAULT_CYCLE_INTERVAL_MS    = 600_000;
    public static final long DEFAULT_WATCHDOG_INTERVAL_MS = 60_000;
    public static final long DEFAULT_HEARTBEAT_TIMEOUT_MS = 900_000;
    public static final int  DEFAULT_SNAPSHOT_EVERY       = 5;
    public static final long DEFAULT_FIRST_CYCLE_DELAY_MS = 5_000;

    public DaemonSettings {
        requirePositive(cycleInterval, "cycleInterval");
        requirePositive(watchdogInterval, "watchdogInterval");
        requirePositive(heartbeatTimeout, "heartbeatTimeout");
        if (snapshotEveryCycles <= 0) {
            throw new IllegalArgumentException("snapshotEveryCycles must be positive: " + snapshotEveryCycles);
        }
        if (snapshotPath == null) {
            throw new IllegalArgumentException("snapshotPath is required");
        }
        if (firstCycleDelay == null || firstCycleDelay.isNegative()) {
            throw new IllegalArgumentException("firstCycleDelay must not be negative");
        }
    }

    public static DaemonSettings defaults(Path snapshotPath) {
        return new DaemonSettings(
            Duration.ofMillis(DEFAULT_CYCLE_INTERVAL_MS),
            Duration.ofMillis(DEFAULT_WATCHDOG_INTERVAL_MS),
            Duration.ofMillis(DEFAULT_HEARTBEAT_TIMEOUT_MS),
            DEFAULT_SNAPSHOT_EVERY,
            snapshotPath,
            Duration.ofMillis(DEFAULT_FIRST_CYCLE_DELAY_MS));
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + d);
        }
    }
}
