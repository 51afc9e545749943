package com.agentdaemon.common.model;

/**
 * Continuity bookkeeping that travels inside the snapshot file.
 *
 * @param record      current continuity record, {@code null} before the first check
 * @param rebootCount number of startup checks run across all process lifetimes
 */
public record ContinuityCheckpoint(ContinuityRecord record, int rebootCount) {

    public static ContinuityCheckpoint none() {
        return new ContinuityCheckpoint(null, 0);
    }

    public static ContinuityCheckpoint of(StateSnapshot snapshot) {
        return new ContinuityCheckpoint(snapshot.continuityRecord(), Math.max(0, snapshot.rebootCount()));
    }
}
