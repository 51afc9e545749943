package com.agentdaemon.daemon.snapshot;

import com.agentdaemon.common.model.StateSnapshot;

/**
 * Result of reading the snapshot file once at startup.
 * {@link Outcome#MISSING} and {@link Outcome#CORRUPTED} both mean "no usable snapshot".
 */
public record SnapshotLoad(Outcome outcome, StateSnapshot snapshot) {

    public enum Outcome { LOADED, MISSING, CORRUPTED }

    public static SnapshotLoad loaded(StateSnapshot snapshot) {
        return new SnapshotLoad(Outcome.LOADED, snapshot);
    }

    public static SnapshotLoad missing() {
        return new SnapshotLoad(Outcome.MISSING, null);
    }

    public static SnapshotLoad corrupted() {
        return new SnapshotLoad(Outcome.CORRUPTED, null);
    }

    public boolean usable() {
        return outcome == Outcome.LOADED;
    }
}
