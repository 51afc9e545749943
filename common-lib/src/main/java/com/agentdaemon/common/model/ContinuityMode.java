package com.agentdaemon.common.model;

/** Lifecycle of the continuity engine: {@code INITIALIZING → NORMAL | RECOVERY}. */
public enum ContinuityMode {
    INITIALIZING,
    NORMAL,
    RECOVERY
}
