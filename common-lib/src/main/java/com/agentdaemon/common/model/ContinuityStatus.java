package com.agentdaemon.common.model;

/**
 * Outcome of the last continuity check.
 *
 * <ul>
 *   <li>{@link #OK}: no discontinuity, or every gap was recovered</li>
 *   <li>{@link #DEGRADED}: one or two gaps remain</li>
 *   <li>{@link #BROKEN}: more than two gaps remain</li>
 * </ul>
 */
public enum ContinuityStatus {
    OK,
    DEGRADED,
    BROKEN
}
