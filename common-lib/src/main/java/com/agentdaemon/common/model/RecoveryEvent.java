package com.agentdaemon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Daemon-level (process liveness) recovery record. Distinct from {@link RebirthEvent},
 * which audits semantic identity continuity.
 *
 * @param snapshotUsed  id of the snapshot the event drew on, {@code null} when none was available
 * @param cycleRestored snapshot cycle, or the live cycle when no snapshot was available
 */
public record RecoveryEvent(
    @JsonProperty("id")             String id,
    @JsonProperty("timestamp")      Instant timestamp,
    @JsonProperty("type")           RecoveryType type,
    @JsonProperty("snapshot_used")  String snapshotUsed,
    @JsonProperty("cycle_restored") long cycleRestored,
    @JsonProperty("state_restored") RestoredState stateRestored,
    @JsonProperty("notes")          String notes
) {}
