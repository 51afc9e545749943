package com.agentdaemon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Audit record of one recovery attempt triggered by a detected discontinuity.
 * Recorded even when every gap was recovered.
 */
public record RebirthEvent(
    @JsonProperty("id")              String id,
    @JsonProperty("timestamp")       Instant timestamp,
    @JsonProperty("cause")           String cause,
    @JsonProperty("lost_parts")      List<String> lostParts,
    @JsonProperty("recovered_parts") List<String> recoveredParts,
    @JsonProperty("remaining_gaps")  List<String> remainingGaps,
    @JsonProperty("recovery_source") RecoverySource recoverySource,
    @JsonProperty("previous_status") ContinuityStatus previousStatus,
    @JsonProperty("new_status")      ContinuityStatus newStatus
) {

    public RebirthEvent {
        lostParts      = lostParts      != null ? List.copyOf(lostParts)      : List.of();
        recoveredParts = recoveredParts != null ? List.copyOf(recoveredParts) : List.of();
        remainingGaps  = remainingGaps  != null ? List.copyOf(remainingGaps)  : List.of();
    }
}
