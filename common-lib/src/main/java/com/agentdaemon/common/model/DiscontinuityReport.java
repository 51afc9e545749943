package com.agentdaemon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of comparing freshly computed fingerprints with the previous run's record.
 * Never persisted; consumed immediately to decide whether to enter recovery.
 *
 * @param details every applicable finding, in evaluation order, including the ones that
 *                did not raise severity
 */
public record DiscontinuityReport(
    @JsonProperty("detected")          boolean detected,
    @JsonProperty("identity_mismatch") boolean identityMismatch,
    @JsonProperty("evolution_gap")     boolean evolutionGap,
    @JsonProperty("memory_missing")    boolean memoryMissing,
    @JsonProperty("severity")          Severity severity,
    @JsonProperty("details")           List<String> details
) {

    public DiscontinuityReport {
        details = details != null ? List.copyOf(details) : List.of();
    }
}
