package com.agentdaemon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Compact reality-check metrics persisted alongside a snapshot. Not checksummed. */
public record RealityMetricsSummary(
    @JsonProperty("stability")              double stability,
    @JsonProperty("evolution")              double evolution,
    @JsonProperty("autonomy")               double autonomy,
    @JsonProperty("consecutive_mismatches") int consecutiveMismatches
) {

    public static RealityMetricsSummary empty() {
        return new RealityMetricsSummary(0.0, 0.0, 0.0, 0);
    }
}
