package com.agentdaemon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Projection of the agent's live state captured inside a {@link StateSnapshot}.
 * Part of the checksummed region.
 */
public record AgentState(
    @JsonProperty("cycle_count")   long cycleCount,
    @JsonProperty("confidence")    double confidence,
    @JsonProperty("doubts")        int doubts,
    @JsonProperty("energy_level")  double energyLevel,
    @JsonProperty("mode")          String mode,
    @JsonProperty("current_focus") String currentFocus
) {}
