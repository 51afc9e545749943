package com.agentdaemon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Decision-gate answer for a sensitive action. */
public record DecisionVerdict(
    @JsonProperty("approved")       boolean approved,
    @JsonProperty("recommendation") String recommendation
) {

    public static DecisionVerdict approve(String recommendation) {
        return new DecisionVerdict(true, recommendation);
    }

    public static DecisionVerdict deny(String recommendation) {
        return new DecisionVerdict(false, recommendation);
    }
}
