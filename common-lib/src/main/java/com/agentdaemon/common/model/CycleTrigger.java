package com.agentdaemon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Handed to the unit of work for each cycle.
 *
 * @param afterRestart true only for the first cycle run after a cold-start restoration
 */
public record CycleTrigger(
    @JsonProperty("cycle")         long cycle,
    @JsonProperty("after_restart") boolean afterRestart,
    @JsonProperty("triggered_at")  Instant triggeredAt,
    @JsonProperty("trace_id")      String traceId
) {}
