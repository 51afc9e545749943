package com.agentdaemon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** What the unit of work reports for one cycle. */
public record CycleResult(
    @JsonProperty("success") boolean success,
    @JsonProperty("cycle")   long cycle,
    @JsonProperty("stats")   Map<String, Object> stats,
    @JsonProperty("error")   String error
) {

    public CycleResult {
        stats = stats != null ? Map.copyOf(stats) : Map.of();
    }

    public static CycleResult success(long cycle, Map<String, Object> stats) {
        return new CycleResult(true, cycle, stats, null);
    }

    public static CycleResult failure(long cycle, String error) {
        return new CycleResult(false, cycle, Map.of(), error);
    }
}
