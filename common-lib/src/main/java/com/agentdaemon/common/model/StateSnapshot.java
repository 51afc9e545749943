package com.agentdaemon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Checksummed projection of live state, written by the daemon every K cycles and on
 * shutdown, read once at process start.
 *
 * <p>The {@code checksum} covers only {@code cycle}, {@code agent_state} and
 * {@code autonomy_level}. Every other field may change without invalidating it:
 * the checksum detects accidental corruption of the fields that resume depends on,
 * it is not a full-state hash.
 *
 * <p>{@code reboot_count} and {@code continuity_record} carry the continuity engine's
 * bookkeeping across restarts so a first-ever start can be told apart from a start
 * whose previous record was lost.
 */
public record StateSnapshot(
    @JsonProperty("id")                      String id,
    @JsonProperty("timestamp")               Instant timestamp,
    @JsonProperty("cycle")                   long cycle,
    @JsonProperty("schema_version")          int schemaVersion,
    @JsonProperty("agent_state")             AgentState agentState,
    @JsonProperty("autonomy_level")          int autonomyLevel,
    @JsonProperty("active_constraints")      Set<String> activeConstraints,
    @JsonProperty("reality_metrics_summary") RealityMetricsSummary realityMetricsSummary,
    @JsonProperty("behavior_pattern_hash")   String behaviorPatternHash,
    @JsonProperty("desire_state_summary")    Map<String, Object> desireStateSummary,
    @JsonProperty("governance_state")        Map<String, Object> governanceState,
    @JsonProperty("reboot_count")            int rebootCount,
    @JsonProperty("continuity_record")       ContinuityRecord continuityRecord,
    @JsonProperty("checksum")                String checksum
) {

    public static final int SCHEMA_VERSION = 2;

    public StateSnapshot {
        SortedSet<String> constraints = new TreeSet<>();
        if (activeConstraints != null) {
            constraints.addAll(activeConstraints);
        }
        activeConstraints     = Collections.unmodifiableSortedSet(constraints);
        realityMetricsSummary = realityMetricsSummary != null ? realityMetricsSummary : RealityMetricsSummary.empty();
        desireStateSummary    = copyOf(desireStateSummary);
        governanceState       = copyOf(governanceState);
    }

    /** Returns a copy carrying {@code newChecksum}; every other field is shared. */
    public StateSnapshot withChecksum(String newChecksum) {
        return new StateSnapshot(id, timestamp, cycle, schemaVersion, agentState, autonomyLevel,
            activeConstraints, realityMetricsSummary, behaviorPatternHash, desireStateSummary,
            governanceState, rebootCount, continuityRecord, newChecksum);
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
