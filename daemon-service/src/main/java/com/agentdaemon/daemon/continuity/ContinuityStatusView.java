package com.agentdaemon.daemon.continuity;

import com.agentdaemon.common.model.ContinuityMode;
import com.agentdaemon.common.model.ContinuityStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/** Read-only continuity summary for the status surface. */
public record ContinuityStatusView(
    @JsonProperty("status")              ContinuityStatus status,
    @JsonProperty("mode")                ContinuityMode mode,
    @JsonProperty("startupComplete")     boolean startupComplete,
    @JsonProperty("totalReboots")        int totalReboots,
    @JsonProperty("rebirthCount")        int rebirthCount,
    @JsonProperty("lastCheck")           Instant lastCheck,
    @JsonProperty("currentFingerprints") Map<String, String> currentFingerprints
) {}
