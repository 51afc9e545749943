package com.agentdaemon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Hash over a fixed projection of one subsystem's exported summary.
 * Only ever persisted inside a {@link ContinuityRecord}.
 */
public record Fingerprint(
    @JsonProperty("hash")      String hash,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("version")   String version,
    @JsonProperty("source")    FingerprintOrigin source
) {}
