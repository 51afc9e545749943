package com.agentdaemon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** The three fingerprints recorded at the end of a continuity check. */
public record ContinuityRecord(
    @JsonProperty("identity_fingerprint")  Fingerprint identityFingerprint,
    @JsonProperty("evolution_fingerprint") Fingerprint evolutionFingerprint,
    @JsonProperty("memory_fingerprint")    Fingerprint memoryFingerprint,
    @JsonProperty("last_verified")         Instant lastVerified,
    @JsonProperty("status")                ContinuityStatus status
) {}
