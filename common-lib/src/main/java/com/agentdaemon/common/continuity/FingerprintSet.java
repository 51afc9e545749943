package com.agentdaemon.common.continuity;

import com.agentdaemon.common.model.Fingerprint;

/** Identity, evolution and memory fingerprints computed in one startup check. */
public record FingerprintSet(Fingerprint identity, Fingerprint evolution, Fingerprint memory) {}
