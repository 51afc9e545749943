package com.agentdaemon.daemon.continuity;

import com.agentdaemon.common.continuity.FingerprintSet;
import com.agentdaemon.common.continuity.MemoryCounts;

/** Fingerprints of one check plus the memory counts read from the same summary. */
public record FingerprintCapture(FingerprintSet fingerprints, MemoryCounts memoryCounts) {}
