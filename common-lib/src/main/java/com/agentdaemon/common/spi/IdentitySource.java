package com.agentdaemon.common.spi;

import reactor.core.publisher.Mono;

/**
 * Identity subsystem as seen by the continuity engine.
 *
 * <p>Summary keys used for the fingerprint: {@code origin}, {@code purpose},
 * {@code nonNegotiables}, {@code boundaries}; version from {@code currentVersion}.
 */
public interface IdentitySource extends SummarySource {

    /** 0–100; 80 or more counts as an intact identity core during rebirth. */
    Mono<Integer> integrityScore();
}
