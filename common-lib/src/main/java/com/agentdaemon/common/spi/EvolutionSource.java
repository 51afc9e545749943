package com.agentdaemon.common.spi;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Evolution subsystem as seen by the continuity engine.
 *
 * <p>Summary keys used for the fingerprint: {@code version}, {@code evolutionCount},
 * {@code mode}, {@code capabilities}; version from {@code version}.
 */
public interface EvolutionSource extends SummarySource {

    /** Surviving evolution log entries, oldest first. */
    Mono<List<String>> evolutionLog();
}
