package com.agentdaemon.common.spi;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Distilled-memory subsystem as seen by the continuity engine.
 *
 * <p>Summary keys used for the fingerprint: {@code coreIdentityCount},
 * {@code activeLessonsCount}, {@code coreIdentityHashes}; version from
 * {@code totalProcessed}.
 *
 * <p>The counts in the summary and the lists returned by the recovery queries may
 * disagree: the subsystem is allowed to recover partially between the two calls.
 */
public interface MemorySource extends SummarySource {

    Mono<List<String>> coreIdentityItems();

    Mono<List<String>> activeLessons();
}
