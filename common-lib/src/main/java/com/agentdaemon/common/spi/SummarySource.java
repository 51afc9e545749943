package com.agentdaemon.common.spi;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * A subsystem that can describe itself as a small JSON-like map.
 * Fingerprints hash a fixed projection of this map, never the whole of it.
 */
public interface SummarySource {

    Mono<Map<String, Object>> exportSummary();
}
