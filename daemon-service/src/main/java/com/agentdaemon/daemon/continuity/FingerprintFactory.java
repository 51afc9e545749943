package com.agentdaemon.daemon.continuity;

import com.agentdaemon.common.continuity.FingerprintSet;
import com.agentdaemon.common.continuity.MemoryCounts;
import com.agentdaemon.common.integrity.FingerprintHasher;
import com.agentdaemon.common.model.Fingerprint;
import com.agentdaemon.common.model.FingerprintOrigin;
import com.agentdaemon.common.spi.EvolutionSource;
import com.agentdaemon.common.spi.IdentitySource;
import com.agentdaemon.common.spi.MemorySource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Computes fingerprints over a fixed projection of each collaborator's summary.
 * Fields outside the projection can churn freely without counting as drift.
 */
@Component
public class FingerprintFactory {

    static final List<String> IDENTITY_KEYS  = List.of("origin", "purpose", "nonNegotiables", "boundaries");
    static final List<String> EVOLUTION_KEYS = List.of("version", "evolutionCount", "mode", "capabilities");
    static final List<String> MEMORY_KEYS    = List.of("coreIdentityCount", "activeLessonsCount", "coreIdentityHashes");

    private final IdentitySource  identity;
    private final EvolutionSource evolution;
    private final MemorySource    memory;
    private final Clock           clock;

    public FingerprintFactory(IdentitySource identity, EvolutionSource evolution,
                              MemorySource memory, Clock clock) {
        this.identity  = identity;
        this.evolution = evolution;
        this.memory    = memory;
        this.clock     = clock;
    }

    public Mono<FingerprintCapture> capture() {
        return Mono.zip(identity.exportSummary(), evolution.exportSummary(), memory.exportSummary())
            .map(t -> {
                Instant now = clock.instant();
                Map<String, Object> memorySummary = t.getT3();
                FingerprintSet set = new FingerprintSet(
                    fingerprint(t.getT1(), IDENTITY_KEYS, text(t.getT1().get("currentVersion")),
                                FingerprintOrigin.IDENTITY, now),
                    fingerprint(t.getT2(), EVOLUTION_KEYS, text(t.getT2().get("version")),
                                FingerprintOrigin.EVOLUTION, now),
                    fingerprint(memorySummary, MEMORY_KEYS, "mem_" + number(memorySummary.get("totalProcessed")),
                                FingerprintOrigin.MEMORY, now));
                MemoryCounts counts = new MemoryCounts(
                    (int) number(memorySummary.get("coreIdentityCount")),
                    (int) number(memorySummary.get("activeLessonsCount")));
                return new FingerprintCapture(set, counts);
            });
    }

    private static Fingerprint fingerprint(Map<String, Object> summary, List<String> keys, String version,
                                           FingerprintOrigin origin, Instant now) {
        String hash = FingerprintHasher.hash(FingerprintHasher.project(summary, keys));
        return new Fingerprint(hash, now, version, origin);
    }

    private static String text(Object value) {
        return value != null ? value.toString() : "unknown";
    }

    private static long number(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
