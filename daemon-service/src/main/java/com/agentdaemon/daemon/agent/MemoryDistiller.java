package com.agentdaemon.daemon.agent;

import com.agentdaemon.common.history.BoundedHistory;
import com.agentdaemon.common.integrity.FingerprintHasher;
import com.agentdaemon.common.spi.MemorySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps a small distilled memory: core identity statements seeded from configuration and
 * a bounded list of recent lessons. Raw observations are only counted.
 */
@Component
public class MemoryDistiller implements MemorySource {

    private static final Logger log = LoggerFactory.getLogger(MemoryDistiller.class);

    private final List<String>           coreIdentity;
    private final BoundedHistory<String> activeLessons;

    private long totalProcessed;
    private long totalDiscarded;

    public MemoryDistiller(
            @Value("${agent.memory.core-identity:I run in cycles,I report my own failures}") String coreIdentity,
            @Value("${agent.memory.max-lessons:20}") int maxLessons) {
        this.coreIdentity  = IdentityCore.split(coreIdentity);
        this.activeLessons = new BoundedHistory<>(maxLessons);
        log.info("[MemoryDistiller] Initialized. coreIdentity={} maxLessons={}", this.coreIdentity.size(), maxLessons);
    }

    /** Counts an observation; blank ones are discarded as noise. */
    public synchronized void observe(String observation) {
        if (observation == null || observation.isBlank()) {
            totalDiscarded++;
            return;
        }
        totalProcessed++;
    }

    /** Keeps {@code lesson} as an active lesson, evicting the oldest beyond capacity. */
    public synchronized void learn(String lesson) {
        observe(lesson);
        if (lesson != null && !lesson.isBlank()) {
            activeLessons.add(lesson);
            log.debug("[MemoryDistiller] Lesson kept. activeLessons={}", activeLessons.size());
        }
    }

    public synchronized long totalProcessed() {
        return totalProcessed;
    }

    @Override
    public Mono<Map<String, Object>> exportSummary() {
        return Mono.fromSupplier(() -> {
            Map<String, Object> summary = new LinkedHashMap<>();
            synchronized (this) {
                summary.put("coreIdentityCount", coreIdentity.size());
                summary.put("activeLessonsCount", activeLessons.size());
                summary.put("coreIdentityHashes", coreIdentity.stream()
                    .map(item -> FingerprintHasher.hash(Map.<String, Object>of("item", item)))
                    .toList());
                summary.put("totalProcessed", totalProcessed);
                summary.put("totalDiscarded", totalDiscarded);
            }
            return summary;
        });
    }

    @Override
    public Mono<List<String>> coreIdentityItems() {
        return Mono.fromSupplier(() -> List.copyOf(coreIdentity));
    }

    @Override
    public Mono<List<String>> activeLessons() {
        return Mono.fromSupplier(activeLessons::snapshot);
    }
}
