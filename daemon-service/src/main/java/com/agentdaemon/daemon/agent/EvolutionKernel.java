package com.agentdaemon.daemon.agent;

import com.agentdaemon.common.history.BoundedHistory;
import com.agentdaemon.common.spi.EvolutionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Versioned self-improvement record. The minor version (the counter the continuity engine
 * compares across restarts) bumps whenever a cycle improves the self-score or every
 * {@value #FORCED_EVOLUTION_EVERY} cycles.
 *
 * <p>Held in memory only; a restart begins again at {@code v0.1}.
 */
@Component
public class EvolutionKernel implements EvolutionSource {

    private static final Logger log = LoggerFactory.getLogger(EvolutionKernel.class);

    static final int MAJOR_VERSION          = 0;
    static final int FORCED_EVOLUTION_EVERY = 10;
    static final int MAX_LOG_ENTRIES        = 100;

    private final BoundedHistory<String> evolutionLog = new BoundedHistory<>(MAX_LOG_ENTRIES);

    private int    minorVersion = 1;
    private int    evolutionCount;
    private final String mode;
    private double bestScore;

    public EvolutionKernel(@Value("${agent.evolution.mode:NORMAL}") String mode) {
        this.mode = mode;
        log.info("[EvolutionKernel] Initialized {}", version());
    }

    /**
     * Records one cycle's self-score.
     *
     * @return true if the version advanced
     */
    public synchronized boolean evolve(long cycle, double selfScore) {
        boolean improved = selfScore > bestScore;
        bestScore = Math.max(bestScore, selfScore);
        if (!improved && cycle % FORCED_EVOLUTION_EVERY != 0) {
            return false;
        }
        minorVersion++;
        evolutionCount++;
        String entry = String.format("%s cycle=%d score=%.2f mode=%s", version(), cycle, selfScore, mode);
        evolutionLog.add(entry);
        log.info("[EvolutionKernel] Evolved. {}", entry);
        return true;
    }

    public synchronized String version() {
        return "v" + MAJOR_VERSION + "." + minorVersion;
    }

    public synchronized int evolutionCount() {
        return evolutionCount;
    }

    @Override
    public Mono<Map<String, Object>> exportSummary() {
        return Mono.fromSupplier(() -> {
            Map<String, Object> summary = new LinkedHashMap<>();
            synchronized (this) {
                summary.put("version", version());
                summary.put("evolutionCount", evolutionCount);
                summary.put("mode", mode);
                summary.put("capabilities", capabilities());
                summary.put("latestEvolution", evolutionLog.latest().orElse(null));
            }
            return summary;
        });
    }

    @Override
    public Mono<List<String>> evolutionLog() {
        return Mono.fromSupplier(evolutionLog::snapshot);
    }

    private Map<String, Object> capabilities() {
        Map<String, Object> capabilities = new LinkedHashMap<>();
        capabilities.put("selfAssessment", true);
        capabilities.put("memoryDistillation", true);
        capabilities.put("governedDecisions", true);
        return capabilities;
    }
}
