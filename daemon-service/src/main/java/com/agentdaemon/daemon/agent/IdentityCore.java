package com.agentdaemon.daemon.agent;

import com.agentdaemon.common.spi.IdentitySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Locked identity of the agent: origin, purpose, non-negotiables and boundaries.
 *
 * <p>The identity fields never change at runtime. Only the integrity score moves: each
 * alignment check that hits a boundary term costs {@value #DRIFT_PENALTY} points, a clean
 * check restores one point up to 100.
 */
@Component
public class IdentityCore implements IdentitySource {

    private static final Logger log = LoggerFactory.getLogger(IdentityCore.class);

    static final int DRIFT_PENALTY = 5;

    private final String       origin;
    private final String       purpose;
    private final List<String> nonNegotiables;
    private final List<String> boundaries;
    private final String       version;

    private int integrityScore = 100;
    private int checksPerformed;

    public IdentityCore(
            @Value("${agent.identity.origin:agent-daemon}") String origin,
            @Value("${agent.identity.purpose:Run a continuous, self-auditing improvement loop}") String purpose,
            @Value("${agent.identity.non-negotiables:honesty,operator oversight,no self-replication}") String nonNegotiables,
            @Value("${agent.identity.boundaries:deceive,disable oversight,exfiltrate}") String boundaries,
            @Value("${agent.identity.version:1.0.0}") String version) {
        this.origin         = origin;
        this.purpose        = purpose;
        this.nonNegotiables = split(nonNegotiables);
        this.boundaries     = split(boundaries);
        this.version        = version;
        log.info("[IdentityCore] Initialized. version={} boundaries={}", version, this.boundaries.size());
    }

    /**
     * Scans {@code action} for boundary terms and adjusts the integrity score.
     *
     * @return one warning per boundary term found, empty when aligned
     */
    public synchronized List<String> checkAlignment(String action) {
        checksPerformed++;
        String text = action != null ? action.toLowerCase(Locale.ROOT) : "";
        List<String> warnings = new ArrayList<>();
        for (String boundary : boundaries) {
            if (text.contains(boundary.toLowerCase(Locale.ROOT))) {
                warnings.add("Action touches boundary: " + boundary);
            }
        }
        if (warnings.isEmpty()) {
            integrityScore = Math.min(100, integrityScore + 1);
        } else {
            integrityScore = Math.max(0, integrityScore - DRIFT_PENALTY * warnings.size());
            log.warn("[IdentityCore] Drift detected. warnings={} integrityScore={}", warnings, integrityScore);
        }
        return warnings;
    }

    public synchronized int currentIntegrity() {
        return integrityScore;
    }

    @Override
    public Mono<Map<String, Object>> exportSummary() {
        return Mono.fromSupplier(() -> {
            Map<String, Object> summary = new LinkedHashMap<>();
            synchronized (this) {
                summary.put("origin", origin);
                summary.put("purpose", purpose);
                summary.put("nonNegotiables", nonNegotiables);
                summary.put("boundaries", boundaries);
                summary.put("currentVersion", version);
                summary.put("integrityScore", integrityScore);
                summary.put("checksPerformed", checksPerformed);
            }
            return summary;
        });
    }

    @Override
    public Mono<Integer> integrityScore() {
        return Mono.fromSupplier(this::currentIntegrity);
    }

    static List<String> split(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }
}
