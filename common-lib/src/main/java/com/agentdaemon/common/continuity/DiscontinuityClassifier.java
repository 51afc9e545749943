package com.agentdaemon.common.continuity;

import com.agentdaemon.common.model.ContinuityRecord;
import com.agentdaemon.common.model.DiscontinuityReport;
import com.agentdaemon.common.model.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares the fingerprints of this run with the previous run's {@link ContinuityRecord}.
 *
 * <h3>Rules, evaluated in order</h3>
 * <ol>
 *   <li>No previous record: first-ever start → not a discontinuity, informational only.
 *       Any later start → detected, {@code moderate}; only the memory rule still applies.</li>
 *   <li>Identity hash differs → {@code identity_mismatch}, {@code critical}.</li>
 *   <li>Identity version differs → detected, detail only, severity unchanged.</li>
 *   <li>Evolution counter decreased → {@code evolution_gap}, at least {@code severe}.</li>
 *   <li>Evolution counter jumped by more than {@value #EVOLUTION_JUMP_THRESHOLD}
 *       → {@code evolution_gap}, at least {@code minor}.</li>
 *   <li>Memory reports zero core identity items and zero lessons
 *       → {@code memory_missing}, at least {@code moderate}.</li>
 *   <li>Memory hash changed while memory is present → detail only, not detected.</li>
 * </ol>
 *
 * <p>Severity only ever rises; every applicable finding is kept in {@code details}.
 * Pure and stateless.
 */
public final class DiscontinuityClassifier {

    public static final long EVOLUTION_JUMP_THRESHOLD = 10;

    public static final String FIRST_STARTUP_DETAIL =
        "First startup - establishing baseline continuity record";
    public static final String RECORD_LOST_DETAIL =
        "No previous continuity record found - possible data loss";
    public static final String MEMORY_EMPTY_DETAIL =
        "Memory appears empty - possible memory loss";

    private DiscontinuityClassifier() {}

    /**
     * @param current          fingerprints computed by this run
     * @param previous         record left by the previous run, {@code null} if none
     * @param memory           counts from the memory summary used for {@code current.memory()}
     * @param firstEverStartup true only when no earlier run of this agent is evidenced
     */
    public static DiscontinuityReport classify(FingerprintSet current,
                                               ContinuityRecord previous,
                                               MemoryCounts memory,
                                               boolean firstEverStartup) {
        Accumulator acc = new Accumulator();

        if (previous == null) {
            if (firstEverStartup) {
                acc.details.add(FIRST_STARTUP_DETAIL);
                return acc.toReport();
            }
            acc.detected = true;
            acc.raise(Severity.MODERATE);
            acc.details.add(RECORD_LOST_DETAIL);
            checkMemory(memory, acc);
            return acc.toReport();
        }

        String prevIdentityHash = previous.identityFingerprint().hash();
        String currIdentityHash = current.identity().hash();
        if (!prevIdentityHash.equals(currIdentityHash)) {
            acc.detected = true;
            acc.identityMismatch = true;
            acc.raise(Severity.CRITICAL);
            acc.details.add("Identity mismatch: " + prevIdentityHash + " -> " + currIdentityHash);
        }

        String prevIdentityVersion = previous.identityFingerprint().version();
        String currIdentityVersion = current.identity().version();
        if (!equalsNullable(prevIdentityVersion, currIdentityVersion)) {
            acc.detected = true;
            acc.details.add("Identity version changed: " + prevIdentityVersion + " -> " + currIdentityVersion);
        }

        String prevEvolution = previous.evolutionFingerprint().version();
        String currEvolution = current.evolution().version();
        long prevCount = EvolutionVersion.counter(prevEvolution);
        long currCount = EvolutionVersion.counter(currEvolution);
        if (currCount < prevCount) {
            acc.detected = true;
            acc.evolutionGap = true;
            acc.raise(Severity.SEVERE);
            acc.details.add("Evolution regression: " + prevEvolution + " -> " + currEvolution);
        } else if (currCount > prevCount + EVOLUTION_JUMP_THRESHOLD) {
            acc.detected = true;
            acc.evolutionGap = true;
            acc.raise(Severity.MINOR);
            acc.details.add("Large evolution jump: " + prevEvolution + " -> " + currEvolution);
        }

        checkMemory(memory, acc);

        String prevMemoryHash = previous.memoryFingerprint().hash();
        String currMemoryHash = current.memory().hash();
        if (!acc.memoryMissing && !prevMemoryHash.equals(currMemoryHash)) {
            acc.details.add("Memory state changed: " + prevMemoryHash + " -> " + currMemoryHash);
        }

        return acc.toReport();
    }

    private static void checkMemory(MemoryCounts memory, Accumulator acc) {
        if (memory != null && memory.isEmpty()) {
            acc.detected = true;
            acc.memoryMissing = true;
            acc.raise(Severity.MODERATE);
            acc.details.add(MEMORY_EMPTY_DETAIL);
        }
    }

    private static boolean equalsNullable(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }

    private static final class Accumulator {
        boolean detected;
        boolean identityMismatch;
        boolean evolutionGap;
        boolean memoryMissing;
        Severity severity = Severity.NONE;
        final List<String> details = new ArrayList<>();

        void raise(Severity floor) {
            severity = severity.atLeast(floor);
        }

        DiscontinuityReport toReport() {
            return new DiscontinuityReport(detected, identityMismatch, evolutionGap,
                memoryMissing, severity, details);
        }
    }
}
