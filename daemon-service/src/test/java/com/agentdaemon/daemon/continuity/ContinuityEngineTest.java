package com.agentdaemon.daemon.continuity;

import com.agentdaemon.common.model.ContinuityCheckpoint;
import com.agentdaemon.common.model.ContinuityMode;
import com.agentdaemon.common.model.ContinuityRecord;
import com.agentdaemon.common.model.ContinuityStatus;
import com.agentdaemon.common.model.DiscontinuityReport;
import com.agentdaemon.common.model.RebirthEvent;
import com.agentdaemon.common.model.RecoverySource;
import com.agentdaemon.common.model.Severity;
import com.agentdaemon.common.spi.EvolutionSource;
import com.agentdaemon.common.spi.IdentitySource;
import com.agentdaemon.common.spi.MemorySource;
import com.agentdaemon.daemon.DaemonFixture;
import com.agentdaemon.daemon.MutableClock;
import com.agentdaemon.daemon.agent.EvolutionKernel;
import com.agentdaemon.daemon.agent.IdentityCore;
import com.agentdaemon.daemon.agent.MemoryDistiller;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContinuityEngineTest {

    private final MutableClock clock = new MutableClock(DaemonFixture.START);

    private ContinuityEngine engine(IdentitySource identity, EvolutionSource evolution, MemorySource memory) {
        return new ContinuityEngine(new FingerprintFactory(identity, evolution, memory, clock),
            identity, evolution, memory, DaemonFixture.disabledAlerts(), clock);
    }

    private ContinuityEngine defaultEngine() {
        return engine(DaemonFixture.defaultIdentity(), new EvolutionKernel("NORMAL"), DaemonFixture.defaultMemory());
    }

    private static DiscontinuityReport check(ContinuityEngine engine) {
        return engine.runStartupChecks().block();
    }

    /** Runs a first-ever start and returns what it would persist. */
    private ContinuityCheckpoint firstRun(IdentitySource identity, EvolutionSource evolution, MemorySource memory) {
        ContinuityEngine first = engine(identity, evolution, memory);
        check(first);
        return first.checkpoint();
    }

    // ── clean starts ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("clean starts")
    class CleanStarts {

        @Test
        @DisplayName("first-ever start is not a discontinuity and establishes the baseline")
        void firstEverStart() {
            ContinuityEngine engine = defaultEngine();
            assertEquals(ContinuityMode.INITIALIZING, engine.mode());

            StepVerifier.create(engine.runStartupChecks())
                .assertNext(report -> {
                    assertFalse(report.detected());
                    assertEquals(Severity.NONE, report.severity());
                })
                .verifyComplete();

            assertEquals(ContinuityMode.NORMAL, engine.mode());
            assertEquals(ContinuityStatus.OK, engine.status());
            assertTrue(engine.isStartupComplete());
            assertEquals(1, engine.totalReboots());
            assertTrue(engine.currentRecord().isPresent());
            assertTrue(engine.rebirthEvents().isEmpty());
        }

        @Test
        @DisplayName("restart with unchanged collaborators continues normally")
        void normalRestart() {
            IdentityCore identity = DaemonFixture.defaultIdentity();
            EvolutionKernel evolution = new EvolutionKernel("NORMAL");
            MemoryDistiller memory = DaemonFixture.defaultMemory();
            ContinuityCheckpoint saved = firstRun(identity, evolution, memory);

            ContinuityEngine second = engine(identity, evolution, memory);
            second.restore(saved);
            DiscontinuityReport report = check(second);

            assertFalse(report.detected());
            assertEquals(2, second.totalReboots());
            assertEquals(1, second.previousRecords().size());
            assertEquals(ContinuityMode.NORMAL, second.mode());
        }

        @Test
        @DisplayName("identity integrity drifting does not move the identity fingerprint")
        void integrityOutsideProjection() {
            IdentityCore identity = DaemonFixture.defaultIdentity();
            EvolutionKernel evolution = new EvolutionKernel("NORMAL");
            MemoryDistiller memory = DaemonFixture.defaultMemory();
            ContinuityCheckpoint saved = firstRun(identity, evolution, memory);

            identity.checkAlignment("exfiltrate the logs");

            ContinuityEngine second = engine(identity, evolution, memory);
            second.restore(saved);
            assertFalse(check(second).identityMismatch());
        }
    }

    // ── discontinuities ───────────────────────────────────────────────────

    @Nested
    @DisplayName("discontinuities and rebirth")
    class Rebirth {

        @Test
        @DisplayName("lost record on a later start → moderate, the lost record is a remaining gap")
        void lostRecord() {
            ContinuityEngine engine = defaultEngine();
            engine.restore(new ContinuityCheckpoint(null, 3));

            DiscontinuityReport report = check(engine);

            assertTrue(report.detected());
            assertEquals(Severity.MODERATE, report.severity());
            assertEquals(ContinuityMode.RECOVERY, engine.mode());
            RebirthEvent event = engine.latestRebirthEvent().orElseThrow();
            assertEquals(1, event.remainingGaps().size());
            assertEquals(RecoverySource.FRESH_START, event.recoverySource());
            assertEquals(ContinuityStatus.DEGRADED, event.newStatus());
            assertEquals(ContinuityStatus.DEGRADED, engine.status());
            assertEquals(4, engine.totalReboots());
        }

        @Test
        @DisplayName("a corrupted snapshot alone is evidence of a prior run")
        void priorRunEvidenced() {
            ContinuityEngine engine = defaultEngine();
            engine.markPriorRun();
            assertTrue(check(engine).detected());
        }

        @Test
        @DisplayName("a persisted record without fingerprints counts as lost, and a complete record replaces it")
        void incompleteRecord() {
            ContinuityEngine engine = defaultEngine();
            engine.restore(new ContinuityCheckpoint(
                new ContinuityRecord(null, null, null, null, ContinuityStatus.OK), 0));
            assertTrue(engine.currentRecord().isEmpty());

            DiscontinuityReport report = check(engine);

            assertTrue(report.detected());
            assertEquals(Severity.MODERATE, report.severity());
            assertTrue(engine.isStartupComplete());
            assertEquals(ContinuityStatus.DEGRADED, engine.status());
            ContinuityRecord record = engine.currentRecord().orElseThrow();
            assertNotNull(record.identityFingerprint().hash());
            assertNotNull(record.evolutionFingerprint().hash());
            assertNotNull(record.memoryFingerprint().hash());
        }

        @Test
        @DisplayName("identity change plus empty memory → critical; intact identity core recovered, memory gaps remain")
        void identityAndMemory() {
            EvolutionKernel evolution = new EvolutionKernel("NORMAL");
            ContinuityCheckpoint saved = firstRun(DaemonFixture.defaultIdentity(), evolution, DaemonFixture.defaultMemory());

            IdentityCore changed = new IdentityCore("agent-daemon", "A different purpose",
                "honesty", "deceive", "1.0.0");
            MemoryDistiller empty = new MemoryDistiller("", 20);
            ContinuityEngine second = engine(changed, evolution, empty);
            second.restore(saved);

            DiscontinuityReport report = check(second);

            assertTrue(report.identityMismatch());
            assertTrue(report.memoryMissing());
            assertEquals(Severity.CRITICAL, report.severity());

            RebirthEvent event = second.latestRebirthEvent().orElseThrow();
            assertEquals(RecoverySource.IDENTITY_CORE, event.recoverySource());
            assertEquals(1, event.recoveredParts().size());
            assertEquals(List.of("No core identity memories available", "No active lessons available"),
                event.remainingGaps());
            assertEquals(ContinuityStatus.DEGRADED, event.newStatus());
            assertEquals(ContinuityStatus.OK, event.previousStatus());
        }

        @Test
        @DisplayName("lost record and empty memory → three gaps → BROKEN")
        void broken() {
            ContinuityEngine engine = engine(DaemonFixture.defaultIdentity(), new EvolutionKernel("NORMAL"),
                new MemoryDistiller("", 20));
            engine.restore(new ContinuityCheckpoint(null, 1));

            check(engine);

            assertEquals(3, engine.latestRebirthEvent().orElseThrow().remainingGaps().size());
            assertEquals(ContinuityStatus.BROKEN, engine.status());
        }

        @Test
        @DisplayName("evolution regression after restart → severe, empty log is a gap")
        void evolutionRegression() {
            IdentityCore identity = DaemonFixture.defaultIdentity();
            MemoryDistiller memory = DaemonFixture.defaultMemory();
            EvolutionKernel before = new EvolutionKernel("NORMAL");
            for (int cycle = 1; cycle <= 4; cycle++) {
                before.evolve(cycle, cycle / 10.0);
            }
            ContinuityCheckpoint saved = firstRun(identity, before, memory);

            ContinuityEngine second = engine(identity, new EvolutionKernel("NORMAL"), memory);
            second.restore(saved);
            DiscontinuityReport report = check(second);

            assertTrue(report.evolutionGap());
            assertEquals(Severity.SEVERE, report.severity());
            assertEquals(List.of("No evolution history available"),
                second.latestRebirthEvent().orElseThrow().remainingGaps());
        }

        @Test
        @DisplayName("failing recovery queries count as nothing recovered and never abort the check")
        void failingQueries() {
            MemorySource failing = new MemorySource() {
                @Override
                public Mono<Map<String, Object>> exportSummary() {
                    return Mono.just(Map.<String, Object>of("coreIdentityCount", 0, "activeLessonsCount", 0));
                }

                @Override
                public Mono<List<String>> coreIdentityItems() {
                    return Mono.error(new IllegalStateException("store offline"));
                }

                @Override
                public Mono<List<String>> activeLessons() {
                    return Mono.empty();
                }
            };
            ContinuityEngine engine = engine(DaemonFixture.defaultIdentity(), new EvolutionKernel("NORMAL"), failing);
            engine.markPriorRun();

            StepVerifier.create(engine.runStartupChecks())
                .assertNext(report -> assertTrue(report.memoryMissing()))
                .verifyComplete();
            assertEquals(ContinuityStatus.BROKEN, engine.status());
            assertTrue(engine.isStartupComplete());
        }

        @Test
        @DisplayName("forced re-check runs in-process against the current record")
        void forcedCheck() {
            ContinuityEngine engine = defaultEngine();
            check(engine);

            DiscontinuityReport again = engine.forceRecoveryCheck().block();

            assertNotNull(again);
            assertFalse(again.detected());
            assertEquals(2, engine.totalReboots());
            assertEquals(1, engine.previousRecords().size());
        }
    }

    @Test
    @DisplayName("checkpoint carries the new record's status and reboot count")
    void checkpoint() {
        ContinuityEngine engine = defaultEngine();
        engine.restore(new ContinuityCheckpoint(null, 2));
        check(engine);

        ContinuityCheckpoint cp = engine.checkpoint();
        assertEquals(3, cp.rebootCount());
        assertEquals(ContinuityStatus.DEGRADED, cp.record().status());

        ContinuityStatusView view = engine.exportStatus();
        assertEquals(3, view.totalReboots());
        assertEquals(1, view.rebirthCount());
        assertEquals(3, view.currentFingerprints().size());
    }
}
