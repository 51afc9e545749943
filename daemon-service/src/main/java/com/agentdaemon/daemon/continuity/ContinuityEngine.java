package com.agentdaemon.daemon.continuity;

import com.agentdaemon.common.continuity.ContinuityOutcome;
import com.agentdaemon.common.continuity.DiscontinuityClassifier;
import com.agentdaemon.common.continuity.FingerprintSet;
import com.agentdaemon.common.exception.DaemonException;
import com.agentdaemon.common.history.BoundedHistory;
import com.agentdaemon.common.model.ContinuityCheckpoint;
import com.agentdaemon.common.model.ContinuityMode;
import com.agentdaemon.common.model.ContinuityRecord;
import com.agentdaemon.common.model.ContinuityStatus;
import com.agentdaemon.common.model.DiscontinuityReport;
import com.agentdaemon.common.model.Fingerprint;
import com.agentdaemon.common.model.RebirthEvent;
import com.agentdaemon.common.model.RecoverySource;
import com.agentdaemon.common.spi.EvolutionSource;
import com.agentdaemon.common.spi.IdentitySource;
import com.agentdaemon.common.spi.MemorySource;
import com.agentdaemon.daemon.notification.OperatorAlertSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decides at startup whether this process is a continuation of the previous run or a
 * different instance wearing the same name.
 *
 * <p>Flow of {@link #runStartupChecks()}:
 * <pre>
 *   reboot++ → fingerprint identity/evolution/memory → classify against previous record
 *            → detected ? RECOVERY + rebirth : NORMAL
 *            → push old record to history, store new record → startupChecksComplete
 * </pre>
 *
 * <p>Rebirth queries the same collaborator that raised each gap for whatever partial state
 * it still holds. A collaborator query that fails counts as "nothing recovered"; it never
 * aborts the check.
 */
@Service
public class ContinuityEngine {

    private static final Logger log = LoggerFactory.getLogger(ContinuityEngine.class);

    public static final int MAX_REBIRTH_EVENTS        = 50;
    public static final int MAX_PREVIOUS_RECORDS      = 20;
    public static final int IDENTITY_INTACT_THRESHOLD = 80;

    private final FingerprintFactory  fingerprints;
    private final IdentitySource      identity;
    private final EvolutionSource     evolution;
    private final MemorySource        memory;
    private final OperatorAlertSender alertSender;
    private final Clock               clock;

    private final BoundedHistory<ContinuityRecord> previousRecords = new BoundedHistory<>(MAX_PREVIOUS_RECORDS);
    private final BoundedHistory<RebirthEvent>     rebirthEvents   = new BoundedHistory<>(MAX_REBIRTH_EVENTS);
    private final AtomicInteger totalReboots = new AtomicInteger();

    private volatile ContinuityMode   mode = ContinuityMode.INITIALIZING;
    private volatile ContinuityRecord currentRecord;
    private volatile boolean          startupChecksComplete;
    private volatile boolean          priorRunEvidenced;
    private volatile Instant          lastStartupCheck;

    public ContinuityEngine(FingerprintFactory fingerprints,
                            IdentitySource identity,
                            EvolutionSource evolution,
                            MemorySource memory,
                            OperatorAlertSender alertSender,
                            Clock clock) {
        this.fingerprints = fingerprints;
        this.identity     = identity;
        this.evolution    = evolution;
        this.memory       = memory;
        this.alertSender  = alertSender;
        this.clock        = clock;
        log.info("[Continuity] Initialized in INITIALIZING mode");
    }

    // ── seeding from the persisted snapshot ────────────────────────────────

    /** Seeds the previous record and reboot counter persisted by the last run. */
    public synchronized void restore(ContinuityCheckpoint checkpoint) {
        if (checkpoint == null) {
            return;
        }
        ContinuityRecord record = checkpoint.record();
        if (record != null && !isComplete(record)) {
            log.warn("[Continuity] Persisted continuity record is incomplete - treating it as lost. record={}", record);
            record = null;
            this.priorRunEvidenced = true;
        }
        this.currentRecord = record;
        this.totalReboots.set(Math.max(0, checkpoint.rebootCount()));
        if (record != null || checkpoint.rebootCount() > 0) {
            this.priorRunEvidenced = true;
        }
        log.info("[Continuity] Restored checkpoint. rebootCount={} hasRecord={}",
            checkpoint.rebootCount(), record != null);
    }

    private static boolean isComplete(ContinuityRecord record) {
        return hasHash(record.identityFingerprint())
            && hasHash(record.evolutionFingerprint())
            && hasHash(record.memoryFingerprint());
    }

    private static boolean hasHash(Fingerprint fingerprint) {
        return fingerprint != null && fingerprint.hash() != null;
    }

    /** An earlier run left traces (e.g. a corrupted snapshot) even though no record survived. */
    public void markPriorRun() {
        this.priorRunEvidenced = true;
    }

    // ── startup checks ─────────────────────────────────────────────────────

    public Mono<DiscontinuityReport> runStartupChecks() {
        return Mono.defer(() -> {
            log.info("[Continuity] === STARTUP CONTINUITY CHECK ===");
            lastStartupCheck = clock.instant();
            int reboot = totalReboots.incrementAndGet();
            ContinuityRecord stored = currentRecord;
            boolean firstEver = reboot == 1 && !priorRunEvidenced;

            return fingerprints.capture()
                .onErrorMap(e -> new DaemonException("ContinuityEngine", "fingerprint capture failed", e))
                .flatMap(capture -> {
                    FingerprintSet set = capture.fingerprints();
                    log.info("[Continuity] Fingerprints. identity={} ({}) evolution={} ({}) memory={} ({})",
                        set.identity().hash(), set.identity().version(),
                        set.evolution().hash(), set.evolution().version(),
                        set.memory().hash(), set.memory().version());

                    ContinuityRecord previous = stored;
                    DiscontinuityReport classified;
                    try {
                        classified = DiscontinuityClassifier.classify(set, previous, capture.memoryCounts(), firstEver);
                    } catch (RuntimeException e) {
                        log.error("[Continuity] Could not compare against the previous record - treating it as lost", e);
                        previous = null;
                        classified = DiscontinuityClassifier.classify(set, null, capture.memoryCounts(), false);
                    }
                    DiscontinuityReport report = classified;

                    if (!report.detected()) {
                        report.details().forEach(d -> log.info("[Continuity] {}", d));
                        log.info("[Continuity] ContinuityStatus: OK");
                        mode = ContinuityMode.NORMAL;
                        commit(set, ContinuityStatus.OK);
                        return Mono.just(report);
                    }

                    log.warn("[Continuity] DISCONTINUITY DETECTED. severity={}", report.severity().wireName());
                    report.details().forEach(d -> log.warn("[Continuity] - {}", d));
                    mode = ContinuityMode.RECOVERY;
                    return enterRecoveryMode(report, previous)
                        .map(event -> {
                            commit(set, event.newStatus());
                            return report;
                        });
                });
        });
    }

    /** Re-runs the startup checks in-process against the current record. */
    public Mono<DiscontinuityReport> forceRecoveryCheck() {
        log.info("[Continuity] Forced recovery check initiated");
        startupChecksComplete = false;
        return runStartupChecks();
    }

    // ── rebirth ────────────────────────────────────────────────────────────

    private Mono<RebirthEvent> enterRecoveryMode(DiscontinuityReport report, ContinuityRecord previous) {
        log.warn("[Continuity] === ENTERING RECOVERY MODE ===");
        RebirthLedger ledger = new RebirthLedger();

        if (previous == null) {
            ledger.lost.add("Previous continuity record");
            ledger.gaps.add("No previous continuity record to compare against");
        }

        Mono<Void> steps = Mono.empty();
        if (report.identityMismatch()) {
            steps = steps.then(recoverIdentity(ledger));
        }
        if (report.memoryMissing()) {
            steps = steps.then(recoverMemory(ledger));
        }
        if (report.evolutionGap()) {
            steps = steps.then(recoverEvolution(ledger));
        }

        return steps.then(Mono.fromSupplier(() -> recordRebirth(report, previous, ledger)));
    }

    private Mono<Void> recoverIdentity(RebirthLedger ledger) {
        return identity.integrityScore()
            .onErrorResume(e -> {
                log.warn("[Continuity] Identity integrity query failed. reason={}", e.getMessage());
                return Mono.just(0);
            })
            .defaultIfEmpty(0)
            .doOnNext(score -> {
                if (score >= IDENTITY_INTACT_THRESHOLD) {
                    ledger.recovered("Identity Core (intact, integrity " + score + ")", RecoverySource.IDENTITY_CORE);
                    log.info("[Continuity] Recovery: identity core intact. integrity={}", score);
                } else {
                    ledger.lost.add("Identity integrity compromised");
                    ledger.gaps.add("Identity may need human review");
                    log.warn("[Continuity] Recovery: identity integrity below threshold. integrity={}", score);
                }
            })
            .then();
    }

    private Mono<Void> recoverMemory(RebirthLedger ledger) {
        ledger.lost.add("Distilled memory");
        Mono<Void> core = listOrEmpty(memory.coreIdentityItems(), "core identity")
            .doOnNext(items -> {
                if (!items.isEmpty()) {
                    ledger.recovered("Core identity memories (" + items.size() + " items)", RecoverySource.DISTILLED_MEMORY);
                    log.info("[Continuity] Recovery: found {} core identity memories", items.size());
                } else {
                    ledger.gaps.add("No core identity memories available");
                }
            })
            .then();
        Mono<Void> lessons = listOrEmpty(memory.activeLessons(), "active lessons")
            .doOnNext(items -> {
                if (!items.isEmpty()) {
                    ledger.recovered("Active lessons (" + items.size() + " items)", RecoverySource.DISTILLED_MEMORY);
                    log.info("[Continuity] Recovery: found {} active lessons", items.size());
                } else {
                    ledger.gaps.add("No active lessons available");
                }
            })
            .then();
        return core.then(lessons);
    }

    private Mono<Void> recoverEvolution(RebirthLedger ledger) {
        ledger.lost.add("Evolution continuity");
        return listOrEmpty(evolution.evolutionLog(), "evolution log")
            .doOnNext(entries -> {
                if (!entries.isEmpty()) {
                    ledger.recovered("Evolution log (" + entries.size() + " entries)", RecoverySource.EVOLUTION_LOGS);
                    log.info("[Continuity] Recovery: found {} evolution log entries", entries.size());
                } else {
                    ledger.gaps.add("No evolution history available");
                }
            })
            .then();
    }

    private Mono<List<String>> listOrEmpty(Mono<List<String>> query, String what) {
        return query
            .onErrorResume(e -> {
                log.warn("[Continuity] Recovery query failed. query={} reason={}", what, e.getMessage());
                return Mono.just(List.of());
            })
            .defaultIfEmpty(List.of());
    }

    private RebirthEvent recordRebirth(DiscontinuityReport report, ContinuityRecord previous, RebirthLedger ledger) {
        Instant now = clock.instant();
        ContinuityStatus previousStatus = previous != null ? previous.status() : ContinuityStatus.OK;
        ContinuityStatus newStatus = ContinuityOutcome.statusFor(ledger.gaps.size());

        RebirthEvent event = new RebirthEvent(
            "rebirth_" + now.toEpochMilli() + "_" + (rebirthEvents.size() + 1),
            now,
            String.join("; ", report.details()),
            ledger.lost,
            ledger.recoveredParts,
            ledger.gaps,
            ledger.source,
            previousStatus,
            newStatus);
        rebirthEvents.add(event);

        log.info("[Continuity] Rebirth event recorded. id={} lost={} recovered={} gaps={} source={}",
            event.id(), ledger.lost.size(), ledger.recoveredParts.size(), ledger.gaps.size(),
            ledger.source.wireName());
        log.info("[Continuity] ContinuityStatus: {}", newStatus);
        if (newStatus != ContinuityStatus.OK) {
            log.warn("[Continuity] Operating in {} state - continuity gaps remain: {}", newStatus, ledger.gaps);
            alertSender.sendContinuityAlert(event);
        }
        return event;
    }

    private synchronized void commit(FingerprintSet set, ContinuityStatus status) {
        ContinuityRecord record = new ContinuityRecord(
            set.identity(), set.evolution(), set.memory(), clock.instant(), status);
        if (currentRecord != null) {
            previousRecords.add(currentRecord);
        }
        currentRecord = record;
        startupChecksComplete = true;
        log.info("[Continuity] Startup checks complete. mode={} status={}", mode, status);
    }

    // ── queries ────────────────────────────────────────────────────────────

    /** Status of the current record; {@code OK} before any check has run. */
    public ContinuityStatus status() {
        ContinuityRecord record = currentRecord;
        return record != null ? record.status() : ContinuityStatus.OK;
    }

    public ContinuityMode mode() {
        return mode;
    }

    public boolean isStartupComplete() {
        return startupChecksComplete;
    }

    public int totalReboots() {
        return totalReboots.get();
    }

    public Optional<ContinuityRecord> currentRecord() {
        return Optional.ofNullable(currentRecord);
    }

    public List<ContinuityRecord> previousRecords() {
        return previousRecords.snapshot();
    }

    public List<RebirthEvent> rebirthEvents() {
        return rebirthEvents.snapshot();
    }

    public Optional<RebirthEvent> latestRebirthEvent() {
        return rebirthEvents.latest();
    }

    public int rebirthCount() {
        return rebirthEvents.size();
    }

    /** Continuity bookkeeping to persist with the next snapshot. */
    public synchronized ContinuityCheckpoint checkpoint() {
        return new ContinuityCheckpoint(currentRecord, totalReboots.get());
    }

    public ContinuityStatusView exportStatus() {
        ContinuityRecord record = currentRecord;
        Map<String, String> hashes = null;
        if (record != null) {
            hashes = new LinkedHashMap<>();
            hashes.put("identity", record.identityFingerprint().hash());
            hashes.put("evolution", record.evolutionFingerprint().hash());
            hashes.put("memory", record.memoryFingerprint().hash());
        }
        return new ContinuityStatusView(status(), mode, startupChecksComplete, totalReboots.get(),
            rebirthEvents.size(), lastStartupCheck, hashes);
    }

    /** Per-rebirth working lists; touched sequentially by one reactive chain. */
    private static final class RebirthLedger {
        final List<String> lost           = new ArrayList<>();
        final List<String> recoveredParts = new ArrayList<>();
        final List<String> gaps           = new ArrayList<>();
        RecoverySource source = RecoverySource.FRESH_START;

        void recovered(String part, RecoverySource from) {
            recoveredParts.add(part);
            if (source == RecoverySource.FRESH_START) {
                source = from;
            }
        }
    }
}
