package com.agentdaemon.daemon.job;

import com.agentdaemon.common.model.CycleResult;
import com.agentdaemon.common.model.CycleTrigger;
import com.agentdaemon.common.model.Heartbeat;
import com.agentdaemon.common.model.HeartbeatStatus;
import com.agentdaemon.common.model.RecoveryEvent;
import com.agentdaemon.common.model.RecoveryType;
import com.agentdaemon.common.model.StateSnapshot;
import com.agentdaemon.common.spi.UnitOfWork;
import com.agentdaemon.common.trace.TraceContextUtil;
import com.agentdaemon.daemon.config.DaemonSettings;
import com.agentdaemon.daemon.continuity.ContinuityEngine;
import com.agentdaemon.daemon.heartbeat.HeartbeatLog;
import com.agentdaemon.daemon.recovery.RecoveryCoordinator;
import com.agentdaemon.daemon.snapshot.SnapshotStore;
import com.agentdaemon.daemon.state.LiveAgentState;
import com.agentdaemon.daemon.watchdog.Watchdog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the unit of work on a fixed interval with heartbeats, periodic snapshots and
 * automatic crash recovery.
 *
 * <p>Each tick:
 * <pre>
 *   guard held? → skip (no queuing)
 *   acquire → running heartbeat → unit of work → completed | error heartbeat
 *           → every K-th completed cycle: snapshot
 *           → third consecutive failure: crash recovery
 *   release guard
 * </pre>
 *
 * <p>The timer never dies with a cycle: every error from the unit of work, thrown or
 * signalled, is turned into a failure result before it reaches the tick subscriber.
 */
@Service
public class CycleDaemon {

    private static final Logger log = LoggerFactory.getLogger(CycleDaemon.class);

    public static final int FAILURES_BEFORE_RECOVERY = 3;

    private final DaemonSettings      settings;
    private final UnitOfWork          unitOfWork;
    private final LiveAgentState      liveState;
    private final HeartbeatLog        heartbeatLog;
    private final ReentrancyGuard     guard;
    private final SnapshotStore       snapshotStore;
    private final RecoveryCoordinator recovery;
    private final Watchdog            watchdog;
    private final ContinuityEngine    continuity;
    private final Clock               clock;
    private final Scheduler           scheduler;

    private final AtomicLong    totalCyclesRun      = new AtomicLong();
    private final AtomicBoolean afterRestartPending = new AtomicBoolean(false);

    private volatile Duration   cycleInterval;
    private volatile Disposable timer;
    private volatile boolean    enabled;
    private volatile Instant    startedAt;

    public CycleDaemon(DaemonSettings settings,
                       UnitOfWork unitOfWork,
                       LiveAgentState liveState,
                       HeartbeatLog heartbeatLog,
                       ReentrancyGuard guard,
                       SnapshotStore snapshotStore,
                       RecoveryCoordinator recovery,
                       Watchdog watchdog,
                       ContinuityEngine continuity,
                       Clock clock,
                       @Qualifier("cycleScheduler") Scheduler scheduler) {
        this.settings      = settings;
        this.unitOfWork    = unitOfWork;
        this.liveState     = liveState;
        this.heartbeatLog  = heartbeatLog;
        this.guard         = guard;
        this.snapshotStore = snapshotStore;
        this.recovery      = recovery;
        this.watchdog      = watchdog;
        this.continuity    = continuity;
        this.clock         = clock;
        this.scheduler     = scheduler;
        this.cycleInterval = settings.cycleInterval();
    }

    // ── lifecycle ──────────────────────────────────────────────────────────

    public synchronized void start() {
        if (enabled) {
            log.warn("[Daemon] Already running - start ignored");
            return;
        }

        recovery.coldStartRecovery().ifPresent(this::markRestarted);

        enabled   = true;
        startedAt = clock.instant();
        heartbeatLog.record(HeartbeatStatus.ALIVE, liveState.cycleCount(), 0);

        timer = Flux.interval(settings.firstCycleDelay(), cycleInterval, scheduler)
            .onBackpressureDrop()
            .subscribe(
                tick -> runCycle().subscribe(
                    result -> {},
                    err -> log.error("[Daemon] Cycle pipeline failed", err)),
                err -> log.error("[Daemon] Cycle timer terminated unexpectedly", err)
            );
        watchdog.enable();

        log.info("[Daemon] Started. cycleIntervalMs={} firstCycleDelayMs={} snapshotEveryCycles={}",
            cycleInterval.toMillis(), settings.firstCycleDelay().toMillis(), settings.snapshotEveryCycles());
    }

    /**
     * Cancels both timers, disables the watchdog, saves a final snapshot and marks the
     * daemon disabled. A cycle already in flight is left to finish.
     */
    public synchronized void stop() {
        if (!enabled) {
            log.debug("[Daemon] Not running - stop ignored");
            return;
        }
        Disposable current = timer;
        if (current != null) {
            current.dispose();
            timer = null;
        }
        watchdog.disable();
        saveSnapshot();
        enabled = false;
        log.info("[Daemon] Stopped. totalCyclesRun={}", totalCyclesRun.get());
    }

    /** Changes the cycle interval; restarts the timer if the daemon is running. */
    public synchronized void setCycleInterval(long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("cycle interval must be positive: " + intervalMs);
        }
        Duration previous = cycleInterval;
        cycleInterval = Duration.ofMillis(intervalMs);
        log.info("[Daemon] Cycle interval changed. fromMs={} toMs={}", previous.toMillis(), intervalMs);
        if (enabled) {
            stop();
            start();
        }
    }

    // ── one cycle ──────────────────────────────────────────────────────────

    /**
     * Runs one guarded cycle.
     *
     * @return the cycle's result, or empty when skipped because another cycle is in flight
     */
    public Mono<CycleResult> runCycle() {
        return Mono.defer(() -> {
            Instant begin = clock.instant();
            long token = guard.tryAcquire(begin);
            if (token == ReentrancyGuard.NOT_ACQUIRED) {
                log.warn("[Daemon] Previous cycle still running - skipping this tick");
                return Mono.empty();
            }

            long cycle = liveState.cycleCount() + 1;
            boolean afterRestart = afterRestartPending.getAndSet(false);
            String traceId = TraceContextUtil.newCycleTraceId(cycle);
            CycleTrigger trigger = new CycleTrigger(cycle, afterRestart, begin, traceId);

            TraceContextUtil.withMdc(traceId, () ->
                log.info("[Daemon] Cycle {} starting. afterRestart={}", cycle, afterRestart));
            heartbeatLog.record(HeartbeatStatus.RUNNING, cycle, 0);

            Mono<CycleResult> body = Mono.defer(() -> unitOfWork.runOneCycle(trigger))
                .onErrorResume(e -> {
                    log.error("[Daemon] Unit of work raised. cycle={} traceId={}", cycle, traceId, e);
                    return Mono.just(CycleResult.failure(cycle, describe(e)));
                })
                .defaultIfEmpty(CycleResult.failure(cycle, "unit of work returned no result"))
                .doOnNext(result -> complete(trigger, result, begin))
                .doFinally(signal -> guard.release(token));

            return TraceContextUtil.withTraceId(body, traceId);
        });
    }

    private void complete(CycleTrigger trigger, CycleResult result, Instant begin) {
        long cycle = trigger.cycle();
        long elapsedMs = Math.max(0, Duration.between(begin, clock.instant()).toMillis());

        if (result.success()) {
            liveState.advanceCycle(cycle);
            long total = totalCyclesRun.incrementAndGet();
            heartbeatLog.record(HeartbeatStatus.COMPLETED, cycle, elapsedMs);
            TraceContextUtil.withMdc(trigger.traceId(), () ->
                log.info("[Daemon] Cycle {} completed. durationMs={} totalCyclesRun={}", cycle, elapsedMs, total));
            if (total % settings.snapshotEveryCycles() == 0) {
                saveSnapshot();
            }
            return;
        }

        Heartbeat heartbeat = heartbeatLog.record(HeartbeatStatus.ERROR, cycle, elapsedMs);
        TraceContextUtil.withMdc(trigger.traceId(), () ->
            log.error("[Daemon] Cycle {} failed. error={} consecutiveFailures={}",
                cycle, result.error(), heartbeat.consecutiveFailures()));
        if (heartbeat.consecutiveFailures() >= FAILURES_BEFORE_RECOVERY) {
            log.warn("[Daemon] {} consecutive failures - triggering crash recovery", heartbeat.consecutiveFailures());
            recovery.recover(RecoveryType.CRASH_RECOVERY,
                heartbeat.consecutiveFailures() + " consecutive cycle failures, last: " + result.error());
        }
    }

    // ── operator actions ───────────────────────────────────────────────────

    public StateSnapshot saveSnapshot() {
        return snapshotStore.save(liveState, continuity.checkpoint());
    }

    public RecoveryEvent recoverManually() {
        return recovery.recover(RecoveryType.MANUAL_RECOVERY, "Operator requested recovery");
    }

    // ── queries ────────────────────────────────────────────────────────────

    /** Heartbeat exists, is younger than the stall timeout, and fewer than three failures in a row. */
    public boolean isHealthy() {
        return heartbeatLog.last()
            .map(hb -> hb.ageAt(clock.instant()).compareTo(settings.heartbeatTimeout()) < 0
                       && hb.consecutiveFailures() < FAILURES_BEFORE_RECOVERY)
            .orElse(false);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public long totalCyclesRun() {
        return totalCyclesRun.get();
    }

    public Duration cycleInterval() {
        return cycleInterval;
    }

    public List<Heartbeat> heartbeatHistory(int limit) {
        return heartbeatLog.recent(limit);
    }

    public DaemonStatus exportStatus() {
        Instant now = clock.instant();
        Instant started = startedAt;
        return new DaemonStatus(
            enabled,
            guard.isHeld(),
            isHealthy(),
            started,
            totalCyclesRun.get(),
            cycleInterval.toMillis(),
            watchdog.isEnabled(),
            heartbeatLog.last().orElse(null),
            snapshotStore.lastSnapshot().map(DaemonStatus.SnapshotRef::of).orElse(null),
            recovery.recoveryCount(),
            recovery.lastRecovery().orElse(null),
            continuity.rebirthCount(),
            continuity.status(),
            continuity.mode(),
            guard.heldSince().orElse(null),
            started != null ? Math.max(0, Duration.between(started, now).toMillis()) : 0L);
    }

    private void markRestarted(RecoveryEvent coldStart) {
        afterRestartPending.set(true);
        log.info("[Daemon] Next cycle tagged after_restart. snapshotUsed={} cycleRestored={}",
            coldStart.snapshotUsed(), coldStart.cycleRestored());
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
