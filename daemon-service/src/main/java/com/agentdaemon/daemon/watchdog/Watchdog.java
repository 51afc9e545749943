package com.agentdaemon.daemon.watchdog;

import com.agentdaemon.common.model.Heartbeat;
import com.agentdaemon.common.model.RecoveryType;
import com.agentdaemon.daemon.config.DaemonSettings;
import com.agentdaemon.daemon.heartbeat.HeartbeatLog;
import com.agentdaemon.daemon.job.ReentrancyGuard;
import com.agentdaemon.daemon.recovery.RecoveryCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Audits heartbeat freshness on its own timer and forces recovery when the cycle loop
 * looks stalled.
 *
 * <p>A check only reads in-memory timestamps and never waits on a collaborator. The stall
 * timeout is expected to exceed one cycle interval.
 */
@Component
public class Watchdog {

    private static final Logger log = LoggerFactory.getLogger(Watchdog.class);

    private final Duration            checkInterval;
    private final Duration            stallTimeout;
    private final HeartbeatLog        heartbeatLog;
    private final ReentrancyGuard     guard;
    private final RecoveryCoordinator recovery;
    private final Clock               clock;
    private final Scheduler           scheduler;

    private volatile Disposable timer;
    private volatile boolean    enabled;

    public Watchdog(DaemonSettings settings,
                    HeartbeatLog heartbeatLog,
                    ReentrancyGuard guard,
                    RecoveryCoordinator recovery,
                    Clock clock,
                    @Qualifier("watchdogScheduler") Scheduler scheduler) {
        this.checkInterval = settings.watchdogInterval();
        this.stallTimeout  = settings.heartbeatTimeout();
        this.heartbeatLog  = heartbeatLog;
        this.guard         = guard;
        this.recovery      = recovery;
        this.clock         = clock;
        this.scheduler     = scheduler;
    }

    public synchronized void enable() {
        cancelTimer();
        timer = Flux.interval(checkInterval, checkInterval, scheduler)
            .onBackpressureDrop()
            .subscribe(
                tick -> safeCheck(),
                err  -> log.error("[Watchdog] Timer terminated unexpectedly", err)
            );
        enabled = true;
        log.info("[Watchdog] Started. intervalMs={} stallTimeoutMs={}",
            checkInterval.toMillis(), stallTimeout.toMillis());
    }

    public synchronized void disable() {
        cancelTimer();
        enabled = false;
        log.info("[Watchdog] Stopped");
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Compares now against the last heartbeat. A gap strictly greater than the stall timeout
     * force-clears the guard and runs a {@code watchdog_recovery}.
     */
    public WatchdogVerdict check() {
        Instant now = clock.instant();
        Optional<Heartbeat> last = heartbeatLog.last();

        if (last.isEmpty()) {
            log.warn("[Watchdog] No heartbeat recorded - system may be starting up");
            return WatchdogVerdict.NO_HEARTBEAT;
        }

        Duration gap = last.get().ageAt(now);
        if (gap.compareTo(stallTimeout) <= 0) {
            guard.heldSince()
                .filter(since -> Duration.between(since, now).compareTo(stallTimeout) > 0)
                .ifPresent(since -> log.warn("[Watchdog] Cycle running for {}s but heartbeats are fresh - not intervening",
                    Duration.between(since, now).toSeconds()));
            log.debug("[Watchdog] Heartbeat fresh. ageMs={}", gap.toMillis());
            return WatchdogVerdict.FRESH;
        }

        log.error("[Watchdog] STALLED LOOP DETECTED - no heartbeat for {}s (timeout {}s)",
            gap.toSeconds(), stallTimeout.toSeconds());
        if (guard.forceClear()) {
            log.warn("[Watchdog] Force-cleared guard of stalled cycle");
        }
        recovery.recover(RecoveryType.WATCHDOG_RECOVERY,
            "No heartbeat for " + gap.toSeconds() + "s");
        return WatchdogVerdict.STALLED;
    }

    // A failing check must not terminate the interval subscription.
    private void safeCheck() {
        try {
            check();
        } catch (RuntimeException e) {
            log.error("[Watchdog] Health check failed", e);
        }
    }

    private void cancelTimer() {
        Disposable current = timer;
        if (current != null) {
            current.dispose();
            timer = null;
        }
    }
}
