package com.agentdaemon.daemon.bootstrap;

import com.agentdaemon.common.model.ContinuityCheckpoint;
import com.agentdaemon.daemon.continuity.ContinuityEngine;
import com.agentdaemon.daemon.job.CycleDaemon;
import com.agentdaemon.daemon.snapshot.SnapshotLoad;
import com.agentdaemon.daemon.snapshot.SnapshotStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Startup order once the application context is ready:
 * <pre>
 *   load snapshot (once) → seed continuity engine → continuity startup checks → start daemon
 * </pre>
 * A failed continuity check is logged and does not keep the daemon from starting.
 * The daemon is stopped, with a final snapshot, when the context closes.
 */
@Component
public class DaemonBootstrap {

    private static final Logger log = LoggerFactory.getLogger(DaemonBootstrap.class);

    private final SnapshotStore    snapshotStore;
    private final ContinuityEngine continuity;
    private final CycleDaemon      daemon;
    private final boolean          autoStart;

    public DaemonBootstrap(SnapshotStore snapshotStore,
                           ContinuityEngine continuity,
                           CycleDaemon daemon,
                           @Value("${daemon.auto-start:true}") boolean autoStart) {
        this.snapshotStore = snapshotStore;
        this.continuity    = continuity;
        this.daemon        = daemon;
        this.autoStart     = autoStart;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        boot().subscribe(
            v -> {},
            err -> log.error("[Bootstrap] Startup sequence failed", err));
    }

    public Mono<Void> boot() {
        return Mono.defer(() -> {
            SnapshotLoad load = snapshotStore.load();
            switch (load.outcome()) {
                case LOADED    -> continuity.restore(ContinuityCheckpoint.of(load.snapshot()));
                case CORRUPTED -> continuity.markPriorRun();
                case MISSING   -> log.info("[Bootstrap] No previous snapshot - first start or wiped data directory");
            }

            return continuity.runStartupChecks()
                .doOnNext(report -> log.info("[Bootstrap] Continuity check done. detected={} severity={} status={}",
                    report.detected(), report.severity().wireName(), continuity.status()))
                .onErrorResume(e -> {
                    log.error("[Bootstrap] Continuity check failed - starting daemon anyway", e);
                    return Mono.empty();
                })
                .then(Mono.fromRunnable(() -> {
                    if (autoStart) {
                        daemon.start();
                    } else {
                        log.info("[Bootstrap] daemon.auto-start=false - waiting for POST /api/v1/daemon/start");
                    }
                }));
        });
    }

    @PreDestroy
    public void shutdown() {
        log.info("[Bootstrap] Shutting down - stopping daemon");
        daemon.stop();
    }
}
