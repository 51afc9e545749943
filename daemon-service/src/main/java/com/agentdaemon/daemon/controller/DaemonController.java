package com.agentdaemon.daemon.controller;

import com.agentdaemon.common.model.CycleResult;
import com.agentdaemon.common.model.Heartbeat;
import com.agentdaemon.common.model.RecoveryEvent;
import com.agentdaemon.common.model.StateSnapshot;
import com.agentdaemon.daemon.heartbeat.HeartbeatLog;
import com.agentdaemon.daemon.job.CycleDaemon;
import com.agentdaemon.daemon.job.DaemonStatus;
import com.agentdaemon.daemon.recovery.RecoveryCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator surface for the cycle daemon.
 *
 * <p>Typical operator flow:
 * <ol>
 *   <li>GET  /health: 200 while heartbeats are fresh and failures stay below three, else 503</li>
 *   <li>GET  /status: full daemon status incl. continuity status</li>
 *   <li>POST /cycle: runs one cycle now (skipped if one is in flight)</li>
 *   <li>POST /recover: manual recovery</li>
 *   <li>PUT  /interval?ms=300000: changes the cycle interval, restarting the timer</li>
 * </ol>
 */
@RestController
@RequestMapping("/api/v1/daemon")
public class DaemonController {

    private static final Logger log = LoggerFactory.getLogger(DaemonController.class);

    private final CycleDaemon         daemon;
    private final RecoveryCoordinator recovery;

    public DaemonController(CycleDaemon daemon, RecoveryCoordinator recovery) {
        this.daemon   = daemon;
        this.recovery = recovery;
    }

    @GetMapping("/status")
    public ResponseEntity<DaemonStatus> status() {
        return ResponseEntity.ok(daemon.exportStatus());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        DaemonStatus s = daemon.exportStatus();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("healthy", s.healthy());
        body.put("enabled", s.enabled());
        body.put("continuityStatus", s.continuityStatus());
        body.put("lastHeartbeat", s.lastHeartbeat());
        HttpStatus code = s.healthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(code).body(body);
    }

    @GetMapping("/heartbeats")
    public ResponseEntity<List<Heartbeat>> heartbeats(
            @RequestParam(defaultValue = "20") int limit) {
        int bounded = Math.max(1, Math.min(limit, HeartbeatLog.MAX_HISTORY));
        return ResponseEntity.ok(daemon.heartbeatHistory(bounded));
    }

    @GetMapping("/recoveries")
    public ResponseEntity<List<RecoveryEvent>> recoveries() {
        return ResponseEntity.ok(recovery.history());
    }

    @PostMapping("/start")
    public ResponseEntity<DaemonStatus> start() {
        log.info("[DaemonAPI] start requested");
        daemon.start();
        return ResponseEntity.ok(daemon.exportStatus());
    }

    @PostMapping("/stop")
    public ResponseEntity<DaemonStatus> stop() {
        log.info("[DaemonAPI] stop requested");
        daemon.stop();
        return ResponseEntity.ok(daemon.exportStatus());
    }

    /** Runs one cycle now. 409 when a cycle is already in flight. */
    @PostMapping("/cycle")
    public Mono<ResponseEntity<CycleResult>> cycle() {
        log.info("[DaemonAPI] manual cycle requested");
        return daemon.runCycle()
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.status(HttpStatus.CONFLICT).build());
    }

    @PostMapping("/snapshot")
    public ResponseEntity<Map<String, Object>> snapshot() {
        log.info("[DaemonAPI] manual snapshot requested");
        StateSnapshot saved = daemon.saveSnapshot();
        return ResponseEntity.ok(Map.<String, Object>of(
            "id",       saved.id(),
            "cycle",    saved.cycle(),
            "checksum", saved.checksum()));
    }

    @PostMapping("/recover")
    public ResponseEntity<RecoveryEvent> recover() {
        log.info("[DaemonAPI] manual recovery requested");
        return ResponseEntity.ok(daemon.recoverManually());
    }

    @PutMapping("/interval")
    public ResponseEntity<Map<String, Object>> interval(@RequestParam long ms) {
        log.info("[DaemonAPI] interval change requested. ms={}", ms);
        try {
            daemon.setCycleInterval(ms);
            return ResponseEntity.ok(Map.<String, Object>of("cycleIntervalMs", daemon.cycleInterval().toMillis()));
        } catch (IllegalArgumentException e) {
            log.warn("[DaemonAPI] interval rejected. ms={} reason={}", ms, e.getMessage());
            return ResponseEntity.badRequest().body(Map.<String, Object>of("error", e.getMessage()));
        }
    }
}
