package com.agentdaemon.daemon.controller;

import com.agentdaemon.common.model.RebirthEvent;
import com.agentdaemon.daemon.continuity.ContinuityEngine;
import com.agentdaemon.daemon.continuity.ContinuityStatusView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/** Read side of the continuity engine, plus a forced re-check. */
@RestController
@RequestMapping("/api/v1/continuity")
public class ContinuityController {

    private static final Logger log = LoggerFactory.getLogger(ContinuityController.class);

    private final ContinuityEngine continuity;

    public ContinuityController(ContinuityEngine continuity) {
        this.continuity = continuity;
    }

    @GetMapping("/status")
    public ResponseEntity<ContinuityStatusView> status() {
        return ResponseEntity.ok(continuity.exportStatus());
    }

    @GetMapping("/rebirths")
    public ResponseEntity<List<RebirthEvent>> rebirths() {
        return ResponseEntity.ok(continuity.rebirthEvents());
    }

    @PostMapping("/check")
    public Mono<ResponseEntity<Object>> check() {
        log.info("[ContinuityAPI] forced check requested");
        return continuity.forceRecoveryCheck()
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .onErrorResume(e -> {
                log.error("[ContinuityAPI] forced check failed", e);
                return Mono.just(ResponseEntity.status(500).body(Map.of("error", String.valueOf(e.getMessage()))));
            });
    }
}
