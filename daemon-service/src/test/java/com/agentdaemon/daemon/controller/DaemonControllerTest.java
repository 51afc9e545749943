package com.agentdaemon.daemon.controller;

import com.agentdaemon.common.model.CycleResult;
import com.agentdaemon.daemon.DaemonFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.nio.file.Path;
import java.util.Map;

class DaemonControllerTest {

    @TempDir
    Path dir;

    private VirtualTimeScheduler scheduler;
    private DaemonFixture        f;
    private WebTestClient        client;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        f = new DaemonFixture(dir.resolve("snap.json"), scheduler,
            trigger -> Mono.just(CycleResult.success(trigger.cycle(), Map.of())));
        client = WebTestClient.bindToController(
                new DaemonController(f.daemon, f.recovery),
                new ContinuityController(f.continuity))
            .build();
    }

    @AfterEach
    void tearDown() {
        f.daemon.stop();
        scheduler.dispose();
    }

    @Test
    @DisplayName("health is 503 before any heartbeat and 200 after a cycle")
    void health() {
        client.get().uri("/api/v1/daemon/health").exchange()
            .expectStatus().isEqualTo(503);

        client.post().uri("/api/v1/daemon/cycle").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.success").isEqualTo(true);

        client.get().uri("/api/v1/daemon/health").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.healthy").isEqualTo(true);
    }

    @Test
    @DisplayName("non-positive interval is rejected with 400")
    void badInterval() {
        client.put().uri("/api/v1/daemon/interval?ms=0").exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("manual recovery is listed in the recovery history")
    void manualRecovery() {
        client.post().uri("/api/v1/daemon/recover").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.type").isEqualTo("manual_recovery");

        client.get().uri("/api/v1/daemon/recoveries").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.length()").isEqualTo(1);
    }

    @Test
    @DisplayName("continuity check runs and status reports the new record")
    void continuityCheck() {
        client.post().uri("/api/v1/continuity/check").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.detected").isEqualTo(false);

        client.get().uri("/api/v1/continuity/status").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.mode").isEqualTo("NORMAL")
            .jsonPath("$.totalReboots").isEqualTo(1);
    }
}
