package com.agentdaemon.daemon.bootstrap;

import com.agentdaemon.common.model.ContinuityMode;
import com.agentdaemon.common.model.ContinuityRecord;
import com.agentdaemon.common.model.ContinuityStatus;
import com.agentdaemon.common.model.CycleResult;
import com.agentdaemon.daemon.DaemonFixture;
import com.agentdaemon.daemon.snapshot.SnapshotLoad;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DaemonBootstrapTest {

    @TempDir
    Path dir;

    private VirtualTimeScheduler scheduler;
    private Path                 snapshotPath;

    @BeforeEach
    void setUp() {
        scheduler    = VirtualTimeScheduler.create();
        snapshotPath = dir.resolve("state_snapshot.json");
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private DaemonFixture fixture() {
        return new DaemonFixture(snapshotPath, scheduler,
            trigger -> Mono.just(CycleResult.success(trigger.cycle(), Map.of())));
    }

    @Test
    @DisplayName("fresh install: continuity baseline, then the daemon starts")
    void freshInstall() {
        DaemonFixture f = fixture();
        DaemonBootstrap bootstrap = new DaemonBootstrap(f.snapshotStore, f.continuity, f.daemon, true);

        StepVerifier.create(bootstrap.boot()).verifyComplete();

        assertEquals(ContinuityMode.NORMAL, f.continuity.mode());
        assertTrue(f.continuity.isStartupComplete());
        assertTrue(f.daemon.isEnabled());

        bootstrap.shutdown();
        assertFalse(f.daemon.isEnabled());
        assertTrue(Files.exists(snapshotPath));
    }

    @Test
    @DisplayName("restart reads the reboot counter and record persisted on shutdown")
    void restart() {
        DaemonFixture first = fixture();
        DaemonBootstrap firstBoot = new DaemonBootstrap(first.snapshotStore, first.continuity, first.daemon, true);
        firstBoot.boot().block();
        firstBoot.shutdown();

        DaemonFixture second = fixture();
        new DaemonBootstrap(second.snapshotStore, second.continuity, second.daemon, false).boot().block();

        assertEquals(2, second.continuity.totalReboots());
        assertEquals(ContinuityMode.NORMAL, second.continuity.mode());
        assertFalse(second.daemon.isEnabled(), "auto-start disabled");
    }

    @Test
    @DisplayName("corrupted snapshot counts as a prior run: discontinuity, daemon still starts")
    void corruptedSnapshot() throws IOException {
        Files.writeString(snapshotPath, "{ broken");
        DaemonFixture f = fixture();
        DaemonBootstrap bootstrap = new DaemonBootstrap(f.snapshotStore, f.continuity, f.daemon, true);

        bootstrap.boot().block();

        assertEquals(ContinuityMode.RECOVERY, f.continuity.mode());
        assertEquals(1, f.continuity.rebirthCount());
        assertTrue(f.daemon.isEnabled());
        assertTrue(f.recovery.history().isEmpty(), "no usable snapshot, so no cold start");
        bootstrap.shutdown();
    }

    @Test
    @DisplayName("incomplete continuity record outside the checksum: treated as lost, replaced, next restart is clean")
    void incompleteContinuityRecord() throws IOException {
        DaemonFixture first = fixture();
        DaemonBootstrap firstBoot = new DaemonBootstrap(first.snapshotStore, first.continuity, first.daemon, true);
        firstBoot.boot().block();
        firstBoot.shutdown();

        ObjectNode json = (ObjectNode) first.objectMapper.readTree(snapshotPath.toFile());
        json.putObject("continuity_record").put("status", "OK");
        first.objectMapper.writeValue(snapshotPath.toFile(), json);

        DaemonFixture second = fixture();
        assertEquals(SnapshotLoad.Outcome.LOADED, second.snapshotStore.load().outcome(),
            "checksum does not cover the continuity record");
        DaemonBootstrap secondBoot = new DaemonBootstrap(second.snapshotStore, second.continuity, second.daemon, true);
        secondBoot.boot().block();

        assertTrue(second.continuity.isStartupComplete());
        assertEquals(ContinuityMode.RECOVERY, second.continuity.mode());
        assertEquals(1, second.continuity.rebirthCount());
        assertEquals(ContinuityStatus.DEGRADED, second.continuity.status());
        ContinuityRecord replaced = second.continuity.currentRecord().orElseThrow();
        assertNotNull(replaced.identityFingerprint().hash());
        assertTrue(second.daemon.isEnabled());
        secondBoot.shutdown();

        DaemonFixture third = fixture();
        new DaemonBootstrap(third.snapshotStore, third.continuity, third.daemon, false).boot().block();

        assertTrue(third.continuity.isStartupComplete());
        assertEquals(ContinuityMode.NORMAL, third.continuity.mode());
        assertEquals(3, third.continuity.totalReboots());
    }
}
