package com.agentdaemon.daemon.snapshot;

import com.agentdaemon.common.exception.DaemonException;
import com.agentdaemon.common.integrity.SnapshotChecksum;
import com.agentdaemon.common.model.AgentState;
import com.agentdaemon.common.model.ContinuityCheckpoint;
import com.agentdaemon.common.model.StateSnapshot;
import com.agentdaemon.daemon.config.DaemonSettings;
import com.agentdaemon.daemon.state.LiveAgentState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Reads and writes the single checksummed snapshot file.
 *
 * <p><strong>Write:</strong> serialise to a temp file in the target directory, then move it
 * over the snapshot path. A failed write is logged and leaves the in-memory last snapshot
 * untouched; it never throws to the caller.
 *
 * <p><strong>Read:</strong> a missing file and a corrupted file (unparseable, or checksum
 * mismatch) both yield no snapshot but log differently. A corrupted file is left in place
 * for inspection.
 *
 * <p>Only the daemon writes through this store. Recovery reads {@link #lastSnapshot()}
 * and never touches the file.
 */
@Component
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    private final Path         path;
    private final ObjectMapper objectMapper;
    private final Clock        clock;

    private volatile StateSnapshot lastSnapshot;

    public SnapshotStore(DaemonSettings settings, ObjectMapper objectMapper, Clock clock) {
        this.path         = settings.snapshotPath();
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    /**
     * Builds a snapshot of {@code state}, checksums it and persists it.
     *
     * @return the snapshot that was built, whether or not the write succeeded
     */
    public StateSnapshot save(LiveAgentState state, ContinuityCheckpoint checkpoint) {
        StateSnapshot snapshot = build(state, checkpoint);
        try {
            writeAtomically(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot));
            lastSnapshot = snapshot;
            log.info("[Snapshot] Saved. id={} cycle={} checksum={} path={}",
                snapshot.id(), snapshot.cycle(), snapshot.checksum(), path);
        } catch (JsonProcessingException e) {
            log.error("[Snapshot] Serialisation failed - keeping previous snapshot. id={}",
                snapshot.id(), new DaemonException("SnapshotStore", "cannot serialise snapshot", e));
        } catch (IOException e) {
            log.error("[Snapshot] Write failed - keeping previous snapshot. id={} path={}",
                snapshot.id(), path, e);
        }
        return snapshot;
    }

    /** Reads the file if present and verifies its checksum. */
    public SnapshotLoad load() {
        if (!Files.exists(path)) {
            log.info("[Snapshot] No snapshot file at {} - starting from fresh state", path);
            return SnapshotLoad.missing();
        }

        StateSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(Files.readAllBytes(path), StateSnapshot.class);
        } catch (IOException e) {
            log.warn("[Snapshot] Snapshot file unreadable - ignoring corrupted snapshot. path={} reason={}",
                path, e.getMessage());
            return SnapshotLoad.corrupted();
        }

        if (snapshot == null || !SnapshotChecksum.verify(snapshot)) {
            log.warn("[Snapshot] Checksum mismatch - ignoring corrupted snapshot, file left in place. path={}", path);
            return SnapshotLoad.corrupted();
        }

        lastSnapshot = snapshot;
        log.info("[Snapshot] Loaded snapshot. id={} cycle={} savedAt={}",
            snapshot.id(), snapshot.cycle(), snapshot.timestamp());
        return SnapshotLoad.loaded(snapshot);
    }

    /** Last snapshot successfully written or loaded in this process. */
    public Optional<StateSnapshot> lastSnapshot() {
        return Optional.ofNullable(lastSnapshot);
    }

    public Path path() {
        return path;
    }

    // ── internals ──────────────────────────────────────────────────────────

    StateSnapshot build(LiveAgentState state, ContinuityCheckpoint checkpoint) {
        Instant now = clock.instant();
        AgentState agentState = state.toAgentState();
        int autonomyLevel = state.autonomyLevel();
        ContinuityCheckpoint cp = checkpoint != null ? checkpoint : ContinuityCheckpoint.none();

        StateSnapshot unsigned = new StateSnapshot(
            "snap_" + now.toEpochMilli(),
            now,
            agentState.cycleCount(),
            StateSnapshot.SCHEMA_VERSION,
            agentState,
            autonomyLevel,
            state.activeConstraints(),
            state.realityMetrics(),
            state.behaviorPatternHash(),
            state.desireSummary(),
            state.governanceState(),
            cp.rebootCount(),
            cp.record(),
            null);
        return unsigned.withChecksum(SnapshotChecksum.compute(unsigned));
    }

    private void writeAtomically(byte[] payload) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = Files.createTempFile(dir, ".snapshot-", ".tmp");
        try {
            Files.write(tmp, payload);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("[Snapshot] Atomic move unsupported on this file system, replacing in place");
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
