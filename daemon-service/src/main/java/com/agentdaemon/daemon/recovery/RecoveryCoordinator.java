package com.agentdaemon.daemon.recovery;

import com.agentdaemon.common.history.BoundedHistory;
import com.agentdaemon.common.model.HeartbeatStatus;
import com.agentdaemon.common.model.RecoveryEvent;
import com.agentdaemon.common.model.RecoveryType;
import com.agentdaemon.common.model.RestoredState;
import com.agentdaemon.common.model.StateSnapshot;
import com.agentdaemon.daemon.heartbeat.HeartbeatLog;
import com.agentdaemon.daemon.job.ReentrancyGuard;
import com.agentdaemon.daemon.notification.OperatorAlertSender;
import com.agentdaemon.daemon.snapshot.SnapshotStore;
import com.agentdaemon.daemon.state.LiveAgentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Liveness recovery shared by the crash path, the watchdog and the operator, plus the
 * once-per-process cold-start restoration.
 *
 * <h3>Recovery procedure</h3>
 * <ol>
 *   <li>increment the recovery counter</li>
 *   <li>build a {@link RecoveryEvent} from the in-memory last snapshot, if any</li>
 *   <li>clear the reentrancy guard</li>
 *   <li>record an {@code alive} heartbeat</li>
 *   <li>alert the operator</li>
 * </ol>
 * The snapshot file is never touched here, and accumulated totals are never reset; the
 * next timer tick resumes normal cycling.
 */
@Component
public class RecoveryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RecoveryCoordinator.class);

    public static final int MAX_EVENTS = 50;

    private final HeartbeatLog        heartbeatLog;
    private final ReentrancyGuard     guard;
    private final SnapshotStore       snapshotStore;
    private final LiveAgentState      liveState;
    private final OperatorAlertSender alertSender;
    private final Clock               clock;

    private final BoundedHistory<RecoveryEvent> events = new BoundedHistory<>(MAX_EVENTS);
    private final AtomicInteger recoveryCount      = new AtomicInteger();
    private final AtomicBoolean coldStartPerformed = new AtomicBoolean(false);
    private volatile Instant    lastRecovery;

    public RecoveryCoordinator(HeartbeatLog heartbeatLog,
                               ReentrancyGuard guard,
                               SnapshotStore snapshotStore,
                               LiveAgentState liveState,
                               OperatorAlertSender alertSender,
                               Clock clock) {
        this.heartbeatLog  = heartbeatLog;
        this.guard         = guard;
        this.snapshotStore = snapshotStore;
        this.liveState     = liveState;
        this.alertSender   = alertSender;
        this.clock         = clock;
    }

    /**
     * Restores carried-over values from the loaded snapshot. Runs at most once per process;
     * later calls are no-ops.
     *
     * @return the {@code cold_start} event, or empty for a fresh boot or a repeated call
     */
    public Optional<RecoveryEvent> coldStartRecovery() {
        if (!coldStartPerformed.compareAndSet(false, true)) {
            log.debug("[Recovery] Cold start already performed in this process - skipping");
            return Optional.empty();
        }

        Optional<StateSnapshot> loaded = snapshotStore.lastSnapshot();
        if (loaded.isEmpty()) {
            log.info("[Recovery] Cold start with no usable snapshot - proceeding with fresh state");
            return Optional.empty();
        }

        StateSnapshot snapshot = loaded.get();
        liveState.restoreFrom(snapshot);
        log.info("[Recovery] Cold start restored from snapshot. id={} cycle={} confidence={} autonomyLevel={} "
                 + "behaviorPatternHash={} (values NOT reset to defaults)",
            snapshot.id(), snapshot.cycle(), snapshot.agentState().confidence(),
            snapshot.autonomyLevel(), snapshot.behaviorPatternHash());

        Instant now = clock.instant();
        RecoveryEvent event = new RecoveryEvent(
            eventId("coldstart", now, events.size() + 1),
            now,
            RecoveryType.COLD_START,
            snapshot.id(),
            snapshot.cycle(),
            RestoredState.fromSnapshot(snapshot),
            "Confidence, autonomy level and behavior patterns restored from snapshot - not reset");
        events.add(event);
        return Optional.of(event);
    }

    /**
     * Runs the recovery procedure.
     *
     * @param type   crash, watchdog or manual; {@code cold_start} is rejected
     * @param reason free-form trigger description, appended to the event notes
     */
    public synchronized RecoveryEvent recover(RecoveryType type, String reason) {
        if (type == RecoveryType.COLD_START) {
            throw new IllegalArgumentException("cold_start is not a recovery procedure; use coldStartRecovery()");
        }

        int count = recoveryCount.incrementAndGet();
        Instant now = clock.instant();
        log.info("[Recovery] Starting recovery procedure. type={} count={} reason={}",
            type.wireName(), count, reason);

        Optional<StateSnapshot> snapshot = snapshotStore.lastSnapshot();
        RecoveryEvent event = snapshot
            .map(s -> {
                log.info("[Recovery] Snapshot available. id={} cycle={}", s.id(), s.cycle());
                return new RecoveryEvent(eventId("recovery", now, count), now, type, s.id(), s.cycle(),
                    RestoredState.fromSnapshot(s),
                    "Snapshot available - patterns preserved. " + reason);
            })
            .orElseGet(() -> {
                log.warn("[Recovery] No snapshot available - patterns not preserved");
                return new RecoveryEvent(eventId("recovery", now, count), now, type, null,
                    liveState.cycleCount(), RestoredState.nothing(),
                    "No snapshot available - patterns not preserved. " + reason);
            });

        if (guard.forceClear()) {
            log.warn("[Recovery] Cleared reentrancy guard held by a stuck cycle");
        }
        heartbeatLog.record(HeartbeatStatus.ALIVE, liveState.cycleCount(), 0);

        events.add(event);
        lastRecovery = now;
        alertSender.sendRecoveryAlert(event);

        log.info("[Recovery] Recovery complete - resuming operations. eventId={}", event.id());
        return event;
    }

    public int recoveryCount() {
        return recoveryCount.get();
    }

    public Optional<Instant> lastRecovery() {
        return Optional.ofNullable(lastRecovery);
    }

    /** Retained events, oldest first, cold starts included. */
    public List<RecoveryEvent> history() {
        return events.snapshot();
    }

    private static String eventId(String prefix, Instant at, int seq) {
        return prefix + "_" + at.toEpochMilli() + "_" + seq;
    }
}
