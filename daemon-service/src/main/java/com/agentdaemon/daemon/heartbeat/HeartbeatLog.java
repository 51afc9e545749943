package com.agentdaemon.daemon.heartbeat;

import com.agentdaemon.common.history.BoundedHistory;
import com.agentdaemon.common.model.Heartbeat;
import com.agentdaemon.common.model.HeartbeatStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Bounded, append-only record of cycle attempts and outcomes. Feeds the watchdog and the
 * health predicate.
 */
@Component
public class HeartbeatLog {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatLog.class);

    public static final int MAX_HISTORY = 100;

    private final BoundedHistory<Heartbeat> history = new BoundedHistory<>(MAX_HISTORY);
    private final Clock clock;

    public HeartbeatLog(Clock clock) {
        this.clock = clock;
    }

    /**
     * Appends a heartbeat whose streak counters derive from the current last one.
     * Synchronised so derivation and append are one step.
     */
    public synchronized Heartbeat record(HeartbeatStatus status, long cycle, long durationMs) {
        Heartbeat heartbeat = Heartbeat.next(history.latest().orElse(null), cycle, status,
                                             durationMs, clock.instant());
        history.add(heartbeat);
        log.info("[Heartbeat] status={} cycle={} durationMs={} successes={} failures={}",
            status.wireName(), cycle, heartbeat.cycleDurationMs(),
            heartbeat.consecutiveSuccesses(), heartbeat.consecutiveFailures());
        return heartbeat;
    }

    public Optional<Heartbeat> last() {
        return history.latest();
    }

    /** Most recent {@code limit} heartbeats, oldest first. */
    public List<Heartbeat> recent(int limit) {
        return history.recent(limit);
    }

    public int size() {
        return history.size();
    }
}
