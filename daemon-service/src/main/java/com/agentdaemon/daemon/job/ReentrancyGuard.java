package com.agentdaemon.daemon.job;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Allows one cycle in flight at a time.
 *
 * <p>Each acquisition gets a fresh token; {@link #release(long)} only frees the guard if
 * that token still holds it. A cycle that outlives a watchdog {@link #forceClear()} can
 * therefore never release a guard taken by a newer cycle.
 */
@Component
public class ReentrancyGuard {

    public static final long NOT_ACQUIRED = 0L;

    private final AtomicLong holder = new AtomicLong(NOT_ACQUIRED);
    private final AtomicLong tokens = new AtomicLong();
    private volatile Instant acquiredAt;

    /** @return a positive token, or {@link #NOT_ACQUIRED} if another cycle holds the guard */
    public long tryAcquire(Instant now) {
        long token = tokens.incrementAndGet();
        if (holder.compareAndSet(NOT_ACQUIRED, token)) {
            acquiredAt = now;
            return token;
        }
        return NOT_ACQUIRED;
    }

    /** @return true if {@code token} was still the holder */
    public boolean release(long token) {
        if (token == NOT_ACQUIRED) {
            return false;
        }
        return holder.compareAndSet(token, NOT_ACQUIRED);
    }

    /** Frees the guard whoever holds it. @return true if it was held */
    public boolean forceClear() {
        return holder.getAndSet(NOT_ACQUIRED) != NOT_ACQUIRED;
    }

    public boolean isHeld() {
        return holder.get() != NOT_ACQUIRED;
    }

    public Optional<Instant> heldSince() {
        return isHeld() ? Optional.ofNullable(acquiredAt) : Optional.empty();
    }
}
