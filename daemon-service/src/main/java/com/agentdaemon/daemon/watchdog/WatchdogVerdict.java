package com.agentdaemon.daemon.watchdog;

/** Result of one watchdog check. */
public enum WatchdogVerdict {

    /** Nothing recorded yet; the daemon may still be starting. */
    NO_HEARTBEAT,

    /** Last heartbeat is within the stall timeout. */
    FRESH,

    /** Last heartbeat is older than the stall timeout; recovery was run. */
    STALLED
}
