package com.agentdaemon.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Why the daemon ran a liveness recovery. */
public enum RecoveryType {

    /** Process start that found a usable snapshot. */
    COLD_START("cold_start"),

    /** Three consecutive failed cycles. */
    CRASH_RECOVERY("crash_recovery"),

    /** Watchdog saw no heartbeat progress within the stall timeout. */
    WATCHDOG_RECOVERY("watchdog_recovery"),

    /** Operator request. */
    MANUAL_RECOVERY("manual_recovery");

    private final String wireName;

    RecoveryType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static RecoveryType fromWire(String value) {
        for (RecoveryType type : values()) {
            if (type.wireName.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown recovery type: " + value);
    }
}
