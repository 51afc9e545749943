package com.agentdaemon.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Liveness/outcome marker carried by every {@link Heartbeat}.
 *
 * <ul>
 *   <li>{@link #ALIVE}: daemon started, or a recovery finished</li>
 *   <li>{@link #RUNNING}: a cycle has been handed to the unit of work</li>
 *   <li>{@link #COMPLETED}: the unit of work reported success</li>
 *   <li>{@link #ERROR}: the unit of work reported failure or threw</li>
 * </ul>
 */
public enum HeartbeatStatus {

    ALIVE("alive"),
    RUNNING("running"),
    COMPLETED("completed"),
    ERROR("error");

    private final String wireName;

    HeartbeatStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static HeartbeatStatus fromWire(String value) {
        for (HeartbeatStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown heartbeat status: " + value);
    }
}
