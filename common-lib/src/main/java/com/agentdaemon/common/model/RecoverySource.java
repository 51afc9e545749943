package com.agentdaemon.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** First subsystem that yielded recovered data during a rebirth. */
public enum RecoverySource {

    IDENTITY_CORE("identity_core"),
    DISTILLED_MEMORY("distilled_memory"),
    EVOLUTION_LOGS("evolution_logs"),
    FRESH_START("fresh_start");

    private final String wireName;

    RecoverySource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static RecoverySource fromWire(String value) {
        for (RecoverySource source : values()) {
            if (source.wireName.equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown recovery source: " + value);
    }
}
