package com.agentdaemon.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Subsystem a {@link Fingerprint} was computed from. */
public enum FingerprintOrigin {

    IDENTITY("identity"),
    EVOLUTION("evolution"),
    MEMORY("memory");

    private final String wireName;

    FingerprintOrigin(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static FingerprintOrigin fromWire(String value) {
        for (FingerprintOrigin origin : values()) {
            if (origin.wireName.equalsIgnoreCase(value)) {
                return origin;
            }
        }
        throw new IllegalArgumentException("Unknown fingerprint source: " + value);
    }
}
