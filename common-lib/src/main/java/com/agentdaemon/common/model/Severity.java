package com.agentdaemon.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Discontinuity severity, declared from least to most severe. */
public enum Severity {

    NONE("none"),
    MINOR("minor"),
    MODERATE("moderate"),
    SEVERE("severe"),
    CRITICAL("critical");

    private final String wireName;

    Severity(String wireName) {
        this.wireName = wireName;
    }

    /** Raises to {@code floor} if this severity is lower; never downgrades. */
    public Severity atLeast(Severity floor) {
        return floor.ordinal() > ordinal() ? floor : this;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Severity fromWire(String value) {
        for (Severity severity : values()) {
            if (severity.wireName.equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
