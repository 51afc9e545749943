package com.agentdaemon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** What a {@link RecoveryEvent} was able to take from the snapshot it used. */
public record RestoredState(
    @JsonProperty("confidence")         Double confidence,
    @JsonProperty("autonomy")           Integer autonomy,
    @JsonProperty("patterns_preserved") boolean patternsPreserved
) {

    public static RestoredState fromSnapshot(StateSnapshot snapshot) {
        return new RestoredState(snapshot.agentState().confidence(), snapshot.autonomyLevel(), true);
    }

    public static RestoredState nothing() {
        return new RestoredState(null, null, false);
    }
}
