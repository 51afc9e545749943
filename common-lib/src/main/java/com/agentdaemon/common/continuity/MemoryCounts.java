package com.agentdaemon.common.continuity;

/** Retained-memory counts as reported in the memory subsystem's summary. */
public record MemoryCounts(int coreIdentityCount, int activeLessonsCount) {

    public boolean isEmpty() {
        return coreIdentityCount == 0 && activeLessonsCount == 0;
    }
}
