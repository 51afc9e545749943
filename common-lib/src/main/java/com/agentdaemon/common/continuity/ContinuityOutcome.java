package com.agentdaemon.common.continuity;

import com.agentdaemon.common.model.ContinuityStatus;

/** Maps the number of unrecovered gaps after a rebirth to a {@link ContinuityStatus}. */
public final class ContinuityOutcome {

    /** More gaps than this and continuity is considered broken. */
    public static final int BROKEN_GAP_THRESHOLD = 2;

    private ContinuityOutcome() {}

    public static ContinuityStatus statusFor(int remainingGaps) {
        if (remainingGaps > BROKEN_GAP_THRESHOLD) return ContinuityStatus.BROKEN;
        if (remainingGaps > 0)                    return ContinuityStatus.DEGRADED;
        return ContinuityStatus.OK;
    }
}
