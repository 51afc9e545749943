package com.agentdaemon.common.integrity;

import com.agentdaemon.common.model.AgentState;
import com.agentdaemon.common.model.StateSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * CRC-32 over the canonical JSON of {@code {cycle, agent_state, autonomy_level}}.
 *
 * <p>Cheap and order-sensitive; catches accidental corruption of the fields resume
 * depends on. Not tamper-proof: anyone who can edit the file can recompute it.
 */
public final class SnapshotChecksum {

    private SnapshotChecksum() {}

    public static String compute(long cycle, AgentState agentState, int autonomyLevel) {
        Map<String, Object> region = new LinkedHashMap<>();
        region.put("cycle", cycle);
        region.put("agent_state", agentState);
        region.put("autonomy_level", autonomyLevel);

        CRC32 crc = new CRC32();
        crc.update(CanonicalJson.bytes(region));
        return String.format("%08x", crc.getValue());
    }

    public static String compute(StateSnapshot snapshot) {
        return compute(snapshot.cycle(), snapshot.agentState(), snapshot.autonomyLevel());
    }

    /** True iff the stored checksum matches the one recomputed from the snapshot's fields. */
    public static boolean verify(StateSnapshot snapshot) {
        return snapshot.checksum() != null
            && snapshot.agentState() != null
            && snapshot.checksum().equals(compute(snapshot));
    }
}
