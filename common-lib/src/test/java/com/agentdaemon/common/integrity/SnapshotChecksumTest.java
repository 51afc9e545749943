package com.agentdaemon.common.integrity;

import com.agentdaemon.common.model.AgentState;
import com.agentdaemon.common.model.StateSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The checksum guards against accidental corruption of the resume fields. It is not
 * tamper-proof: an editor who recomputes it gets a valid file.
 */
class SnapshotChecksumTest {

    private static final AgentState STATE = new AgentState(42, 61.0, 1, 80.0, "active", "refine strategy");

    private static StateSnapshot signed(long cycle, AgentState state, int autonomy) {
        StateSnapshot unsigned = new StateSnapshot("snap_1", Instant.parse("2026-01-01T00:00:00Z"), cycle,
            StateSnapshot.SCHEMA_VERSION, state, autonomy, Set.of("b", "a"), null, "hash",
            Map.of("k", "v"), Map.of(), 1, null, null);
        return unsigned.withChecksum(SnapshotChecksum.compute(unsigned));
    }

    @Test
    @DisplayName("checksum is 8 lowercase hex chars and deterministic")
    void format() {
        String a = SnapshotChecksum.compute(42, STATE, 55);
        String b = SnapshotChecksum.compute(42, STATE, 55);
        assertEquals(a, b);
        assertTrue(a.matches("[0-9a-f]{8}"), a);
    }

    @Test
    @DisplayName("a freshly signed snapshot verifies")
    void verifiesSigned() {
        assertTrue(SnapshotChecksum.verify(signed(42, STATE, 55)));
    }

    @Test
    @DisplayName("changing cycle, agent state or autonomy invalidates the checksum")
    void coveredFieldsDetected() {
        StateSnapshot s = signed(42, STATE, 55);
        String sum = s.checksum();
        assertNotEquals(sum, SnapshotChecksum.compute(43, STATE, 55));
        assertNotEquals(sum, SnapshotChecksum.compute(42,
            new AgentState(42, 62.0, 1, 80.0, "active", "refine strategy"), 55));
        assertNotEquals(sum, SnapshotChecksum.compute(42, STATE, 56));
    }

    @Test
    @DisplayName("fields outside the checksum region do not affect it")
    void uncoveredFieldsIgnored() {
        StateSnapshot s = signed(42, STATE, 55);
        StateSnapshot edited = new StateSnapshot("other", Instant.EPOCH, 42, 1, STATE, 55,
            Set.of(), null, "different", Map.of(), Map.of("x", 1), 9, null, s.checksum());
        assertTrue(SnapshotChecksum.verify(edited));
    }

    @Test
    @DisplayName("missing checksum never verifies")
    void missingChecksum() {
        assertFalse(SnapshotChecksum.verify(signed(1, STATE, 1).withChecksum(null)));
    }
}
