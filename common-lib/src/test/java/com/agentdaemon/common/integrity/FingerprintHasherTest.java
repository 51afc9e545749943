package com.agentdaemon.common.integrity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FingerprintHasherTest {

    private static final List<String> KEYS = List.of("origin", "purpose");

    @Test
    @DisplayName("hash is 16 hex chars and independent of map insertion order")
    void stableAcrossOrder() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("origin", "x");
        a.put("purpose", "y");
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("purpose", "y");
        b.put("origin", "x");

        String ha = FingerprintHasher.hash(FingerprintHasher.project(a, KEYS));
        String hb = FingerprintHasher.hash(FingerprintHasher.project(b, KEYS));
        assertEquals(ha, hb);
        assertTrue(ha.matches("[0-9a-f]{16}"), ha);
    }

    @Test
    @DisplayName("fields outside the projection do not move the hash")
    void projectionIgnoresExtraFields() {
        Map<String, Object> a = Map.of("origin", "x", "purpose", "y", "integrityScore", 100);
        Map<String, Object> b = Map.of("origin", "x", "purpose", "y", "integrityScore", 40);
        assertEquals(FingerprintHasher.hash(FingerprintHasher.project(a, KEYS)),
                     FingerprintHasher.hash(FingerprintHasher.project(b, KEYS)));
    }

    @Test
    @DisplayName("a projected field disappearing changes the hash")
    void missingFieldChangesHash() {
        Map<String, Object> full = Map.of("origin", "x", "purpose", "y");
        Map<String, Object> partial = Map.of("origin", "x");
        assertNotEquals(FingerprintHasher.hash(FingerprintHasher.project(full, KEYS)),
                        FingerprintHasher.hash(FingerprintHasher.project(partial, KEYS)));
    }
}
