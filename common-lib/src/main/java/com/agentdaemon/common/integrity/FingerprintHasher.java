package com.agentdaemon.common.integrity;

import com.agentdaemon.common.exception.DaemonException;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SHA-256 over the canonical JSON of a fixed projection of a subsystem summary,
 * truncated to 16 hex characters.
 */
public final class FingerprintHasher {

    private static final int HASH_LENGTH = 16;

    private FingerprintHasher() {}

    /**
     * Keeps only {@code keys} from {@code summary}. Missing keys project to {@code null}
     * so a field disappearing still changes the hash.
     */
    public static Map<String, Object> project(Map<String, Object> summary, List<String> keys) {
        Map<String, Object> projection = new LinkedHashMap<>();
        for (String key : keys) {
            projection.put(key, summary != null ? summary.get(key) : null);
        }
        return projection;
    }

    public static String hash(Map<String, Object> projection) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] raw = digest.digest(CanonicalJson.bytes(projection));
            return HexFormat.of().formatHex(raw).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new DaemonException("FingerprintHasher", "SHA-256 unavailable", e);
        }
    }
}
