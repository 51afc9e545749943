package com.agentdaemon.common.continuity;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the evolution counter from a version string such as {@code v0.12}.
 * The counter is the trailing run of digits; anything unparseable counts as 0.
 */
public final class EvolutionVersion {

    private static final Pattern TRAILING_DIGITS = Pattern.compile("(\\d+)\\s*$");

    private EvolutionVersion() {}

    public static long counter(String version) {
        if (version == null) {
            return 0L;
        }
        Matcher m = TRAILING_DIGITS.matcher(version);
        if (!m.find()) {
            return 0L;
        }
        try {
            return Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
