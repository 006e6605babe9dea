package org.ferry.connect;

import java.util.Locale;

/**
 * Why a connection attempt failed, derived from the driver or tool message.
 */
public enum FailureReason {
    DNS,
    AUTH,
    TIMEOUT,
    REFUSED,
    OTHER;

    public static FailureReason classify(String message) {
        if (message == null) {
            return OTHER;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("unknownhost") || lower.contains("could not translate host")
                || lower.contains("name or service not known") || lower.contains("nodename nor servname")) {
            return DNS;
        }
        if (lower.contains("authentication failed") || lower.contains("no pg_hba.conf")
                || lower.contains("tenant or user not found") || lower.contains("password")) {
            return AUTH;
        }
        if (lower.contains("timed out") || lower.contains("timeout")) {
            return TIMEOUT;
        }
        if (lower.contains("refused")) {
            return REFUSED;
        }
        return OTHER;
    }
}
