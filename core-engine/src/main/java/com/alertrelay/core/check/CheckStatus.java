package com.alertrelay.core.check;

import java.util.Locale;

/**
 * Outcome of a single health check, ordered from best to worst for
 * aggregation purposes.
 *
 * @since 1.0.0
 */
public enum CheckStatus {

    OK("ok", 0),
    UNKNOWN("unknown", 1),
    WARNING("warning", 2),
    CRITICAL("critical", 3);

    private final String value;
    private final int weight;

    CheckStatus(String value, int weight) {
        this.value = value;
        this.weight = weight;
    }

    public String value() {
        return value;
    }

    /**
     * @return {@code raw} as a status, {@link #UNKNOWN} when unrecognized
     */
    public static CheckStatus fromValue(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (CheckStatus s : values()) {
            if (s.value.equals(v)) {
                return s;
            }
        }
        return UNKNOWN;
    }

    public static CheckStatus worse(CheckStatus a, CheckStatus b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return b.weight > a.weight ? b : a;
    }

    @Override
    public String toString() {
        return value;
    }
}
