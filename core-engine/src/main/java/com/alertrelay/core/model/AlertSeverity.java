package com.alertrelay.core.model;

import java.util.Locale;

/**
 * Canonical alert severity with an ordinal rank used when merging alerts into
 * an incident: critical(3) &gt; warning(2) &gt; info(1).
 *
 * @since 1.0.0
 */
public enum AlertSeverity {

    CRITICAL("critical", 3),
    WARNING("warning", 2),
    INFO("info", 1);

    private final String value;
    private final int rank;

    AlertSeverity(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    public String value() {
        return value;
    }

    public int rank() {
        return rank;
    }

    /**
     * Coerce a free-form severity string. Unrecognized or {@code null} input
     * becomes {@link #WARNING}.
     *
     * @param raw raw severity value
     * @return normalized severity, never {@code null}
     */
    public static AlertSeverity normalize(String raw) {
        if (raw == null) {
            return WARNING;
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (AlertSeverity s : values()) {
            if (s.value.equals(v)) {
                return s;
            }
        }
        return WARNING;
    }

    /**
     * @return {@code true} if {@code raw} is exactly one of the canonical values
     */
    public static boolean isCanonical(String raw) {
        if (raw == null) {
            return false;
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        return CRITICAL.value.equals(v) || WARNING.value.equals(v) || INFO.value.equals(v);
    }

    /**
     * Return the worse (higher ranked) of two severities.
     *
     * @param a first severity, may be {@code null}
     * @param b second severity, may be {@code null}
     * @return the severity with the higher rank; {@code a} on ties
     */
    public static AlertSeverity worse(AlertSeverity a, AlertSeverity b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return b.rank > a.rank ? b : a;
    }

    @Override
    public String toString() {
        return value;
    }
}
