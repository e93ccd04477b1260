package com.alertrelay.pipeline.notify;

import java.util.Locale;

/**
 * Severity carried by a {@link NotificationMessage}, ordered by urgency.
 *
 * @since 1.0.0
 */
public enum NotificationSeverity {

    SUCCESS("success", 0),
    INFO("info", 1),
    WARNING("warning", 2),
    CRITICAL("critical", 3);

    private final String value;
    private final int rank;

    NotificationSeverity(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    public String value() {
        return value;
    }

    /**
     * @return the matching severity, {@link #INFO} for anything unrecognized
     */
    public static NotificationSeverity normalize(String raw) {
        if (raw == null) {
            return INFO;
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (NotificationSeverity s : values()) {
            if (s.value.equals(v)) {
                return s;
            }
        }
        return INFO;
    }

    public static NotificationSeverity worse(NotificationSeverity a, NotificationSeverity b) {
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
