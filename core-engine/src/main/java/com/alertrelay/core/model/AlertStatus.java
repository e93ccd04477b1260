package com.alertrelay.core.model;

import java.util.Locale;

/**
 * Lifecycle status of a single alert.
 *
 * @since 1.0.0
 */
public enum AlertStatus {

    FIRING("firing"),
    RESOLVED("resolved");

    private final String value;

    AlertStatus(String value) {
        this.value = value;
    }

    /**
     * @return lowercase wire value ({@code firing} / {@code resolved})
     */
    public String value() {
        return value;
    }

    /**
     * Coerce a free-form status string into an {@link AlertStatus}.
     *
     * <p>
     * Anything other than {@code resolved} (case-insensitive) is treated as
     * {@link #FIRING}, including {@code null}.
     * </p>
     *
     * @param raw raw status value, may be {@code null}
     * @return normalized status, never {@code null}
     */
    public static AlertStatus normalize(String raw) {
        if (raw != null && RESOLVED.value.equals(raw.trim().toLowerCase(Locale.ROOT))) {
            return RESOLVED;
        }
        return FIRING;
    }

    @Override
    public String toString() {
        return value;
    }
}
