package com.alertrelay.core.model;

/**
 * Status of an {@link Incident}.
 *
 * <p>
 * {@link #OPEN} and {@link #ACKNOWLEDGED} are the <em>active</em> states: new
 * alerts may still be attached and the auto-resolution sweep considers them.
 * </p>
 *
 * @since 1.0.0
 */
public enum IncidentStatus {

    OPEN("open"),
    ACKNOWLEDGED("acknowledged"),
    RESOLVED("resolved"),
    CLOSED("closed");

    private final String value;

    IncidentStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isActive() {
        return this == OPEN || this == ACKNOWLEDGED;
    }

    @Override
    public String toString() {
        return value;
    }
}
