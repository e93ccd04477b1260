package com.alertrelay.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only audit entry for one alert. Instances are immutable once built.
 *
 * @since 1.0.0
 */
public final class AlertHistory {

    public static final String CREATED = "created";
    public static final String SEVERITY_CHANGED = "severity_changed";
    public static final String RESOLVED = "resolved";

    private final Long id;
    private final long alertId;
    private final String event;
    private final String oldStatus;
    private final String newStatus;
    private final Map<String, Object> details;
    private final Instant createdAt;

    public AlertHistory(Long id, long alertId, String event, String oldStatus, String newStatus,
            Map<String, Object> details, Instant createdAt) {
        this.id = id;
        this.alertId = alertId;
        this.event = Objects.requireNonNull(event, "event must not be null");
        this.oldStatus = oldStatus != null ? oldStatus : "";
        this.newStatus = newStatus != null ? newStatus : "";
        this.details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Collections.emptyMap();
        this.createdAt = createdAt;
    }

    /**
     * @return a copy of this entry carrying the store-assigned id and timestamp
     */
    public AlertHistory withIdentity(long newId, Instant newCreatedAt) {
        return new AlertHistory(newId, alertId, event, oldStatus, newStatus, details, newCreatedAt);
    }

    public Long getId() {
        return id;
    }

    public long getAlertId() {
        return alertId;
    }

    public String getEvent() {
        return event;
    }

    public String getOldStatus() {
        return oldStatus;
    }

    public String getNewStatus() {
        return newStatus;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "AlertHistory{alertId=" + alertId + ", event='" + event + "', "
                + oldStatus + " -> " + newStatus + '}';
    }
}
