package com.alertrelay.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A grouping of related alerts with its own lifecycle.
 *
 * <p>
 * Attached alerts reference the incident through {@link Alert#getIncidentId()};
 * the incident itself holds no alert list. {@code metadata} carries operator
 * annotations such as {@code notes}, {@code acknowledged_by} and
 * {@code resolved_by}.
 * </p>
 *
 * @since 1.0.0
 */
public class Incident {

    private Long id;
    private String title;
    private AlertSeverity severity = AlertSeverity.WARNING;
    private String description = "";
    private String summary = "";
    private IncidentStatus status = IncidentStatus.OPEN;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant acknowledgedAt;
    private Instant resolvedAt;
    private Instant closedAt;
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public Incident() {
    }

    public Incident copy() {
        Incident i = new Incident();
        i.id = id;
        i.title = title;
        i.severity = severity;
        i.description = description;
        i.summary = summary;
        i.status = status;
        i.createdAt = createdAt;
        i.updatedAt = updatedAt;
        i.acknowledgedAt = acknowledgedAt;
        i.resolvedAt = resolvedAt;
        i.closedAt = closedAt;
        i.metadata = copyMetadata(metadata);
        return i;
    }

    private static Map<String, Object> copyMetadata(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, v instanceof List<?> list ? new ArrayList<>(list) : v));
        return copy;
    }

    public boolean isActive() {
        return status != null && status.isActive();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public void setSeverity(AlertSeverity severity) {
        this.severity = severity;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public IncidentStatus getStatus() {
        return status;
    }

    public void setStatus(IncidentStatus status) {
        this.status = status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    public void setAcknowledgedAt(Instant acknowledgedAt) {
        this.acknowledgedAt = acknowledgedAt;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public void setResolvedAt(Instant resolvedAt) {
        this.resolvedAt = resolvedAt;
    }

    public Instant getClosedAt() {
        return closedAt;
    }

    public void setClosedAt(Instant closedAt) {
        this.closedAt = closedAt;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "Incident{" +
                "id=" + id +
                ", title='" + title + '\'' +
                ", severity=" + severity +
                ", status=" + status +
                '}';
    }
}
