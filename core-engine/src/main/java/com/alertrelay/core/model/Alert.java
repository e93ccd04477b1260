package com.alertrelay.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted alert row owned by the lifecycle engine.
 *
 * <p>
 * The pair ({@code fingerprint}, {@code source}) identifies at most one row.
 * Stores hand out copies, so mutating an instance has no effect until it is
 * passed back through {@code AlertStore.updateAlert}.
 * </p>
 *
 * @since 1.0.0
 */
public class Alert {

    /** Store-assigned identifier, {@code null} until first saved. */
    private Long id;

    private String fingerprint;
    private String source;
    private String name;
    private AlertStatus status = AlertStatus.FIRING;
    private AlertSeverity severity = AlertSeverity.WARNING;
    private String description = "";
    private Map<String, String> labels = new LinkedHashMap<>();
    private Map<String, String> annotations = new LinkedHashMap<>();
    private Map<String, Object> rawPayload = new LinkedHashMap<>();
    private Instant startedAt;
    private Instant endedAt;

    /** Stamped by the store on insert. */
    private Instant receivedAt;
    private Instant updatedAt;

    /** Key used to group this alert with others into one incident. */
    private String groupKey;

    private Long incidentId;

    public Alert() {
    }

    /**
     * Build a fresh firing row from a normalized alert.
     *
     * @param normalized parsed alert
     * @param source     driver name of the payload
     * @return unsaved alert row
     */
    public static Alert from(NormalizedAlert normalized, String source) {
        Alert a = new Alert();
        a.fingerprint = normalized.getFingerprint();
        a.source = source;
        a.name = normalized.getName();
        a.status = normalized.getStatus();
        a.severity = normalized.getSeverity();
        a.description = normalized.getDescription();
        a.labels = new LinkedHashMap<>(normalized.getLabels());
        a.annotations = new LinkedHashMap<>(normalized.getAnnotations());
        a.rawPayload = new LinkedHashMap<>(normalized.getRawPayload());
        a.startedAt = normalized.getStartedAt();
        a.endedAt = normalized.getEndedAt();
        return a;
    }

    /**
     * @return deep-enough copy: maps are copied, values are shared
     */
    public Alert copy() {
        Alert a = new Alert();
        a.id = id;
        a.fingerprint = fingerprint;
        a.source = source;
        a.name = name;
        a.status = status;
        a.severity = severity;
        a.description = description;
        a.labels = new LinkedHashMap<>(labels);
        a.annotations = new LinkedHashMap<>(annotations);
        a.rawPayload = new LinkedHashMap<>(rawPayload);
        a.startedAt = startedAt;
        a.endedAt = endedAt;
        a.receivedAt = receivedAt;
        a.updatedAt = updatedAt;
        a.groupKey = groupKey;
        a.incidentId = incidentId;
        return a;
    }

    public boolean isFiring() {
        return status == AlertStatus.FIRING;
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

    public String getFingerprint() {
        return fingerprint;
    }

    public void setFingerprint(String fingerprint) {
        this.fingerprint = fingerprint;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public void setStatus(AlertStatus status) {
        this.status = status;
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

    public Map<String, String> getLabels() {
        return labels;
    }

    public void setLabels(Map<String, String> labels) {
        this.labels = labels != null ? new LinkedHashMap<>(labels) : new LinkedHashMap<>();
    }

    public Map<String, String> getAnnotations() {
        return annotations;
    }

    public void setAnnotations(Map<String, String> annotations) {
        this.annotations = annotations != null ? new LinkedHashMap<>(annotations) : new LinkedHashMap<>();
    }

    public Map<String, Object> getRawPayload() {
        return rawPayload;
    }

    public void setRawPayload(Map<String, Object> rawPayload) {
        this.rawPayload = rawPayload != null ? new LinkedHashMap<>(rawPayload) : new LinkedHashMap<>();
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public void setEndedAt(Instant endedAt) {
        this.endedAt = endedAt;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    public void setReceivedAt(Instant receivedAt) {
        this.receivedAt = receivedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public String getGroupKey() {
        return groupKey;
    }

    public void setGroupKey(String groupKey) {
        this.groupKey = groupKey;
    }

    public Long getIncidentId() {
        return incidentId;
    }

    public void setIncidentId(Long incidentId) {
        this.incidentId = incidentId;
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id=" + id +
                ", fingerprint='" + fingerprint + '\'' +
                ", source='" + source + '\'' +
                ", status=" + status +
                ", severity=" + severity +
                ", incidentId=" + incidentId +
                '}';
    }
}
