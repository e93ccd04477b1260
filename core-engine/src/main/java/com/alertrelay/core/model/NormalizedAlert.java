package com.alertrelay.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical alert record produced by every source driver.
 *
 * <p>
 * Status and severity are normalized when the record is built: a raw status
 * other than {@code resolved} becomes {@link AlertStatus#FIRING} and an
 * unrecognized severity becomes {@link AlertSeverity#WARNING}. A built
 * instance never carries a raw, un-normalized value.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code fingerprint}, {@code name} and
 * {@code startedAt} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class NormalizedAlert {

    private final String fingerprint;
    private final String name;
    private final AlertStatus status;
    private final AlertSeverity severity;
    private final String description;
    private final Map<String, String> labels;
    private final Map<String, String> annotations;
    private final Instant startedAt;
    private final Instant endedAt;
    private final Map<String, Object> rawPayload;

    private NormalizedAlert(Builder builder) {
        this.fingerprint = Objects.requireNonNull(builder.fingerprint, "fingerprint must not be null");
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.startedAt = Objects.requireNonNull(builder.startedAt, "startedAt must not be null");
        this.status = AlertStatus.normalize(builder.status);
        this.severity = AlertSeverity.normalize(builder.severity);
        this.description = builder.description != null ? builder.description : "";
        this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(builder.labels));
        this.annotations = Collections.unmodifiableMap(new LinkedHashMap<>(builder.annotations));
        this.endedAt = builder.endedAt;
        this.rawPayload = Collections.unmodifiableMap(new LinkedHashMap<>(builder.rawPayload));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link NormalizedAlert}.
     */
    public static class Builder {
        private String fingerprint;
        private String name;
        private String status;
        private String severity;
        private String description;
        private final Map<String, String> labels = new LinkedHashMap<>();
        private final Map<String, String> annotations = new LinkedHashMap<>();
        private Instant startedAt;
        private Instant endedAt;
        private final Map<String, Object> rawPayload = new LinkedHashMap<>();

        public Builder fingerprint(String fingerprint) {
            this.fingerprint = fingerprint;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status != null ? status.value() : null;
            return this;
        }

        public Builder severity(String severity) {
            this.severity = severity;
            return this;
        }

        public Builder severity(AlertSeverity severity) {
            this.severity = severity != null ? severity.value() : null;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder labels(Map<String, String> labels) {
            if (labels != null) {
                this.labels.putAll(labels);
            }
            return this;
        }

        public Builder label(String key, String value) {
            this.labels.put(key, value);
            return this;
        }

        public Builder annotations(Map<String, String> annotations) {
            if (annotations != null) {
                this.annotations.putAll(annotations);
            }
            return this;
        }

        public Builder annotation(String key, String value) {
            this.annotations.put(key, value);
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder endedAt(Instant endedAt) {
            this.endedAt = endedAt;
            return this;
        }

        public Builder rawPayload(Map<String, Object> rawPayload) {
            if (rawPayload != null) {
                this.rawPayload.putAll(rawPayload);
            }
            return this;
        }

        /**
         * @return a new, normalized {@link NormalizedAlert}
         * @throws NullPointerException if a required field is missing
         */
        public NormalizedAlert build() {
            return new NormalizedAlert(this);
        }
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getName() {
        return name;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public Map<String, String> getAnnotations() {
        return annotations;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    /**
     * @return end time, or {@code null} while the alert is still firing
     */
    public Instant getEndedAt() {
        return endedAt;
    }

    public Map<String, Object> getRawPayload() {
        return rawPayload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NormalizedAlert that))
            return false;
        return fingerprint.equals(that.fingerprint)
                && status == that.status
                && startedAt.equals(that.startedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fingerprint, status, startedAt);
    }

    @Override
    public String toString() {
        return "NormalizedAlert{" +
                "fingerprint='" + fingerprint + '\'' +
                ", name='" + name + '\'' +
                ", status=" + status +
                ", severity=" + severity +
                ", startedAt=" + startedAt +
                '}';
    }
}
