package com.alertrelay.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of parsing one webhook delivery: the ordered alerts it carried plus
 * passthrough metadata from the source envelope.
 *
 * @since 1.0.0
 */
public final class NormalizedPayload {

    private final List<NormalizedAlert> alerts;
    private final String source;
    private final String version;
    private final String groupKey;
    private final String receiver;
    private final String externalUrl;
    private final Map<String, Object> rawPayload;

    private NormalizedPayload(Builder builder) {
        this.source = Objects.requireNonNull(builder.source, "source must not be null");
        this.alerts = List.copyOf(builder.alerts);
        this.version = nullToEmpty(builder.version);
        this.groupKey = nullToEmpty(builder.groupKey);
        this.receiver = nullToEmpty(builder.receiver);
        this.externalUrl = nullToEmpty(builder.externalUrl);
        this.rawPayload = Collections.unmodifiableMap(new LinkedHashMap<>(builder.rawPayload));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<NormalizedAlert> alerts = new ArrayList<>();
        private String source;
        private String version;
        private String groupKey;
        private String receiver;
        private String externalUrl;
        private final Map<String, Object> rawPayload = new LinkedHashMap<>();

        public Builder alert(NormalizedAlert alert) {
            this.alerts.add(Objects.requireNonNull(alert, "alert must not be null"));
            return this;
        }

        public Builder alerts(List<NormalizedAlert> alerts) {
            if (alerts != null) {
                alerts.forEach(this::alert);
            }
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder groupKey(String groupKey) {
            this.groupKey = groupKey;
            return this;
        }

        public Builder receiver(String receiver) {
            this.receiver = receiver;
            return this;
        }

        public Builder externalUrl(String externalUrl) {
            this.externalUrl = externalUrl;
            return this;
        }

        public Builder rawPayload(Map<String, Object> rawPayload) {
            if (rawPayload != null) {
                this.rawPayload.putAll(rawPayload);
            }
            return this;
        }

        public NormalizedPayload build() {
            return new NormalizedPayload(this);
        }
    }

    public List<NormalizedAlert> getAlerts() {
        return alerts;
    }

    /**
     * @return name of the driver (or caller-declared source) that produced the payload
     */
    public String getSource() {
        return source;
    }

    public String getVersion() {
        return version;
    }

    public String getGroupKey() {
        return groupKey;
    }

    public String getReceiver() {
        return receiver;
    }

    public String getExternalUrl() {
        return externalUrl;
    }

    public Map<String, Object> getRawPayload() {
        return rawPayload;
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }

    @Override
    public String toString() {
        return "NormalizedPayload{source='" + source + "', alerts=" + alerts.size() + '}';
    }
}
