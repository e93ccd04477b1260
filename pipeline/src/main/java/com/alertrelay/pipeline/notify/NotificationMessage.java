package com.alertrelay.pipeline.notify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable message handed to a {@link NotifyDriver}.
 *
 * @since 1.0.0
 */
public final class NotificationMessage {

    private final String title;
    private final String message;
    private final NotificationSeverity severity;
    private final String channel;
    private final Map<String, String> tags;
    private final Map<String, Object> context;

    private NotificationMessage(Builder b) {
        this.title = b.title;
        this.message = b.message;
        this.severity = b.severity;
        this.channel = b.channel;
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(b.tags));
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(b.context));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a copy addressed to {@code channelName}
     */
    public NotificationMessage forChannel(String channelName) {
        Builder b = new Builder()
                .title(title)
                .message(message)
                .severity(severity)
                .channel(channelName);
        b.tags.putAll(tags);
        b.context.putAll(context);
        return b.build();
    }

    public String getTitle() {
        return title;
    }

    public String getMessage() {
        return message;
    }

    public NotificationSeverity getSeverity() {
        return severity;
    }

    public String getChannel() {
        return channel;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public static final class Builder {
        private String title = "";
        private String message = "";
        private NotificationSeverity severity = NotificationSeverity.INFO;
        private String channel = "default";
        private final Map<String, String> tags = new LinkedHashMap<>();
        private final Map<String, Object> context = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder title(String title) {
            this.title = title != null ? title : "";
            return this;
        }

        public Builder message(String message) {
            this.message = message != null ? message : "";
            return this;
        }

        public Builder severity(NotificationSeverity severity) {
            this.severity = severity != null ? severity : NotificationSeverity.INFO;
            return this;
        }

        /**
         * Free-form severity; anything unrecognized becomes {@code info}.
         */
        public Builder severity(String severity) {
            this.severity = NotificationSeverity.normalize(severity);
            return this;
        }

        public Builder channel(String channel) {
            this.channel = channel != null && !channel.isBlank() ? channel : "default";
            return this;
        }

        public Builder tag(String key, String value) {
            if (value != null) {
                this.tags.put(key, value);
            }
            return this;
        }

        public Builder context(String key, Object value) {
            this.context.put(key, value);
            return this;
        }

        public NotificationMessage build() {
            return new NotificationMessage(this);
        }
    }

    @Override
    public String toString() {
        return "NotificationMessage{" +
                "title='" + title + '\'' +
                ", severity=" + severity +
                ", channel='" + channel + '\'' +
                '}';
    }
}
