package com.alertrelay.pipeline.notify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one {@link NotifyDriver#send} call. Delivery failures are
 * values, not exceptions.
 *
 * @since 1.0.0
 */
public final class SendResult {

    private final boolean success;
    private final String messageId;
    private final String error;
    private final Map<String, Object> metadata;

    private SendResult(boolean success, String messageId, String error, Map<String, Object> metadata) {
        this.success = success;
        this.messageId = messageId;
        this.error = error;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    public static SendResult ok(String messageId, Map<String, Object> metadata) {
        return new SendResult(true, messageId, null, metadata);
    }

    public static SendResult failed(String error) {
        return new SendResult(false, null, error, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessageId() {
        return messageId;
    }

    public String getError() {
        return error;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return success
                ? "SendResult{success, messageId='" + messageId + "'}"
                : "SendResult{failed, error='" + error + "'}";
    }
}
