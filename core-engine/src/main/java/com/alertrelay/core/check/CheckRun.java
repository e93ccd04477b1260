package com.alertrelay.core.check;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Audit record of one checker execution inside a pipeline run.
 *
 * @since 1.0.0
 */
public final class CheckRun {

    private final Long id;
    private final String checkerName;
    private final CheckStatus status;
    private final String message;
    private final Map<String, Object> metrics;
    private final String error;
    private final long durationMs;
    private final String traceId;
    private final Instant createdAt;

    public CheckRun(Long id, String checkerName, CheckStatus status, String message,
            Map<String, Object> metrics, String error, long durationMs, String traceId, Instant createdAt) {
        this.id = id;
        this.checkerName = Objects.requireNonNull(checkerName, "checkerName must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.message = message != null ? message : "";
        this.metrics = metrics != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metrics))
                : Collections.emptyMap();
        this.error = error;
        this.durationMs = durationMs;
        this.traceId = traceId;
        this.createdAt = createdAt;
    }

    public static CheckRun of(CheckResult result, long durationMs, String traceId) {
        return new CheckRun(null, result.getCheckerName(), result.getStatus(), result.getMessage(),
                result.getMetrics(), result.getError(), durationMs, traceId, null);
    }

    public CheckRun withIdentity(long newId, Instant newCreatedAt) {
        return new CheckRun(newId, checkerName, status, message, metrics, error, durationMs, traceId,
                newCreatedAt);
    }

    public Long getId() {
        return id;
    }

    public String getCheckerName() {
        return checkerName;
    }

    public CheckStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getMetrics() {
        return metrics;
    }

    public String getError() {
        return error;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public String getTraceId() {
        return traceId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
