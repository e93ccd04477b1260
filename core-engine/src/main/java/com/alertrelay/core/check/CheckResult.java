package com.alertrelay.core.check;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result returned by a {@link Checker}.
 *
 * <p>
 * {@code error} is set only when the probe itself failed (as opposed to
 * reporting a bad reading).
 * </p>
 *
 * @since 1.0.0
 */
public final class CheckResult {

    private final CheckStatus status;
    private final String message;
    private final Map<String, Object> metrics;
    private final String checkerName;
    private final String error;

    public CheckResult(CheckStatus status, String message, Map<String, Object> metrics,
            String checkerName, String error) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.message = message != null ? message : "";
        this.metrics = metrics != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metrics))
                : Collections.emptyMap();
        this.checkerName = checkerName != null ? checkerName : "";
        this.error = error;
    }

    public static CheckResult of(String checkerName, CheckStatus status, String message) {
        return new CheckResult(status, message, null, checkerName, null);
    }

    public static CheckResult of(String checkerName, CheckStatus status, String message,
            Map<String, Object> metrics) {
        return new CheckResult(status, message, metrics, checkerName, null);
    }

    /**
     * Result used when a checker threw instead of returning.
     */
    public static CheckResult failed(String checkerName, Throwable cause) {
        String text = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new CheckResult(CheckStatus.UNKNOWN, "Check failed: " + text, null, checkerName, text);
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

    public String getCheckerName() {
        return checkerName;
    }

    /**
     * @return probe failure text, or {@code null}
     */
    public String getError() {
        return error;
    }

    public boolean isOk() {
        return status == CheckStatus.OK;
    }

    /**
     * @return plain-map view used in pipeline node output
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status.value());
        map.put("message", message);
        map.put("metrics", new LinkedHashMap<>(metrics));
        map.put("checker_name", checkerName);
        map.put("error", error);
        return map;
    }

    @Override
    public String toString() {
        return "CheckResult{" + checkerName + "=" + status + ", message='" + message + "'}";
    }
}
