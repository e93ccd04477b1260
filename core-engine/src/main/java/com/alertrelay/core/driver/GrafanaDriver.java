package com.alertrelay.core.driver;

import com.alertrelay.core.model.NormalizedAlert;
import com.alertrelay.core.model.NormalizedPayload;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Grafana alerting webhook driver.
 *
 * <p>
 * Handles both the unified alerting format (an {@code alerts} array shaped
 * like Alertmanager's) and the legacy dashboard format carrying
 * {@code evalMatches}, {@code ruleName} and a dashboard {@code state}.
 * </p>
 *
 * @since 1.0.0
 */
public class GrafanaDriver extends AbstractSourceDriver {

    public static final String NAME = "grafana";

    public GrafanaDriver(Clock clock) {
        super(NAME, "Grafana", clock);
    }

    @Override
    protected boolean accepts(PayloadView payload) {
        boolean grafanaKeys = payload.hasAny("orgId", "state", "title");
        boolean hasAlerts = payload.hasAny("alerts", "evalMatches");
        return grafanaKeys || (hasAlerts && payload.has("dashboardId"));
    }

    @Override
    protected NormalizedPayload parseValid(PayloadView payload) {
        NormalizedPayload.Builder result = payloadOf(name(), payload)
                .version(payload.string("version", ""))
                .groupKey(payload.string("groupKey", ""))
                .receiver(payload.string("receiver", ""))
                .externalUrl(payload.string("externalURL", ""));
        if (payload.has("alerts")) {
            for (PayloadView alert : payload.objects("alerts")) {
                result.alert(parseUnified(alert));
            }
        } else if (payload.has("evalMatches")) {
            result.alert(parseLegacy(payload));
        }
        return result.build();
    }

    private NormalizedAlert parseUnified(PayloadView alert) {
        Map<String, String> labels = alert.stringMap("labels");
        Map<String, String> annotations = alert.stringMap("annotations");
        String alertName = labels.containsKey("alertname")
                ? labels.get("alertname")
                : alert.string("alertname", "Unknown Alert");

        Instant endedAt = null;
        if (alert.text("endsAt").isPresent()) {
            endedAt = dropFarFuture(timestampOrNow(alert.get("endsAt").orElse(null)));
        }

        String description = annotations.getOrDefault("description", "");
        if (description.isEmpty()) {
            description = annotations.containsKey("summary")
                    ? annotations.get("summary")
                    : alert.string("message", "");
        }

        return NormalizedAlert.builder()
                .fingerprint(fingerprintOr(alert.text("fingerprint").orElse(null), labels, alertName))
                .name(alertName)
                .status(alert.string("status", "firing"))
                .severity(labels.getOrDefault("severity", "warning"))
                .description(description)
                .labels(labels)
                .annotations(annotations)
                .startedAt(timestampOrNow(alert.get("startsAt").orElse(null)))
                .endedAt(endedAt)
                .rawPayload(alert.raw())
                .build();
    }

    private NormalizedAlert parseLegacy(PayloadView payload) {
        String alertName = payload.string("ruleName")
                .orElseGet(() -> payload.string("title", "Unknown Alert"));

        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("alertname", alertName);
        labels.put("ruleId", payload.string("ruleId", ""));
        labels.put("dashboardId", payload.string("dashboardId", ""));
        labels.put("panelId", payload.string("panelId", ""));
        labels.put("orgId", payload.string("orgId", ""));

        String state = payload.string("state", "alerting");
        boolean resolved = "ok".equals(state);
        String severity = "alerting".equals(state) || "critical".equals(state) ? "critical" : "warning";
        Instant now = now();

        return NormalizedAlert.builder()
                .fingerprint(generateFingerprint(labels, alertName))
                .name(alertName)
                .status(resolved ? "resolved" : "firing")
                .severity(severity)
                .description(payload.string("message", ""))
                .labels(labels)
                .annotation("ruleUrl", payload.string("ruleUrl", ""))
                .startedAt(now)
                .endedAt(resolved ? now : null)
                .rawPayload(payload.raw())
                .build();
    }
}
