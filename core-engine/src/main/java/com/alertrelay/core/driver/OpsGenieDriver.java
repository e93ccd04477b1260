package com.alertrelay.core.driver;

import com.alertrelay.core.model.NormalizedAlert;
import com.alertrelay.core.model.NormalizedPayload;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * OpsGenie webhook driver.
 *
 * <p>
 * The webhook {@code action} decides the status: closing, acknowledging,
 * resolving or deleting an alert all count as resolved. Priority tiers map
 * P1/P2 to critical, P3 to warning and P4/P5 to info.
 * </p>
 *
 * @since 1.0.0
 */
public class OpsGenieDriver extends AbstractSourceDriver {

    public static final String NAME = "opsgenie";

    private static final Set<String> RESOLVED_ACTIONS = Set.of("close", "acknowledge", "ack", "resolve", "delete");

    private static final Map<String, String> PRIORITY_MAP = Map.of(
            "P1", "critical",
            "P2", "critical",
            "P3", "warning",
            "P4", "info",
            "P5", "info");

    public OpsGenieDriver(Clock clock) {
        super(NAME, "OpsGenie", clock);
    }

    @Override
    protected boolean accepts(PayloadView payload) {
        if (payload.has("alert") && payload.has("action")) {
            return payload.object("alert").hasAny("alertId", "tinyId");
        }
        return payload.has("integrationId") && payload.has("integrationName");
    }

    @Override
    protected NormalizedPayload parseValid(PayloadView payload) {
        return payloadOf(name(), payload)
                .alert(parseAlert(payload))
                .build();
    }

    private NormalizedAlert parseAlert(PayloadView payload) {
        PayloadView alert = payload.object("alert");
        String action = lower(payload.string("action", ""));
        String alertName = alert.string("message", "OpsGenie Alert");
        String priority = upper(alert.string("priority", "P3"));

        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("alertname", alertName);
        for (Object tag : alert.list("tags")) {
            if (tag instanceof String s) {
                int colon = s.indexOf(':');
                if (colon >= 0) {
                    labels.put(s.substring(0, colon), s.substring(colon + 1));
                } else {
                    labels.put("tag_" + s, "true");
                }
            }
        }
        labels.put("alert_id", alert.string("alertId", ""));
        labels.put("tiny_id", alert.string("tinyId", ""));
        labels.put("priority", priority);
        for (String key : new String[] {"entity", "alias", "team", "source"}) {
            alert.text(key).ifPresent(v -> labels.put(key, v));
        }

        Map<String, String> annotations = new LinkedHashMap<>();
        annotations.put("action", action);
        annotations.put("username", alert.string("username", ""));

        String nativeId = alert.text("alertId").or(() -> alert.text("alias")).orElse(null);

        return NormalizedAlert.builder()
                .fingerprint(fingerprintOr(nativeId, labels, alertName))
                .name(alertName)
                .status(RESOLVED_ACTIONS.contains(action) ? "resolved" : "firing")
                .severity(PRIORITY_MAP.getOrDefault(priority, "warning"))
                .description(alert.string("description", ""))
                .labels(labels)
                .annotations(annotations)
                .startedAt(timestampOrNow(alert.get("createdAt").orElse(null)))
                .rawPayload(payload.raw())
                .build();
    }
}
