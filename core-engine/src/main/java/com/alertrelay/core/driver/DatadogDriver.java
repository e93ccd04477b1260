package com.alertrelay.core.driver;

import com.alertrelay.core.model.NormalizedAlert;
import com.alertrelay.core.model.NormalizedPayload;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Datadog monitor webhook driver.
 *
 * <p>
 * Datadog posts one flat object per monitor event. Tags arrive either as a
 * comma separated string or as a list; {@code key:value} tags become labels
 * and bare tags become {@code tag=true}.
 * </p>
 *
 * @since 1.0.0
 */
public class DatadogDriver extends AbstractSourceDriver {

    public static final String NAME = "datadog";

    private static final Set<String> CRITICAL_PRIORITIES = Set.of("p1", "high", "critical");
    private static final Set<String> INFO_PRIORITIES = Set.of("p3", "p4", "low", "info");

    public DatadogDriver(Clock clock) {
        super(NAME, "Datadog", clock);
    }

    @Override
    protected boolean accepts(PayloadView payload) {
        if (payload.isObject("org")) {
            return true;
        }
        return payload.hasAny("alert_id", "alert_status", "alert_type", "alert_transition");
    }

    @Override
    protected NormalizedPayload parseValid(PayloadView payload) {
        return payloadOf(name(), payload)
                .externalUrl(payload.string("url", ""))
                .alert(parseAlert(payload))
                .build();
    }

    private NormalizedAlert parseAlert(PayloadView payload) {
        String alertName = payload.string("alert_title")
                .orElseGet(() -> payload.string("title", "Datadog Alert"));

        String transition = lower(payload.string("alert_transition", ""));
        String alertStatus = lower(payload.string("alert_status", ""));
        boolean resolved = "recovered".equals(transition) || "resolved".equals(transition)
                || "ok".equals(alertStatus) || "recovered".equals(alertStatus);

        String alertType = lower(payload.string("alert_type", ""));
        String priority = lower(payload.string("priority", ""));
        String severity = "warning";
        if ("error".equals(alertType) || CRITICAL_PRIORITIES.contains(priority)) {
            severity = "critical";
        } else if (INFO_PRIORITIES.contains(priority)) {
            severity = "info";
        }

        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("alertname", alertName);
        for (String tag : tags(payload)) {
            int colon = tag.indexOf(':');
            if (colon >= 0) {
                labels.put(tag.substring(0, colon), tag.substring(colon + 1));
            } else {
                labels.put(tag, "true");
            }
        }
        payload.text("hostname").ifPresent(h -> labels.put("hostname", h));
        payload.text("alert_metric").ifPresent(m -> labels.put("metric", m));
        payload.text("alert_id").ifPresent(id -> labels.put("alert_id", id));

        String nativeId = payload.text("alert_id").or(() -> payload.text("id")).orElse(null);

        return NormalizedAlert.builder()
                .fingerprint(fingerprintOr(nativeId, labels, alertName))
                .name(alertName)
                .status(resolved ? "resolved" : "firing")
                .severity(severity)
                .description(payload.string("event_msg").orElseGet(() -> payload.string("body", "")))
                .labels(labels)
                .annotation("url", payload.string("url", ""))
                .startedAt(timestampOrNow(payload.get("last_updated").orElse(null)))
                .rawPayload(payload.raw())
                .build();
    }

    private static List<String> tags(PayloadView payload) {
        List<String> tags = new ArrayList<>();
        if (payload.isList("tags")) {
            for (Object tag : payload.list("tags")) {
                if (tag != null && !tag.toString().isBlank()) {
                    tags.add(tag.toString().trim());
                }
            }
        } else {
            for (String tag : payload.string("tags", "").split(",")) {
                if (!tag.isBlank()) {
                    tags.add(tag.trim());
                }
            }
        }
        return tags;
    }
}
