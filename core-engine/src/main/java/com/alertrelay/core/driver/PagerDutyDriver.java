package com.alertrelay.core.driver;

import com.alertrelay.core.model.NormalizedAlert;
import com.alertrelay.core.model.NormalizedPayload;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PagerDuty webhook driver for V3 events and legacy V2 messages.
 *
 * <p>
 * The PagerDuty incident id is used as the fingerprint so that trigger and
 * resolve events for one incident land on the same alert row.
 * </p>
 *
 * @since 1.0.0
 */
public class PagerDutyDriver extends AbstractSourceDriver {

    public static final String NAME = "pagerduty";

    private static final String DEFAULT_TITLE = "PagerDuty Incident";

    public PagerDutyDriver(Clock clock) {
        super(NAME, "PagerDuty", clock);
    }

    @Override
    protected boolean accepts(PayloadView payload) {
        if (payload.has("event")) {
            PayloadView event = payload.object("event");
            return event.has("event_type") && event.has("resource_type");
        }
        if (payload.has("messages")) {
            List<Object> messages = payload.list("messages");
            if (!messages.isEmpty()) {
                PayloadView first = PayloadView.of(messages.get(0));
                return first.has("incident") || first.has("type");
            }
        }
        return false;
    }

    @Override
    protected NormalizedPayload parseValid(PayloadView payload) {
        NormalizedPayload.Builder result = payloadOf(name(), payload);
        if (payload.has("event")) {
            result.alert(parseV3(payload.object("event")));
        } else {
            for (PayloadView message : payload.objects("messages")) {
                result.alert(parseV2(message));
            }
        }
        return result.build();
    }

    private NormalizedAlert parseV3(PayloadView event) {
        PayloadView data = event.object("data");
        String eventType = event.string("event_type", "");
        boolean resolved = eventType.contains("resolved") || eventType.contains("acknowledged");
        String alertName = data.string("title", DEFAULT_TITLE);

        String urgency = data.string("urgency", "high");
        String severity = "high".equals(urgency) ? "critical" : "warning";
        PayloadView priority = data.object("priority");
        if (!priority.isEmpty()) {
            String priorityName = lower(priority.string("name", ""));
            if (priorityName.contains("p1") || priorityName.contains("critical")) {
                severity = "critical";
            } else if (priorityName.contains("p3") || priorityName.contains("low")) {
                severity = "info";
            }
        }

        PayloadView service = data.object("service");
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("alertname", alertName);
        labels.put("incident_id", data.string("id", ""));
        labels.put("incident_number", data.string("number", ""));
        labels.put("service_id", service.string("id", ""));
        labels.put("service_name", service.string("summary", ""));
        labels.put("urgency", urgency);

        return NormalizedAlert.builder()
                .fingerprint(fingerprintOr(data.text("id").orElse(null), labels, alertName))
                .name(alertName)
                .status(resolved ? "resolved" : "firing")
                .severity(severity)
                .description(data.string("description", ""))
                .labels(labels)
                .annotation("html_url", data.string("html_url", ""))
                .startedAt(timestampOrNow(event.get("occurred_at").orElse(null)))
                .rawPayload(event.raw())
                .build();
    }

    private NormalizedAlert parseV2(PayloadView message) {
        PayloadView incident = message.object("incident");
        boolean resolved = message.string("type", "").contains("resolve");
        String alertName = incident.object("trigger_summary_data").string("subject")
                .orElseGet(() -> incident.string("title", DEFAULT_TITLE));

        String urgency = incident.string("urgency", "high");

        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("alertname", alertName);
        labels.put("incident_id", incident.string("id", ""));
        labels.put("incident_number", incident.string("incident_number", ""));
        labels.put("service_name", incident.object("service").string("name", ""));

        return NormalizedAlert.builder()
                .fingerprint(fingerprintOr(incident.text("id").orElse(null), labels, alertName))
                .name(alertName)
                .status(resolved ? "resolved" : "firing")
                .severity("high".equals(urgency) ? "critical" : "warning")
                .description(incident.string("description", ""))
                .labels(labels)
                .startedAt(timestampOrNow(incident.get("created_on").orElse(null)))
                .rawPayload(message.raw())
                .build();
    }
}
