package com.alertrelay.core.driver;

import com.alertrelay.core.model.AlertSeverity;
import com.alertrelay.core.model.NormalizedAlert;
import com.alertrelay.core.model.NormalizedPayload;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Catch-all driver for custom integrations.
 *
 * <p>
 * Accepts either an {@code alerts} list or a single alert object carrying a
 * {@code name}, {@code alert_name}, {@code title} or {@code alertname}. Field
 * names are tolerated broadly: {@code status} or {@code state},
 * {@code severity} or {@code priority}/{@code level}. When the primary field is
 * missing or unrecognized the value is inferred from the secondary ones.
 * </p>
 *
 * <p>
 * The payload's own {@code source} field, when present, replaces the driver
 * name as the persisted source.
 * </p>
 *
 * @since 1.0.0
 */
public class GenericWebhookDriver extends AbstractSourceDriver {

    public static final String NAME = "generic";

    private static final Set<String> RESOLVED_STATES = Set.of("ok", "resolved", "normal");
    private static final Set<String> CRITICAL_PRIORITIES = Set.of("high", "critical", "p1");
    private static final Set<String> CRITICAL_LEVELS = Set.of("error", "critical");
    private static final Set<String> INFO_PRIORITIES = Set.of("low", "p3", "p4");
    private static final Set<String> INFO_LEVELS = Set.of("info", "debug");

    public GenericWebhookDriver(Clock clock) {
        super(NAME, "generic webhook", clock);
    }

    @Override
    protected boolean accepts(PayloadView payload) {
        return payload.isList("alerts") || payload.hasAny("name", "alert_name", "title", "alertname");
    }

    @Override
    protected NormalizedPayload parseValid(PayloadView payload) {
        NormalizedPayload.Builder result = payloadOf(payload.text("source").orElse(name()), payload)
                .version(payload.string("version", ""))
                .groupKey(payload.firstText("group_key", "groupKey").orElse(""))
                .receiver(payload.string("receiver", ""))
                .externalUrl(payload.firstText("external_url", "externalURL").orElse(""));
        if (payload.isList("alerts")) {
            for (PayloadView alert : payload.objects("alerts")) {
                result.alert(parseAlert(alert));
            }
        } else {
            result.alert(parseAlert(payload));
        }
        return result.build();
    }

    private NormalizedAlert parseAlert(PayloadView alert) {
        String alertName = alert.firstText("name", "alert_name", "title", "alertname").orElse("Unknown Alert");
        Map<String, String> labels = alert.stringMap("labels");
        String status = status(alert);

        Instant endedAt = null;
        if ("resolved".equals(status)) {
            endedAt = timestampOrNow(alert.firstValue("ended_at", "endsAt", "resolved_at").orElse(null));
        }

        return NormalizedAlert.builder()
                .fingerprint(fingerprintOr(alert.text("fingerprint").orElse(null), labels, alertName))
                .name(alertName)
                .status(status)
                .severity(severity(alert))
                .description(alert.firstText("description", "message", "summary", "text").orElse(""))
                .labels(labels)
                .annotations(alert.stringMap("annotations"))
                .startedAt(timestampOrNow(
                        alert.firstValue("started_at", "startsAt", "timestamp", "time").orElse(null)))
                .endedAt(endedAt)
                .rawPayload(alert.raw())
                .build();
    }

    private static String status(PayloadView alert) {
        boolean hasStatus = alert.get("status").isPresent();
        String state = lower(alert.string("state", ""));
        String status;
        if (!hasStatus && alert.get("state").isPresent()) {
            status = state;
        } else {
            status = lower(alert.text("status").orElse("firing"));
        }
        if ("firing".equals(status) || "resolved".equals(status)) {
            return status;
        }
        return RESOLVED_STATES.contains(state) ? "resolved" : "firing";
    }

    private static String severity(PayloadView alert) {
        String priority = lower(alert.string("priority", ""));
        String level = lower(alert.string("level", ""));
        String severity;
        if (alert.get("severity").isPresent()) {
            severity = lower(alert.text("severity").orElse(""));
        } else if (!priority.isEmpty()) {
            severity = priority;
        } else {
            severity = level;
        }
        if (AlertSeverity.isCanonical(severity)) {
            return severity;
        }
        if (CRITICAL_PRIORITIES.contains(priority) || CRITICAL_LEVELS.contains(level)) {
            return "critical";
        }
        if (INFO_PRIORITIES.contains(priority) || INFO_LEVELS.contains(level)) {
            return "info";
        }
        return "warning";
    }
}
