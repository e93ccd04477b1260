package com.alertrelay.core.driver;

import com.alertrelay.core.model.NormalizedAlert;
import com.alertrelay.core.model.NormalizedPayload;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Prometheus Alertmanager webhook driver.
 *
 * <p>
 * Recognized by the {@code alerts} and {@code status} keys together with at
 * least one of {@code groupKey}, {@code receiver}, {@code groupLabels} or
 * {@code commonLabels}. Each entry in {@code alerts} becomes one normalized
 * alert; the native {@code fingerprint} is kept when present.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertmanagerDriver extends AbstractSourceDriver {

    public static final String NAME = "alertmanager";

    public AlertmanagerDriver(Clock clock) {
        super(NAME, "AlertManager", clock);
    }

    @Override
    protected boolean accepts(PayloadView payload) {
        return payload.has("alerts") && payload.has("status")
                && payload.hasAny("groupKey", "receiver", "groupLabels", "commonLabels");
    }

    @Override
    protected NormalizedPayload parseValid(PayloadView payload) {
        NormalizedPayload.Builder result = payloadOf(name(), payload)
                .version(payload.string("version", ""))
                .groupKey(payload.string("groupKey", ""))
                .receiver(payload.string("receiver", ""))
                .externalUrl(payload.string("externalURL", ""));
        for (PayloadView alert : payload.objects("alerts")) {
            result.alert(parseAlert(alert));
        }
        return result.build();
    }

    private NormalizedAlert parseAlert(PayloadView alert) {
        Map<String, String> labels = alert.stringMap("labels");
        Map<String, String> annotations = alert.stringMap("annotations");
        String alertName = labels.getOrDefault("alertname", "Unknown Alert");

        Instant endedAt = null;
        if (alert.text("endsAt").isPresent()) {
            endedAt = dropFarFuture(timestampOrNow(alert.get("endsAt").orElse(null)));
        }

        String description = annotations.getOrDefault("description", "");
        if (description.isEmpty()) {
            description = annotations.getOrDefault("summary", "");
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
}
