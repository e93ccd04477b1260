package com.alertrelay.core.driver;

import com.alertrelay.core.model.NormalizedAlert;
import com.alertrelay.core.model.NormalizedPayload;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Zabbix media-type webhook driver.
 *
 * <p>
 * Zabbix payloads are user-templated, so detection is loose: any two of the
 * usual event/trigger/host keys, or {@code event_source} together with
 * {@code event_value}. Severity accepts both the textual tiers and the
 * numeric 0 to 5 scale.
 * </p>
 *
 * @since 1.0.0
 */
public class ZabbixDriver extends AbstractSourceDriver {

    public static final String NAME = "zabbix";

    private static final Map<String, String> SEVERITY_MAP = Map.ofEntries(
            Map.entry("disaster", "critical"),
            Map.entry("high", "critical"),
            Map.entry("average", "warning"),
            Map.entry("warning", "warning"),
            Map.entry("information", "info"),
            Map.entry("not classified", "info"),
            Map.entry("5", "critical"),
            Map.entry("4", "critical"),
            Map.entry("3", "warning"),
            Map.entry("2", "warning"),
            Map.entry("1", "info"),
            Map.entry("0", "info"));

    public ZabbixDriver(Clock clock) {
        super(NAME, "Zabbix", clock);
    }

    @Override
    protected boolean accepts(PayloadView payload) {
        if (payload.has("event_source") && payload.has("event_value")) {
            return true;
        }
        return payload.countPresent("event_id", "trigger_id", "trigger_name", "trigger_severity", "host_name") >= 2;
    }

    @Override
    protected NormalizedPayload parseValid(PayloadView payload) {
        return payloadOf(name(), payload)
                .externalUrl(payload.string("zabbix_url", ""))
                .alert(parseAlert(payload))
                .build();
    }

    private NormalizedAlert parseAlert(PayloadView payload) {
        String alertName = payload.string("trigger_name")
                .orElseGet(() -> payload.string("event_name", "Zabbix Alert"));

        // 1 = PROBLEM, 0 = OK
        String eventValue = payload.string("event_value", "").trim();
        String triggerStatus = upper(payload.string("trigger_status", ""));
        String eventStatus = upper(payload.string("event_status", ""));
        boolean resolved = "0".equals(eventValue) || "OK".equals(triggerStatus)
                || "RESOLVED".equals(eventStatus) || "OK".equals(eventStatus);

        String rawSeverity = lower(payload.string("trigger_severity")
                .orElseGet(() -> payload.string("event_severity", "")));

        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("alertname", alertName);
        labels.put("host_name", payload.string("host_name", ""));
        labels.put("host_ip", payload.string("host_ip", ""));
        labels.put("trigger_id", payload.string("trigger_id", ""));
        labels.put("event_id", payload.string("event_id", ""));
        payload.text("item_name").ifPresent(v -> labels.put("item_name", v));
        payload.text("host_group").ifPresent(v -> labels.put("host_group", v));

        Object timestamp = payload.text("event_date")
                .<Object>map(date -> (date + " " + payload.string("event_time", "")).trim())
                .orElseGet(() -> payload.get("event_timestamp").orElse(null));

        String nativeId = payload.text("event_id").or(() -> payload.text("trigger_id")).orElse(null);

        String description = payload.string("alert_message")
                .orElseGet(() -> payload.string("event_message", ""));
        if (description.isEmpty() && payload.text("item_name").isPresent() && payload.text("item_value").isPresent()) {
            description = payload.string("item_name", "") + ": " + payload.string("item_value", "");
        }

        Map<String, String> annotations = new LinkedHashMap<>();
        annotations.put("item_value", payload.string("item_value", ""));
        annotations.put("zabbix_url", payload.string("zabbix_url", ""));

        return NormalizedAlert.builder()
                .fingerprint(fingerprintOr(nativeId, labels, alertName))
                .name(alertName)
                .status(resolved ? "resolved" : "firing")
                .severity(SEVERITY_MAP.getOrDefault(rawSeverity, "warning"))
                .description(description)
                .labels(labels)
                .annotations(annotations)
                .startedAt(timestampOrNow(timestamp))
                .rawPayload(payload.raw())
                .build();
    }
}
