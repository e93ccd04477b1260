package com.alertrelay.core.driver;

import com.alertrelay.core.model.NormalizedAlert;
import com.alertrelay.core.model.NormalizedPayload;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * New Relic driver for classic incident webhooks and workflow notifications.
 *
 * @since 1.0.0
 */
public class NewRelicDriver extends AbstractSourceDriver {

    public static final String NAME = "newrelic";

    private static final String DEFAULT_TITLE = "New Relic Alert";
    private static final int MAX_TARGET_LABELS = 3;

    private static final Map<String, String> SEVERITY_MAP = Map.of(
            "critical", "critical",
            "high", "critical",
            "warning", "warning",
            "medium", "warning",
            "low", "info",
            "info", "info");

    public NewRelicDriver(Clock clock) {
        super(NAME, "New Relic", clock);
    }

    @Override
    protected boolean accepts(PayloadView payload) {
        if (payload.has("account_id") && payload.has("current_state")) {
            return true;
        }
        if (payload.has("issueUrl") && payload.has("accumulations")) {
            return true;
        }
        return payload.countPresent("condition_id", "incident_id", "policy_name", "condition_name") >= 2;
    }

    @Override
    protected NormalizedPayload parseValid(PayloadView payload) {
        NormalizedAlert alert = payload.has("issueUrl") ? parseWorkflow(payload) : parseClassic(payload);
        return payloadOf(name(), payload)
                .externalUrl(payload.string("incident_url").orElseGet(() -> payload.string("issueUrl", "")))
                .alert(alert)
                .build();
    }

    private NormalizedAlert parseClassic(PayloadView payload) {
        String alertName = payload.string("condition_name")
                .orElseGet(() -> payload.string("policy_name", DEFAULT_TITLE));
        String currentState = lower(payload.string("current_state", ""));
        boolean resolved = "closed".equals(currentState) || "acknowledged".equals(currentState);
        String severity = SEVERITY_MAP.getOrDefault(lower(payload.string("severity", "warning")), "warning");

        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("alertname", alertName);
        labels.put("account_id", payload.string("account_id", ""));
        labels.put("account_name", payload.string("account_name", ""));
        labels.put("condition_id", payload.string("condition_id", ""));
        labels.put("policy_name", payload.string("policy_name", ""));
        labels.put("incident_id", payload.string("incident_id", ""));

        List<Object> targets = payload.list("targets");
        for (int i = 0; i < Math.min(MAX_TARGET_LABELS, targets.size()); i++) {
            if (targets.get(i) instanceof Map<?, ?>) {
                PayloadView target = PayloadView.of(targets.get(i));
                labels.put("target_" + i + "_name", target.string("name", ""));
                labels.put("target_" + i + "_type", target.string("type", ""));
            }
        }

        Map<String, String> annotations = new LinkedHashMap<>();
        annotations.put("incident_url", payload.string("incident_url", ""));
        annotations.put("runbook_url", payload.string("runbook_url", ""));

        return NormalizedAlert.builder()
                .fingerprint(fingerprintOr(payload.string("incident_id", ""), labels, alertName))
                .name(alertName)
                .status(resolved ? "resolved" : "firing")
                .severity(severity)
                .description(payload.string("details", ""))
                .labels(labels)
                .annotations(annotations)
                .startedAt(timestampOrNow(payload.get("timestamp").orElse(null)))
                .rawPayload(payload.raw())
                .build();
    }

    private NormalizedAlert parseWorkflow(PayloadView payload) {
        String alertName = payload.string("title").orElseGet(() -> {
            List<Object> conditionNames = payload.object("accumulations").list("conditionName");
            return !conditionNames.isEmpty() && conditionNames.get(0) != null
                    ? conditionNames.get(0).toString()
                    : DEFAULT_TITLE;
        });

        String state = lower(payload.string("state", ""));
        boolean resolved = "closed".equals(state) || "acknowledged".equals(state);

        String priority = lower(payload.string("priority", ""));
        String severity;
        if ("critical".equals(priority) || "high".equals(priority)) {
            severity = "critical";
        } else if ("medium".equals(priority)) {
            severity = "warning";
        } else {
            severity = "info";
        }

        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("alertname", alertName);
        labels.put("issue_id", payload.string("issueId", ""));

        return NormalizedAlert.builder()
                .fingerprint(fingerprintOr(payload.text("issueId").orElse(null), labels, alertName))
                .name(alertName)
                .status(resolved ? "resolved" : "firing")
                .severity(severity)
                .description(payload.string("description", ""))
                .labels(labels)
                .annotation("issue_url", payload.string("issueUrl", ""))
                .startedAt(timestampOrNow(payload.get("createdAt").orElse(null)))
                .rawPayload(payload.raw())
                .build();
    }
}
