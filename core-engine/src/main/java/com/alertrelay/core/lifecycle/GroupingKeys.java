package com.alertrelay.core.lifecycle;

import com.alertrelay.core.model.NormalizedAlert;

import java.util.Map;

/**
 * Derives the key that decides which alerts share an incident.
 *
 * <ol>
 * <li>{@code checker=<checker>|hostname=<host>} when the alert carries a
 * {@code checker} label (health-check alerts)</li>
 * <li>the payload's own group key when the source supplied one</li>
 * <li>{@code name=<alert name>} otherwise</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class GroupingKeys {

    private GroupingKeys() {
        // utility class
    }

    public static String of(NormalizedAlert alert, String payloadGroupKey) {
        Map<String, String> labels = alert.getLabels();
        String checker = labels.get("checker");
        if (checker != null && !checker.isEmpty()) {
            return "checker=" + checker + "|hostname=" + labels.getOrDefault("hostname", "");
        }
        if (payloadGroupKey != null && !payloadGroupKey.isBlank()) {
            return payloadGroupKey;
        }
        return "name=" + alert.getName();
    }
}
