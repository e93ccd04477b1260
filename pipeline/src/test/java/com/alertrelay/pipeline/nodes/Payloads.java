package com.alertrelay.pipeline.nodes;

import java.util.List;
import java.util.Map;

/**
 * Webhook bodies shared by the node tests.
 */
final class Payloads {

    private Payloads() {
    }

    static Map<String, Object> alertmanager(String status) {
        return Map.of(
                "version", "4",
                "receiver", "relay",
                "status", status,
                "alerts", List.of(Map.of(
                        "status", status,
                        "labels", Map.of("alertname", "HighCPU", "severity", "critical"),
                        "annotations", Map.of("summary", "CPU high"),
                        "startsAt", "2024-01-08T11:00:00Z")));
    }
}
