package com.alertrelay.core.driver;

import com.alertrelay.core.model.AlertSeverity;
import com.alertrelay.core.model.AlertStatus;
import com.alertrelay.core.model.NormalizedAlert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link OpsGenieDriver}.
 */
class OpsGenieDriverTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-08T12:00:00Z"), ZoneOffset.UTC);

    private OpsGenieDriver driver;
    private Map<String, Object> alert;
    private Map<String, Object> payload;

    @BeforeEach
    void setUp() {
        driver = new OpsGenieDriver(CLOCK);
        alert = new LinkedHashMap<>();
        alert.put("alertId", "og-1");
        alert.put("tinyId", "12");
        alert.put("message", "API latency");
        alert.put("priority", "P2");
        alert.put("tags", List.of("env:prod", "paging"));
        alert.put("entity", "api-gateway");

        payload = new LinkedHashMap<>();
        payload.put("action", "Create");
        payload.put("alert", alert);
    }

    @Test
    @DisplayName("Should parse create actions as firing with tag labels")
    void shouldParseCreate() {
        NormalizedAlert a = driver.parse(payload).getAlerts().get(0);

        assertThat(a.getFingerprint()).isEqualTo("og-1");
        assertThat(a.getName()).isEqualTo("API latency");
        assertThat(a.getStatus()).isEqualTo(AlertStatus.FIRING);
        assertThat(a.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(a.getLabels())
                .containsEntry("env", "prod")
                .containsEntry("tag_paging", "true")
                .containsEntry("entity", "api-gateway")
                .containsEntry("priority", "P2");
        assertThat(a.getAnnotations()).containsEntry("action", "create");
    }

    @Test
    @DisplayName("Should treat a Close action as resolved")
    void shouldResolveOnClose() {
        payload.put("action", "Close");

        assertThat(driver.parse(payload).getAlerts().get(0).getStatus()).isEqualTo(AlertStatus.RESOLVED);
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({"P1, CRITICAL", "p4, INFO", "P5, INFO", "P3, WARNING", "P99, WARNING"})
    @DisplayName("Should map priority tiers to severities")
    void shouldMapPriority(String priority, AlertSeverity expected) {
        alert.put("priority", priority);

        assertThat(driver.parse(payload).getAlerts().get(0).getSeverity()).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should require an alert identifier next to the action")
    void shouldValidateShape() {
        assertThat(driver.validate(Map.of("action", "Create", "alert", Map.of("message", "x")))).isFalse();
        assertThat(driver.validate(Map.of("integrationId", "i", "integrationName", "n"))).isTrue();
    }
}
