package com.alertrelay.core.driver;

import com.alertrelay.core.model.AlertSeverity;
import com.alertrelay.core.model.AlertStatus;
import com.alertrelay.core.model.NormalizedAlert;
import com.alertrelay.core.model.NormalizedPayload;
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
 * Unit tests for {@link GenericWebhookDriver}.
 */
class GenericWebhookDriverTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-08T12:00:00Z"), ZoneOffset.UTC);

    private GenericWebhookDriver driver;

    @BeforeEach
    void setUp() {
        driver = new GenericWebhookDriver(CLOCK);
    }

    @Test
    @DisplayName("Should parse a single alert object and take the payload source")
    void shouldParseSingleObject() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", "my-monitor");
        payload.put("title", "Queue depth");
        payload.put("state", "OK");
        payload.put("level", "error");
        payload.put("message", "queue drained");
        payload.put("labels", Map.of("queue", "orders"));
        payload.put("group_key", "orders");

        NormalizedPayload parsed = driver.parse(payload);
        NormalizedAlert a = parsed.getAlerts().get(0);

        assertThat(parsed.getSource()).isEqualTo("my-monitor");
        assertThat(parsed.getGroupKey()).isEqualTo("orders");
        assertThat(a.getName()).isEqualTo("Queue depth");
        assertThat(a.getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(a.getEndedAt()).isEqualTo(CLOCK.instant());
        assertThat(a.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(a.getDescription()).isEqualTo("queue drained");
    }

    @Test
    @DisplayName("Should parse an alerts list and default the source to generic")
    void shouldParseAlertsList() {
        Map<String, Object> payload = Map.of("alerts", List.of(
                Map.of("name", "A", "severity", "info"),
                Map.of("alertname", "B", "priority", "p1", "status", "weird")));

        NormalizedPayload parsed = driver.parse(payload);

        assertThat(parsed.getSource()).isEqualTo("generic");
        assertThat(parsed.getAlerts()).extracting(NormalizedAlert::getName).containsExactly("A", "B");
        assertThat(parsed.getAlerts().get(0).getSeverity()).isEqualTo(AlertSeverity.INFO);
        assertThat(parsed.getAlerts().get(1).getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(parsed.getAlerts().get(1).getStatus()).isEqualTo(AlertStatus.FIRING);
    }

    @ParameterizedTest(name = "level \"{0}\" -> {1}")
    @CsvSource({"error, CRITICAL", "CRITICAL, CRITICAL", "debug, INFO", "info, INFO", "warning, WARNING", "trace, WARNING"})
    @DisplayName("Should derive severity from level when severity and priority are absent")
    void shouldDeriveSeverityFromLevel(String level, AlertSeverity expected) {
        NormalizedAlert a = driver.parse(Map.of("name", "Disk full", "level", level)).getAlerts().get(0);

        assertThat(a.getSeverity()).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should prefer severity and priority over level")
    void shouldPreferPrimaryFieldsOverLevel() {
        NormalizedAlert bySeverity = driver.parse(Map.of("name", "x", "severity", "info", "level", "error"))
                .getAlerts().get(0);
        NormalizedAlert byPriority = driver.parse(Map.of("name", "x", "priority", "p1", "level", "debug"))
                .getAlerts().get(0);

        assertThat(bySeverity.getSeverity()).isEqualTo(AlertSeverity.INFO);
        assertThat(byPriority.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
    }

    @Test
    @DisplayName("Should reject objects without any name-like key")
    void shouldRejectNameless() {
        assertThat(driver.validate(Map.of("foo", "bar"))).isFalse();
        assertThat(driver.validate(Map.of("alerts", "not-a-list"))).isFalse();
    }
}
