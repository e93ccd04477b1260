package com.alertrelay.core.driver;

import com.alertrelay.core.model.AlertSeverity;
import com.alertrelay.core.model.AlertStatus;
import com.alertrelay.core.model.NormalizedAlert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ZabbixDriver}.
 */
class ZabbixDriverTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-08T12:00:00Z"), ZoneOffset.UTC);

    private ZabbixDriver driver;
    private Map<String, Object> payload;

    @BeforeEach
    void setUp() {
        driver = new ZabbixDriver(CLOCK);
        payload = new LinkedHashMap<>();
        payload.put("event_id", "9001");
        payload.put("event_value", "1");
        payload.put("trigger_name", "Free disk space is less than 10%");
        payload.put("trigger_severity", "High");
        payload.put("host_name", "db-01");
        payload.put("item_name", "vfs.fs.size");
        payload.put("item_value", "7%");
        payload.put("event_date", "2024.01.08");
        payload.put("event_time", "10:30:00");
    }

    @Test
    @DisplayName("Should parse problem events with the Zabbix date format")
    void shouldParseProblem() {
        NormalizedAlert a = driver.parse(payload).getAlerts().get(0);

        assertThat(a.getFingerprint()).isEqualTo("9001");
        assertThat(a.getStatus()).isEqualTo(AlertStatus.FIRING);
        assertThat(a.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(a.getStartedAt()).isEqualTo(Instant.parse("2024-01-08T10:30:00Z"));
        assertThat(a.getDescription()).isEqualTo("vfs.fs.size: 7%");
        assertThat(a.getLabels()).containsEntry("host_name", "db-01");
    }

    @Test
    @DisplayName("Should resolve when event_value is 0")
    void shouldResolveOnEventValueZero() {
        payload.put("event_value", "0");

        assertThat(driver.parse(payload).getAlerts().get(0).getStatus()).isEqualTo(AlertStatus.RESOLVED);
    }

    @Test
    @DisplayName("Should understand numeric severities")
    void shouldMapNumericSeverity() {
        payload.put("trigger_severity", 1);

        assertThat(driver.parse(payload).getAlerts().get(0).getSeverity()).isEqualTo(AlertSeverity.INFO);
    }

    @Test
    @DisplayName("Should need two recognizable keys")
    void shouldValidateLoosely() {
        assertThat(driver.validate(Map.of("host_name", "h", "trigger_id", "t"))).isTrue();
        assertThat(driver.validate(Map.of("host_name", "h"))).isFalse();
        assertThat(driver.validate(Map.of("event_source", "0", "event_value", "1"))).isTrue();
    }
}
