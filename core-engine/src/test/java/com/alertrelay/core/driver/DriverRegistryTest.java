package com.alertrelay.core.driver;

import com.alertrelay.core.registry.UnknownEntryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DriverRegistry}.
 */
class DriverRegistryTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-08T12:00:00Z"), ZoneOffset.UTC);

    private DriverRegistry registry;

    @BeforeEach
    void setUp() {
        registry = DriverRegistry.standard(CLOCK);
    }

    @Test
    @DisplayName("Should list the bundled drivers in detection order")
    void shouldListDrivers() {
        assertThat(registry.names()).containsExactly(
                "alertmanager", "grafana", "pagerduty", "datadog", "newrelic", "opsgenie", "zabbix", "generic");
    }

    @Test
    @DisplayName("Should detect an Alertmanager payload")
    void shouldDetectAlertmanager() {
        Map<String, Object> payload = Map.of("alerts", List.of(), "status", "firing", "receiver", "r");

        assertThat(registry.detect(payload)).map(SourceDriver::name).contains("alertmanager");
    }

    @Test
    @DisplayName("Should prefer the earlier driver when predicates overlap")
    void shouldPreferRegistrationOrder() {
        // matches grafana (title) and the generic fallback
        Map<String, Object> payload = Map.of("title", "Something", "state", "alerting");

        assertThat(registry.detect(payload)).map(SourceDriver::name).contains("grafana");
    }

    @Test
    @DisplayName("Should fall back to the generic driver")
    void shouldFallBackToGeneric() {
        assertThat(registry.detect(Map.of("name", "custom"))).map(SourceDriver::name).contains("generic");
    }

    @Test
    @DisplayName("Should detect nothing for an unrecognizable payload")
    void shouldDetectNothing() {
        assertThat(registry.detect(Map.of("foo", "bar"))).isEmpty();
        assertThat(registry.detect(null)).isEmpty();
    }

    @Test
    @DisplayName("Should name the available drivers for an unknown name")
    void shouldRejectUnknownName() {
        assertThatThrownBy(() -> registry.get("nagios"))
                .isInstanceOf(UnknownEntryException.class)
                .hasMessageStartingWith("Unknown driver: nagios. Available: alertmanager, grafana");
    }
}
