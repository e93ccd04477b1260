package com.alertrelay.core.lifecycle;

import com.alertrelay.core.check.CheckResult;
import com.alertrelay.core.check.CheckStatus;
import com.alertrelay.core.check.Checker;
import com.alertrelay.core.check.CheckerRegistry;
import com.alertrelay.core.driver.DriverRegistry;
import com.alertrelay.core.model.Alert;
import com.alertrelay.core.model.AlertSeverity;
import com.alertrelay.core.model.AlertStatus;
import com.alertrelay.core.model.Incident;
import com.alertrelay.core.model.IncidentStatus;
import com.alertrelay.core.model.NormalizedAlert;
import com.alertrelay.core.registry.NamedRegistry;
import com.alertrelay.core.store.AlertQuery;
import com.alertrelay.core.store.InMemoryAlertStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CheckAlertBridge}.
 */
class CheckAlertBridgeTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-08T12:00:00Z"), ZoneOffset.UTC);

    private InMemoryAlertStore store;
    private CheckAlertBridge bridge;

    @BeforeEach
    void setUp() {
        store = new InMemoryAlertStore(CLOCK);
        AlertLifecycleEngine engine = AlertLifecycleEngine.builder()
                .drivers(DriverRegistry.standard(CLOCK))
                .store(store)
                .clock(CLOCK)
                .build();
        bridge = new CheckAlertBridge(engine, "web-01");
    }

    @Test
    @DisplayName("Should derive a stable fingerprint from checker and host")
    void shouldDeriveFingerprint() {
        assertThat(bridge.fingerprint("disk")).isEqualTo("f7c2264dcb1924ee");
    }

    @Test
    @DisplayName("Should convert a result into a labelled alert")
    void shouldConvertResult() {
        CheckResult result = CheckResult.of("disk", CheckStatus.CRITICAL, "Disk 97% full",
                Map.of("usage_percent", 97, "mounts", List.of("/", "/var")));

        NormalizedAlert alert = bridge.toAlert(result, Map.of("team", "infra"));

        assertThat(alert.getName()).isEqualTo("DISK Check Alert");
        assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.FIRING);
        assertThat(alert.getEndedAt()).isNull();
        assertThat(alert.getLabels())
                .containsEntry("hostname", "web-01")
                .containsEntry("checker", "disk")
                .containsEntry("team", "infra")
                .containsEntry("metric_usage_percent", "97")
                .doesNotContainKey("metric_mounts");
        assertThat(alert.getAnnotations()).containsKey("mounts");
    }

    @Test
    @DisplayName("Should append the probe error to the description")
    void shouldDescribeProbeError() {
        NormalizedAlert alert = bridge.toAlert(CheckResult.failed("memory", new IllegalStateException("no /proc")),
                null);

        assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.WARNING);
        assertThat(alert.getDescription()).isEqualTo("Check failed: no /proc\nError: no /proc");
    }

    @Test
    @DisplayName("Should fire then resolve one alert and one incident for the disk checker")
    void shouldFireThenResolve() {
        ProcessingResult fired = bridge.processCheckResult(
                CheckResult.of("disk", CheckStatus.WARNING, "Disk 85% full"), null);

        assertThat(fired.getAlertsCreated()).isEqualTo(1);
        assertThat(fired.getIncidentsCreated()).isEqualTo(1);
        Alert row = store.findFirstAlert(AlertQuery.byKey(bridge.fingerprint("disk"), CheckAlertBridge.SOURCE))
                .orElseThrow();
        assertThat(row.getSeverity()).isEqualTo(AlertSeverity.WARNING);
        assertThat(row.getStatus()).isEqualTo(AlertStatus.FIRING);
        assertThat(row.getGroupKey()).isEqualTo("checker=disk|hostname=web-01");

        ProcessingResult cleared = bridge.processCheckResult(
                CheckResult.of("disk", CheckStatus.OK, "Disk 40% full"), null);

        assertThat(cleared.getAlertsResolved()).isEqualTo(1);
        assertThat(cleared.getIncidentsResolved()).isEqualTo(1);
        assertThat(store.countAlerts(AlertQuery.builder().build())).isEqualTo(1);
        Incident incident = store.findIncident(row.getIncidentId()).orElseThrow();
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
    }

    @Test
    @DisplayName("Should run enabled checkers and record failures per checker")
    void shouldRunChecks() {
        NamedRegistry<Checker> checkers = NamedRegistry.<Checker>builder("checker")
                .register("disk", () -> fixed("disk", CheckStatus.WARNING))
                .register("broken", () -> new Checker() {
                    @Override
                    public String name() {
                        return "broken";
                    }

                    @Override
                    public CheckResult check() {
                        throw new IllegalStateException("probe crashed");
                    }
                })
                .register("load", () -> fixed("load", CheckStatus.OK))
                .build();
        CheckerRegistry registry = new CheckerRegistry(checkers, Set.of("load"), false);

        CheckAlertResult result = bridge.runChecksAndAlert(registry, null, null);

        assertThat(result.getChecksRun()).isEqualTo(1);
        assertThat(result.getAlertsCreated()).isEqualTo(1);
        assertThat(result.getErrors()).containsExactly("broken: probe crashed");
    }

    @Test
    @DisplayName("Should report unknown checker names")
    void shouldReportUnknownChecker() {
        CheckerRegistry registry = CheckerRegistry.of(List.of(fixed("disk", CheckStatus.OK)));

        CheckAlertResult result = bridge.runChecksAndAlert(registry, List.of("disk", "cpu"), null);

        assertThat(result.getChecksRun()).isEqualTo(1);
        assertThat(result.getErrors()).containsExactly("Unknown checker: cpu. Available: disk");
    }

    private static Checker fixed(String name, CheckStatus status) {
        return new Checker() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public CheckResult check() {
                return CheckResult.of(name, status, name + " " + status.value());
            }
        };
    }
}
