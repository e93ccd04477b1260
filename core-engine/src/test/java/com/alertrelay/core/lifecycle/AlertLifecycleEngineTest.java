package com.alertrelay.core.lifecycle;

import com.alertrelay.core.driver.DriverRegistry;
import com.alertrelay.core.model.Alert;
import com.alertrelay.core.model.AlertHistory;
import com.alertrelay.core.model.AlertSeverity;
import com.alertrelay.core.model.AlertStatus;
import com.alertrelay.core.model.Incident;
import com.alertrelay.core.model.IncidentStatus;
import com.alertrelay.core.model.NormalizedAlert;
import com.alertrelay.core.model.NormalizedPayload;
import com.alertrelay.core.store.AlertQuery;
import com.alertrelay.core.store.InMemoryAlertStore;
import com.alertrelay.core.store.StoreException;
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
 * Unit tests for {@link AlertLifecycleEngine}.
 */
class AlertLifecycleEngineTest {

    private static final Instant NOW = Instant.parse("2024-01-08T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final String SOURCE = "test";

    private InMemoryAlertStore store;
    private AlertLifecycleEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryAlertStore(CLOCK);
        engine = engineWith(store);
    }

    private static AlertLifecycleEngine engineWith(InMemoryAlertStore store) {
        return AlertLifecycleEngine.builder()
                .drivers(DriverRegistry.standard(CLOCK))
                .store(store)
                .clock(CLOCK)
                .build();
    }

    private static NormalizedAlert alert(String fingerprint, String status, String severity) {
        return NormalizedAlert.builder()
                .fingerprint(fingerprint)
                .name("alert " + fingerprint)
                .status(status)
                .severity(severity)
                .description("desc " + severity)
                .startedAt(NOW.minusSeconds(60))
                .build();
    }

    private static NormalizedPayload payload(String groupKey, NormalizedAlert... alerts) {
        return NormalizedPayload.builder()
                .source(SOURCE)
                .groupKey(groupKey)
                .alerts(List.of(alerts))
                .build();
    }

    private Alert row(String fingerprint) {
        return store.findFirstAlert(AlertQuery.byKey(fingerprint, SOURCE)).orElseThrow();
    }

    // ---------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should create an alert, a history entry and an incident for a new firing alert")
    void shouldCreateFiringAlert() {
        ProcessingResult result = engine.process(payload("", alert("fp1", "firing", "critical")));

        assertThat(result.getAlertsCreated()).isEqualTo(1);
        assertThat(result.getIncidentsCreated()).isEqualTo(1);
        assertThat(result.hasErrors()).isFalse();

        Alert row = row("fp1");
        assertThat(row.getStatus()).isEqualTo(AlertStatus.FIRING);
        assertThat(row.getGroupKey()).isEqualTo("name=alert fp1");
        assertThat(row.getIncidentId()).isNotNull();
        assertThat(store.historyOf(row.getId()))
                .extracting(AlertHistory::getEvent).containsExactly(AlertHistory.CREATED);

        Incident incident = store.findIncident(row.getIncidentId()).orElseThrow();
        assertThat(incident.getTitle()).isEqualTo("alert fp1");
        assertThat(incident.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.OPEN);
    }

    @Test
    @DisplayName("Should write nothing for a resolved alert with no existing row")
    void shouldIgnoreUnknownResolved() {
        ProcessingResult result = engine.process(payload("", alert("fp1", "resolved", "critical")));

        assertThat(result.totalProcessed()).isZero();
        assertThat(store.countAlerts(AlertQuery.builder().build())).isZero();
        assertThat(store.findIncidents(Set.of())).isEmpty();
    }

    @Test
    @DisplayName("Should update in place and record a severity change")
    void shouldRefreshFiringAlert() {
        engine.process(payload("", alert("fp1", "firing", "warning")));
        ProcessingResult same = engine.process(payload("", alert("fp1", "firing", "warning")));
        ProcessingResult changed = engine.process(payload("", alert("fp1", "firing", "critical")));

        assertThat(same.getAlertsUpdated()).isEqualTo(1);
        assertThat(changed.getAlertsUpdated()).isEqualTo(1);
        assertThat(store.countAlerts(AlertQuery.byKey("fp1", SOURCE))).isEqualTo(1);

        Alert row = row("fp1");
        assertThat(row.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(row.getDescription()).isEqualTo("desc critical");
        List<AlertHistory> history = store.historyOf(row.getId());
        assertThat(history).extracting(AlertHistory::getEvent)
                .containsExactly(AlertHistory.CREATED, AlertHistory.SEVERITY_CHANGED);
        assertThat(history.get(1).getDetails())
                .containsEntry("old_severity", "warning")
                .containsEntry("new_severity", "critical");
    }

    @Test
    @DisplayName("Should resolve the same row and stamp endedAt")
    void shouldResolveFiringAlert() {
        engine.process(payload("", alert("fp1", "firing", "warning")));
        ProcessingResult result = engine.process(payload("", alert("fp1", "resolved", "warning")));

        assertThat(result.getAlertsResolved()).isEqualTo(1);
        assertThat(store.countAlerts(AlertQuery.byKey("fp1", SOURCE))).isEqualTo(1);
        Alert row = row("fp1");
        assertThat(row.getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(row.getEndedAt()).isEqualTo(NOW);
        assertThat(store.historyOf(row.getId())).extracting(AlertHistory::getEvent)
                .containsExactly(AlertHistory.CREATED, AlertHistory.RESOLVED);
    }

    @Test
    @DisplayName("Should prefer the incoming endedAt when resolving")
    void shouldUseIncomingEndedAt() {
        engine.process(payload("", alert("fp1", "firing", "warning")));
        Instant ended = NOW.minusSeconds(30);
        NormalizedAlert resolved = NormalizedAlert.builder()
                .fingerprint("fp1").name("alert fp1").status(AlertStatus.RESOLVED)
                .startedAt(NOW.minusSeconds(60)).endedAt(ended)
                .build();

        engine.process(payload("", resolved));

        assertThat(row("fp1").getEndedAt()).isEqualTo(ended);
    }

    @Test
    @DisplayName("Should keep a resolved alert resolved when it fires again")
    void shouldNotRefireResolvedAlert() {
        engine.process(payload("", alert("fp1", "firing", "warning")));
        engine.process(payload("", alert("fp1", "resolved", "warning")));
        ProcessingResult result = engine.process(payload("", alert("fp1", "firing", "critical")));

        assertThat(result.getAlertsUpdated()).isEqualTo(1);
        Alert row = row("fp1");
        assertThat(row.getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(row.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(store.historyOf(row.getId())).hasSize(2);
    }

    // ---------------------------------------------------------------
    // Incidents
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should group alerts by payload group key and raise incident severity")
    void shouldRaiseIncidentSeverity() {
        ProcessingResult result = engine.process(payload("grp",
                alert("a", "firing", "warning"),
                alert("b", "firing", "critical")));

        assertThat(result.getIncidentsCreated()).isEqualTo(1);
        assertThat(result.getIncidentsUpdated()).isEqualTo(1);
        assertThat(row("a").getIncidentId()).isEqualTo(row("b").getIncidentId());
        assertThat(store.findIncident(row("a").getIncidentId()).orElseThrow().getSeverity())
                .isEqualTo(AlertSeverity.CRITICAL);
    }

    @Test
    @DisplayName("Should not lower incident severity when a milder alert joins")
    void shouldNotLowerIncidentSeverity() {
        engine.process(payload("grp", alert("a", "firing", "critical")));
        engine.process(payload("grp", alert("b", "firing", "warning")));

        assertThat(store.findIncident(row("b").getIncidentId()).orElseThrow().getSeverity())
                .isEqualTo(AlertSeverity.CRITICAL);
    }

    @Test
    @DisplayName("Should resolve an incident exactly when its last firing alert resolves")
    void shouldAutoResolveAtZeroFiring() {
        engine.process(payload("grp", alert("a", "firing", "warning"), alert("b", "firing", "warning")));
        long incidentId = row("a").getIncidentId();

        ProcessingResult first = engine.process(payload("grp", alert("a", "resolved", "warning")));
        assertThat(first.getIncidentsResolved()).isZero();
        assertThat(store.findIncident(incidentId).orElseThrow().getStatus()).isEqualTo(IncidentStatus.OPEN);

        ProcessingResult second = engine.process(payload("grp", alert("b", "resolved", "warning")));
        assertThat(second.getIncidentsResolved()).isEqualTo(1);
        Incident incident = store.findIncident(incidentId).orElseThrow();
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
        assertThat(incident.getResolvedAt()).isEqualTo(NOW);
        assertThat(incident.getSummary()).isEqualTo(AlertLifecycleEngine.AUTO_RESOLVE_SUMMARY);
    }

    @Test
    @DisplayName("Should open a new incident when the group's incident is already resolved")
    void shouldOpenNewIncidentAfterResolution() {
        engine.process(payload("grp", alert("a", "firing", "warning")));
        engine.process(payload("grp", alert("a", "resolved", "warning")));
        ProcessingResult result = engine.process(payload("grp", alert("b", "firing", "warning")));

        assertThat(result.getIncidentsCreated()).isEqualTo(1);
        assertThat(row("b").getIncidentId()).isNotEqualTo(row("a").getIncidentId());
    }

    @Test
    @DisplayName("Should not create incidents for info alerts")
    void shouldSkipInfoIncidents() {
        engine.process(payload("", alert("fp1", "firing", "info")));

        assertThat(row("fp1").getIncidentId()).isNull();
        assertThat(store.findIncidents(Set.of())).isEmpty();
    }

    @Test
    @DisplayName("Should not create incidents when auto-create is disabled")
    void shouldHonourAutoCreateFlag() {
        AlertLifecycleEngine noIncidents = AlertLifecycleEngine.builder()
                .drivers(DriverRegistry.standard(CLOCK))
                .store(store)
                .clock(CLOCK)
                .autoCreateIncidents(false)
                .build();

        ProcessingResult result = noIncidents.process(payload("", alert("fp1", "firing", "critical")));

        assertThat(result.getAlertsCreated()).isEqualTo(1);
        assertThat(store.findIncidents(Set.of())).isEmpty();
    }

    // ---------------------------------------------------------------
    // Failures
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should roll back a failing alert and keep processing the rest")
    void shouldIsolateAlertFailures() {
        InMemoryAlertStore flaky = new InMemoryAlertStore(CLOCK) {
            @Override
            public synchronized Incident createIncident(Incident incident) {
                if ("alert bad".equals(incident.getTitle())) {
                    throw new StoreException("disk full");
                }
                return super.createIncident(incident);
            }
        };
        AlertLifecycleEngine flakyEngine = engineWith(flaky);

        ProcessingResult result = flakyEngine.process(payload("",
                alert("bad", "firing", "critical"),
                alert("good", "firing", "critical")));

        assertThat(result.getAlertsCreated()).isEqualTo(1);
        assertThat(result.getIncidentsCreated()).isEqualTo(1);
        assertThat(result.getErrors()).containsExactly("Error processing alert bad: disk full");
        assertThat(flaky.findFirstAlert(AlertQuery.byKey("bad", SOURCE))).isEmpty();
        Alert good = flaky.findFirstAlert(AlertQuery.byKey("good", SOURCE)).orElseThrow();
        assertThat(flaky.historyOf(good.getId())).hasSize(1);
    }

    @Test
    @DisplayName("Should report a failed batch and roll back all of its writes")
    void shouldRollBackFailedBatch() {
        InMemoryAlertStore broken = new InMemoryAlertStore(CLOCK) {
            @Override
            public synchronized List<Incident> findIncidents(Set<IncidentStatus> statuses) {
                throw new StoreException("connection lost");
            }
        };

        ProcessingResult result = engineWith(broken).process(payload("", alert("fp1", "firing", "warning")));

        assertThat(result.getErrors()).containsExactly("Batch failed: connection lost");
        assertThat(result.getAlertsCreated()).isZero();
        assertThat(broken.countAlerts(AlertQuery.builder().build())).isZero();
    }

    // ---------------------------------------------------------------
    // Webhook entry points
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should auto-detect an Alertmanager body and generate its fingerprint")
    void shouldProcessAlertmanagerJson() {
        String json = """
                {
                  "version": "4",
                  "receiver": "relay",
                  "status": "firing",
                  "alerts": [
                    {
                      "status": "firing",
                      "labels": {"alertname": "HighCPU", "severity": "critical"},
                      "annotations": {"summary": "CPU high"},
                      "startsAt": "2024-01-08T11:00:00Z"
                    }
                  ]
                }
                """;

        ProcessingResult result = engine.processWebhook(json, null);

        assertThat(result.getAlertsCreated()).isEqualTo(1);
        Alert row = store.findFirstAlert(AlertQuery.byKey("cb8b593651aa775e", "alertmanager")).orElseThrow();
        assertThat(row.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(row.getStatus()).isEqualTo(AlertStatus.FIRING);
    }

    @Test
    @DisplayName("Should report an unknown driver name")
    void shouldReportUnknownDriver() {
        ProcessingResult result = engine.processWebhook(Map.of("name", "x"), "nagios");

        assertThat(result.getErrors()).singleElement().asString().startsWith("Unknown driver: nagios");
        assertThat(result.totalProcessed()).isZero();
    }

    @Test
    @DisplayName("Should report a payload no driver recognizes")
    void shouldReportUndetectablePayload() {
        ProcessingResult result = engine.processWebhook(Map.of("foo", "bar"), "");

        assertThat(result.getErrors()).containsExactly("Could not detect driver for payload");
    }

    @Test
    @DisplayName("Should report a payload the named driver rejects")
    void shouldReportInvalidPayload() {
        ProcessingResult result = engine.processWebhook(Map.of("foo", "bar"), "alertmanager");

        assertThat(result.getErrors()).containsExactly("Invalid AlertManager payload");
    }

    @Test
    @DisplayName("Should report malformed JSON")
    void shouldReportMalformedJson() {
        ProcessingResult result = engine.processWebhook("{not json", null);

        assertThat(result.getErrors()).singleElement().asString().startsWith("Malformed JSON payload");
        assertThat(engine.processWebhook("[1, 2]", null).getErrors())
                .containsExactly("Payload must be a JSON object");
    }

    @Test
    @DisplayName("Should expose counts under snake_case keys")
    void shouldRenderResultMap() {
        ProcessingResult result = engine.process(payload("", alert("fp1", "firing", "warning")));

        assertThat(result.toMap())
                .containsEntry("alerts_created", 1)
                .containsEntry("incidents_created", 1)
                .containsEntry("total_processed", 1)
                .containsEntry("errors", List.of());
    }
}
