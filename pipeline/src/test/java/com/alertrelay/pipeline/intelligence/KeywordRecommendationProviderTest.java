package com.alertrelay.pipeline.intelligence;

import com.alertrelay.core.model.Alert;
import com.alertrelay.core.model.AlertSeverity;
import com.alertrelay.core.model.AlertStatus;
import com.alertrelay.core.model.Incident;
import com.alertrelay.core.model.IncidentStatus;
import com.alertrelay.core.store.InMemoryAlertStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link KeywordRecommendationProvider}.
 */
class KeywordRecommendationProviderTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-08T12:00:00Z"), ZoneOffset.UTC);

    private InMemoryAlertStore store;
    private KeywordRecommendationProvider provider;

    @BeforeEach
    void setUp() {
        store = new InMemoryAlertStore(CLOCK);
        provider = new KeywordRecommendationProvider(store);
    }

    private Incident incident(String title, AlertSeverity severity) {
        Incident incident = new Incident();
        incident.setTitle(title);
        incident.setDescription("");
        incident.setSeverity(severity);
        incident.setStatus(IncidentStatus.OPEN);
        return store.createIncident(incident);
    }

    @Test
    @DisplayName("Should register under the name local")
    void shouldBeNamedLocal() {
        assertThat(provider.name()).isEqualTo("local");
    }

    @Test
    @DisplayName("Should recommend a memory playbook for OOM incidents")
    void shouldDetectMemory() {
        Incident incident = incident("Pod OOMKilled", AlertSeverity.CRITICAL);

        List<Recommendation> result = provider.run(incident);

        assertThat(result).singleElement().satisfies(r -> {
            assertThat(r.getType()).isEqualTo(RecommendationType.MEMORY);
            assertThat(r.getPriority()).isEqualTo(RecommendationPriority.CRITICAL);
            assertThat(r.getTitle()).isEqualTo("High Memory Usage Detected");
            assertThat(r.getIncidentId()).isEqualTo(incident.getId());
            assertThat(r.getActions()).isNotEmpty();
        });
    }

    @Test
    @DisplayName("Should use the metadata path for disk incidents")
    void shouldDetectDisk() {
        Incident incident = incident("Filesystem almost full", AlertSeverity.WARNING);
        incident.setMetadata(Map.of("path", "/var"));
        store.updateIncident(incident);

        Recommendation result = provider.run(store.findIncident(incident.getId()).orElseThrow()).get(0);

        assertThat(result.getType()).isEqualTo(RecommendationType.DISK);
        assertThat(result.getPriority()).isEqualTo(RecommendationPriority.HIGH);
        assertThat(result.getDetails()).containsEntry("path", "/var");
    }

    @Test
    @DisplayName("Should detect CPU incidents from their title")
    void shouldDetectCpu() {
        Recommendation result = provider.run(incident("HighCPU", AlertSeverity.INFO)).get(0);

        assertThat(result.getType()).isEqualTo(RecommendationType.CPU);
        assertThat(result.getPriority()).isEqualTo(RecommendationPriority.MEDIUM);
        assertThat(result.getTitle()).isEqualTo("High CPU Usage Detected");
    }

    @Test
    @DisplayName("Should prefer memory over disk when both keywords appear")
    void shouldPreferMemoryOverDisk() {
        Incident incident = incident("Swap and disk pressure", AlertSeverity.WARNING);

        assertThat(provider.classify(incident)).isEqualTo(RecommendationType.MEMORY);
    }

    @Test
    @DisplayName("Should classify using the attached alerts")
    void shouldClassifyFromAttachedAlerts() {
        Incident incident = incident("Service degraded", AlertSeverity.WARNING);
        Alert alert = new Alert();
        alert.setFingerprint("fp");
        alert.setSource("test");
        alert.setName("InodeExhaustion");
        alert.setStatus(AlertStatus.FIRING);
        alert.setSeverity(AlertSeverity.WARNING);
        alert.setIncidentId(incident.getId());
        store.createAlert(alert);

        assertThat(provider.classify(incident)).isEqualTo(RecommendationType.DISK);
    }

    @Test
    @DisplayName("Should fall back to a general review")
    void shouldFallBackToGeneral() {
        List<Recommendation> unknown = provider.run(incident("Checkout latency", AlertSeverity.CRITICAL));
        List<Recommendation> none = provider.run(null);

        assertThat(unknown).singleElement()
                .extracting(Recommendation::getType).isEqualTo(RecommendationType.GENERAL);
        assertThat(none).singleElement().satisfies(r -> {
            assertThat(r.getPriority()).isEqualTo(RecommendationPriority.LOW);
            assertThat(r.getIncidentId()).isNull();
        });
    }

    @Test
    @DisplayName("Should serialize recommendations with snake_case keys")
    void shouldSerializeRecommendation() {
        Map<String, Object> map = provider.run(incident("HighCPU", AlertSeverity.CRITICAL)).get(0).toMap();

        assertThat(map).containsOnlyKeys("type", "priority", "title", "description",
                "details", "actions", "incident_id");
        assertThat(map).containsEntry("type", "cpu").containsEntry("priority", "critical");
    }
}
