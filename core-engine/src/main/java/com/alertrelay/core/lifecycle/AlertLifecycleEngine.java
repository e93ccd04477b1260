package com.alertrelay.core.lifecycle;

import com.alertrelay.core.driver.DriverRegistry;
import com.alertrelay.core.driver.InvalidPayloadException;
import com.alertrelay.core.driver.SourceDriver;
import com.alertrelay.core.json.JsonPayloads;
import com.alertrelay.core.model.Alert;
import com.alertrelay.core.model.AlertHistory;
import com.alertrelay.core.model.AlertSeverity;
import com.alertrelay.core.model.AlertStatus;
import com.alertrelay.core.model.Incident;
import com.alertrelay.core.model.IncidentStatus;
import com.alertrelay.core.model.NormalizedAlert;
import com.alertrelay.core.model.NormalizedPayload;
import com.alertrelay.core.registry.UnknownEntryException;
import com.alertrelay.core.store.AlertQuery;
import com.alertrelay.core.store.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Fingerprint-keyed alert state machine with incident grouping.
 *
 * <h3>Transitions per (fingerprint, source)</h3>
 * <table>
 * <caption>Alert transitions</caption>
 * <tr><th>Existing</th><th>Incoming</th><th>Action</th></tr>
 * <tr><td>none</td><td>firing</td><td>create row, {@code created} history,
 * incident attachment for critical/warning</td></tr>
 * <tr><td>none</td><td>resolved</td><td>nothing</td></tr>
 * <tr><td>firing</td><td>firing</td><td>refresh fields,
 * {@code severity_changed} history when severity moved</td></tr>
 * <tr><td>firing</td><td>resolved</td><td>stamp {@code endedAt}, mark resolved,
 * {@code resolved} history</td></tr>
 * <tr><td>resolved</td><td>any</td><td>refresh fields, status unchanged</td></tr>
 * </table>
 *
 * <h3>Atomicity</h3>
 * <p>
 * One payload is one store transaction. Each alert runs inside a nested
 * transaction (savepoint): if it fails, its partial writes are undone, the
 * error is recorded and the next alert is processed. The auto-resolution
 * sweep runs inside the same outer transaction after the last alert.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * The existing-row lookup and the subsequent write are not atomic with
 * respect to other callers unless the store serializes them.
 * {@link com.alertrelay.core.store.InMemoryAlertStore} does.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertLifecycleEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AlertLifecycleEngine.class);

    static final String AUTO_RESOLVE_SUMMARY = "All alerts resolved automatically";

    private static final Set<IncidentStatus> ACTIVE = Set.of(IncidentStatus.OPEN, IncidentStatus.ACKNOWLEDGED);

    private final DriverRegistry drivers;
    private final AlertStore store;
    private final Clock clock;
    private final boolean autoCreateIncidents;
    private final boolean autoResolveIncidents;

    private AlertLifecycleEngine(Builder builder) {
        this.drivers = Objects.requireNonNull(builder.drivers, "drivers must not be null");
        this.store = Objects.requireNonNull(builder.store, "store must not be null");
        this.clock = Objects.requireNonNull(builder.clock, "clock must not be null");
        this.autoCreateIncidents = builder.autoCreateIncidents;
        this.autoResolveIncidents = builder.autoResolveIncidents;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DriverRegistry drivers;
        private AlertStore store;
        private Clock clock = Clock.systemUTC();
        private boolean autoCreateIncidents = true;
        private boolean autoResolveIncidents = true;

        public Builder drivers(DriverRegistry drivers) {
            this.drivers = drivers;
            return this;
        }

        public Builder store(AlertStore store) {
            this.store = store;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder autoCreateIncidents(boolean autoCreateIncidents) {
            this.autoCreateIncidents = autoCreateIncidents;
            return this;
        }

        public Builder autoResolveIncidents(boolean autoResolveIncidents) {
            this.autoResolveIncidents = autoResolveIncidents;
            return this;
        }

        public AlertLifecycleEngine build() {
            return new AlertLifecycleEngine(this);
        }
    }

    // ---------------------------------------------------------------
    // Entry points
    // ---------------------------------------------------------------

    /**
     * Process a raw webhook body.
     *
     * @param json       raw JSON text, must be an object
     * @param driverName driver to use, or {@code null}/blank to auto-detect
     * @return processing summary, never {@code null}
     */
    public ProcessingResult processWebhook(String json, String driverName) {
        Map<String, Object> payload;
        try {
            payload = JsonPayloads.parseObject(json);
        } catch (IllegalArgumentException e) {
            LOG.warn("Rejected webhook body: {}", e.getMessage());
            return ProcessingResult.failure(e.getMessage());
        }
        return processWebhook(payload, driverName);
    }

    /**
     * Process a parsed webhook payload.
     *
     * @param payload    JSON object as a map
     * @param driverName driver to use, or {@code null}/blank to auto-detect
     * @return processing summary, never {@code null}
     */
    public ProcessingResult processWebhook(Map<String, Object> payload, String driverName) {
        SourceDriver driver;
        if (driverName != null && !driverName.isBlank()) {
            try {
                driver = drivers.get(driverName);
            } catch (UnknownEntryException e) {
                LOG.warn(e.getMessage());
                return ProcessingResult.failure(e.getMessage());
            }
        } else {
            Optional<SourceDriver> detected = drivers.detect(payload);
            if (detected.isEmpty()) {
                LOG.warn("Could not detect driver for payload");
                return ProcessingResult.failure("Could not detect driver for payload");
            }
            driver = detected.get();
        }

        NormalizedPayload parsed;
        try {
            parsed = driver.parse(payload);
        } catch (InvalidPayloadException e) {
            LOG.warn("Driver '{}' rejected payload: {}", driver.name(), e.getMessage());
            return ProcessingResult.failure(e.getMessage());
        }
        return process(parsed);
    }

    /**
     * Apply a normalized payload to the store.
     *
     * @param payload parsed payload
     * @return processing summary, never {@code null}
     */
    public ProcessingResult process(NormalizedPayload payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        try {
            return store.inTransaction(() -> processBatch(payload));
        } catch (RuntimeException e) {
            LOG.error("Batch from '{}' rolled back", payload.getSource(), e);
            return ProcessingResult.failure("Batch failed: " + e.getMessage());
        }
    }

    private ProcessingResult processBatch(NormalizedPayload payload) {
        ProcessingResult result = new ProcessingResult();
        for (NormalizedAlert alert : payload.getAlerts()) {
            try {
                result.merge(store.inTransaction(() -> processAlert(alert, payload)));
            } catch (RuntimeException e) {
                LOG.warn("Error processing alert {} from '{}': {}",
                        alert.getFingerprint(), payload.getSource(), e.toString());
                result.addError("Error processing alert " + alert.getFingerprint() + ": " + e.getMessage());
            }
        }
        if (autoResolveIncidents) {
            sweepIncidents(result);
        }
        return result;
    }

    // ---------------------------------------------------------------
    // Per-alert transitions
    // ---------------------------------------------------------------

    private ProcessingResult processAlert(NormalizedAlert incoming, NormalizedPayload payload) {
        ProcessingResult delta = new ProcessingResult();
        Optional<Alert> existing = store.findFirstAlert(AlertQuery.byKey(incoming.getFingerprint(), payload.getSource()));

        if (existing.isEmpty()) {
            if (incoming.getStatus() == AlertStatus.FIRING) {
                createAlert(incoming, payload, delta);
            } else {
                LOG.debug("Ignoring resolved alert {} with no existing row", incoming.getFingerprint());
            }
            return delta;
        }

        Alert row = existing.get();
        if (row.getStatus() == AlertStatus.FIRING && incoming.getStatus() == AlertStatus.RESOLVED) {
            resolveAlert(row, incoming, delta);
        } else {
            refreshAlert(row, incoming, delta);
        }
        return delta;
    }

    private void createAlert(NormalizedAlert incoming, NormalizedPayload payload, ProcessingResult delta) {
        Alert row = Alert.from(incoming, payload.getSource());
        row.setGroupKey(GroupingKeys.of(incoming, payload.getGroupKey()));
        row = store.createAlert(row);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", row.getSource());
        details.put("severity", row.getSeverity().value());
        appendHistory(row, AlertHistory.CREATED, null, AlertStatus.FIRING, details);
        delta.alertCreated();
        LOG.info("Created alert: {} ({})", row.getName(), row.getFingerprint());

        if (autoCreateIncidents && row.getSeverity() != AlertSeverity.INFO) {
            attachToIncident(row, delta);
        }
    }

    private void refreshAlert(Alert row, NormalizedAlert incoming, ProcessingResult delta) {
        AlertSeverity oldSeverity = row.getSeverity();
        copyMutableFields(row, incoming);
        store.updateAlert(row);

        if (row.getStatus() == AlertStatus.FIRING && oldSeverity != incoming.getSeverity()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("old_severity", oldSeverity.value());
            details.put("new_severity", incoming.getSeverity().value());
            appendHistory(row, AlertHistory.SEVERITY_CHANGED, row.getStatus(), row.getStatus(), details);
        }
        delta.alertUpdated();
        LOG.debug("Updated alert: {} ({})", row.getName(), row.getFingerprint());
    }

    private void resolveAlert(Alert row, NormalizedAlert incoming, ProcessingResult delta) {
        Instant endedAt = incoming.getEndedAt() != null ? incoming.getEndedAt() : clock.instant();
        copyMutableFields(row, incoming);
        row.setStatus(AlertStatus.RESOLVED);
        row.setEndedAt(endedAt);
        store.updateAlert(row);

        appendHistory(row, AlertHistory.RESOLVED, AlertStatus.FIRING, AlertStatus.RESOLVED,
                Map.of("ended_at", endedAt.toString()));
        delta.alertResolved();
        LOG.info("Resolved alert: {} ({})", row.getName(), row.getFingerprint());
    }

    private static void copyMutableFields(Alert row, NormalizedAlert incoming) {
        row.setSeverity(incoming.getSeverity());
        row.setDescription(incoming.getDescription());
        row.setAnnotations(incoming.getAnnotations());
        row.setRawPayload(incoming.getRawPayload());
    }

    private void appendHistory(Alert row, String event, AlertStatus oldStatus, AlertStatus newStatus,
            Map<String, Object> details) {
        store.appendHistory(new AlertHistory(null, row.getId(), event,
                oldStatus != null ? oldStatus.value() : "",
                newStatus != null ? newStatus.value() : "",
                details, null));
    }

    // ---------------------------------------------------------------
    // Incidents
    // ---------------------------------------------------------------

    private void attachToIncident(Alert row, ProcessingResult delta) {
        Optional<Incident> existing = findActiveIncident(row);
        if (existing.isPresent()) {
            Incident incident = existing.get();
            row.setIncidentId(incident.getId());
            store.updateAlert(row);
            AlertSeverity merged = AlertSeverity.worse(incident.getSeverity(), row.getSeverity());
            if (merged != incident.getSeverity()) {
                incident.setSeverity(merged);
                store.updateIncident(incident);
            }
            delta.incidentUpdated();
            LOG.info("Attached alert {} to incident {} ({})", row.getFingerprint(), incident.getId(),
                    incident.getTitle());
            return;
        }

        Incident incident = new Incident();
        incident.setTitle(row.getName());
        incident.setSeverity(row.getSeverity());
        incident.setDescription(row.getDescription());
        incident.setStatus(IncidentStatus.OPEN);
        incident = store.createIncident(incident);

        row.setIncidentId(incident.getId());
        store.updateAlert(row);
        delta.incidentCreated();
        LOG.info("Created incident {}: {}", incident.getId(), incident.getTitle());
    }

    private Optional<Incident> findActiveIncident(Alert row) {
        for (Alert sibling : store.findAlerts(AlertQuery.builder().groupKey(row.getGroupKey()).build())) {
            if (sibling.getIncidentId() == null || sibling.getId().equals(row.getId())) {
                continue;
            }
            Optional<Incident> incident = store.findIncident(sibling.getIncidentId())
                    .filter(Incident::isActive);
            if (incident.isPresent()) {
                return incident;
            }
        }
        return Optional.empty();
    }

    private void sweepIncidents(ProcessingResult result) {
        for (Incident incident : store.findIncidents(ACTIVE)) {
            long attached = store.countAlerts(AlertQuery.attachedTo(incident.getId()));
            if (attached == 0) {
                continue;
            }
            long firing = store.countAlerts(AlertQuery.firingIn(incident.getId()));
            if (firing == 0) {
                incident.setStatus(IncidentStatus.RESOLVED);
                incident.setResolvedAt(clock.instant());
                incident.setSummary(AUTO_RESOLVE_SUMMARY);
                store.updateIncident(incident);
                result.incidentResolved();
                LOG.info("Auto-resolved incident {}: {}", incident.getId(), incident.getTitle());
            }
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public AlertStore store() {
        return store;
    }

    public DriverRegistry drivers() {
        return drivers;
    }

    public Clock clock() {
        return clock;
    }

    public boolean isAutoCreateIncidents() {
        return autoCreateIncidents;
    }

    public boolean isAutoResolveIncidents() {
        return autoResolveIncidents;
    }
}
