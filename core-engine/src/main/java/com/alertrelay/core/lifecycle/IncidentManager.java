package com.alertrelay.core.lifecycle;

import com.alertrelay.core.model.Alert;
import com.alertrelay.core.model.Incident;
import com.alertrelay.core.model.IncidentStatus;
import com.alertrelay.core.store.AlertQuery;
import com.alertrelay.core.store.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Operator-driven incident transitions: acknowledge, resolve, close and
 * notes.
 *
 * @since 1.0.0
 */
public class IncidentManager {

    private static final Logger LOG = LoggerFactory.getLogger(IncidentManager.class);

    private final AlertStore store;
    private final Clock clock;

    public IncidentManager(AlertStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param acknowledgedBy operator identifier, recorded when non-blank
     * @throws IllegalArgumentException if the incident does not exist
     */
    public Incident acknowledge(long incidentId, String acknowledgedBy) {
        Incident incident = mutate(incidentId, i -> {
            i.setStatus(IncidentStatus.ACKNOWLEDGED);
            i.setAcknowledgedAt(clock.instant());
            putIfNotBlank(i, "acknowledged_by", acknowledgedBy);
        });
        LOG.info("Incident acknowledged: {}", incident.getTitle());
        return incident;
    }

    /**
     * @throws IllegalArgumentException if the incident does not exist
     * @throws IllegalStateException    if any attached alert is still firing
     */
    public Incident resolve(long incidentId, String summary, String resolvedBy) {
        Incident incident = mutate(incidentId, i -> {
            long firing = store.countAlerts(AlertQuery.firingIn(incidentId));
            if (firing > 0) {
                throw new IllegalStateException("Incident " + incidentId + " still has "
                        + firing + " firing alert(s)");
            }
            i.setStatus(IncidentStatus.RESOLVED);
            i.setResolvedAt(clock.instant());
            if (summary != null && !summary.isBlank()) {
                i.setSummary(summary);
            }
            putIfNotBlank(i, "resolved_by", resolvedBy);
        });
        LOG.info("Incident resolved: {}", incident.getTitle());
        return incident;
    }

    public Incident close(long incidentId) {
        Incident incident = mutate(incidentId, i -> {
            i.setStatus(IncidentStatus.CLOSED);
            i.setClosedAt(clock.instant());
        });
        LOG.info("Incident closed: {}", incident.getTitle());
        return incident;
    }

    /**
     * Append a note under metadata {@code notes} as {text, author, timestamp}.
     */
    public Incident addNote(long incidentId, String note, String author) {
        Objects.requireNonNull(note, "note must not be null");
        return mutate(incidentId, i -> {
            List<Object> notes = new ArrayList<>();
            if (i.getMetadata().get("notes") instanceof List<?> existing) {
                notes.addAll(existing);
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("text", note);
            entry.put("author", author != null ? author : "");
            entry.put("timestamp", Instant.now(clock).toString());
            notes.add(entry);
            i.getMetadata().put("notes", notes);
        });
    }

    public List<Incident> openIncidents() {
        return store.findIncidents(Set.of(IncidentStatus.OPEN, IncidentStatus.ACKNOWLEDGED));
    }

    public List<Alert> alertsOf(long incidentId) {
        return store.findAlerts(AlertQuery.attachedTo(incidentId));
    }

    private Incident mutate(long incidentId, Consumer<Incident> change) {
        return store.inTransaction(() -> {
            Incident incident = store.findIncident(incidentId)
                    .orElseThrow(() -> new IllegalArgumentException("Incident not found: " + incidentId));
            change.accept(incident);
            return store.updateIncident(incident);
        });
    }

    private static void putIfNotBlank(Incident incident, String key, String value) {
        if (value != null && !value.isBlank()) {
            incident.getMetadata().put(key, value);
        }
    }
}
