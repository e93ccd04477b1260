package com.alertrelay.core.store;

import com.alertrelay.core.model.Alert;
import com.alertrelay.core.model.AlertHistory;
import com.alertrelay.core.model.Incident;
import com.alertrelay.core.model.IncidentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Reference {@link AlertStore} backed by in-process maps.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Every public method synchronizes on the store, so concurrent payloads are
 * fully serialized. This closes the lookup-then-write window for this
 * implementation only; a database-backed store needs a unique constraint on
 * ({@code fingerprint}, {@code source}) for the same guarantee.
 * </p>
 *
 * <h3>Transactions</h3>
 * <p>
 * {@link #inTransaction(Supplier)} snapshots all tables before running the
 * work and restores the snapshot if the work throws. Snapshots nest, which
 * gives savepoint semantics for free.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryAlertStore implements AlertStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryAlertStore.class);

    private final Clock clock;

    private Map<Long, Alert> alerts = new LinkedHashMap<>();
    private Map<Long, Incident> incidents = new LinkedHashMap<>();
    private List<AlertHistory> history = new ArrayList<>();
    private long alertSeq;
    private long incidentSeq;
    private long historySeq;

    public InMemoryAlertStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Alerts
    // ---------------------------------------------------------------

    @Override
    public synchronized Alert createAlert(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        Alert row = alert.copy();
        Instant now = clock.instant();
        row.setId(++alertSeq);
        row.setReceivedAt(now);
        row.setUpdatedAt(now);
        alerts.put(row.getId(), row);
        return row.copy();
    }

    @Override
    public synchronized Alert updateAlert(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        if (alert.getId() == null || !alerts.containsKey(alert.getId())) {
            throw new StoreException("Alert does not exist: " + alert.getId());
        }
        Alert row = alert.copy();
        row.setUpdatedAt(clock.instant());
        alerts.put(row.getId(), row);
        return row.copy();
    }

    @Override
    public synchronized Optional<Alert> findAlert(long id) {
        return Optional.ofNullable(alerts.get(id)).map(Alert::copy);
    }

    @Override
    public synchronized List<Alert> findAlerts(AlertQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        return alerts.values().stream()
                .filter(query::matches)
                .sorted(query.comparator())
                .map(Alert::copy)
                .toList();
    }

    // ---------------------------------------------------------------
    // Incidents
    // ---------------------------------------------------------------

    @Override
    public synchronized Incident createIncident(Incident incident) {
        Objects.requireNonNull(incident, "incident must not be null");
        Incident row = incident.copy();
        Instant now = clock.instant();
        row.setId(++incidentSeq);
        if (row.getCreatedAt() == null) {
            row.setCreatedAt(now);
        }
        row.setUpdatedAt(now);
        incidents.put(row.getId(), row);
        return row.copy();
    }

    @Override
    public synchronized Incident updateIncident(Incident incident) {
        Objects.requireNonNull(incident, "incident must not be null");
        if (incident.getId() == null || !incidents.containsKey(incident.getId())) {
            throw new StoreException("Incident does not exist: " + incident.getId());
        }
        Incident row = incident.copy();
        row.setUpdatedAt(clock.instant());
        incidents.put(row.getId(), row);
        return row.copy();
    }

    @Override
    public synchronized Optional<Incident> findIncident(long id) {
        return Optional.ofNullable(incidents.get(id)).map(Incident::copy);
    }

    @Override
    public synchronized List<Incident> findIncidents(Set<IncidentStatus> statuses) {
        return incidents.values().stream()
                .filter(i -> statuses == null || statuses.isEmpty() || statuses.contains(i.getStatus()))
                .sorted(Comparator.comparing(Incident::getId))
                .map(Incident::copy)
                .toList();
    }

    // ---------------------------------------------------------------
    // History
    // ---------------------------------------------------------------

    @Override
    public synchronized AlertHistory appendHistory(AlertHistory entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        AlertHistory saved = entry.withIdentity(++historySeq, clock.instant());
        history.add(saved);
        return saved;
    }

    @Override
    public synchronized List<AlertHistory> historyOf(long alertId) {
        return history.stream()
                .filter(h -> h.getAlertId() == alertId)
                .toList();
    }

    // ---------------------------------------------------------------
    // Transactions
    // ---------------------------------------------------------------

    @Override
    public synchronized <T> T inTransaction(Supplier<T> work) {
        Objects.requireNonNull(work, "work must not be null");
        Snapshot snapshot = new Snapshot();
        try {
            return work.get();
        } catch (RuntimeException | Error e) {
            LOG.debug("Rolling back transaction: {}", e.toString());
            snapshot.restore();
            throw e;
        }
    }

    /** Copy of every table and sequence at one point in time. */
    private final class Snapshot {
        private final Map<Long, Alert> alertsCopy = new LinkedHashMap<>();
        private final Map<Long, Incident> incidentsCopy = new LinkedHashMap<>();
        private final List<AlertHistory> historyCopy = new ArrayList<>(history);
        private final long alertSeqCopy = alertSeq;
        private final long incidentSeqCopy = incidentSeq;
        private final long historySeqCopy = historySeq;

        Snapshot() {
            alerts.forEach((id, a) -> alertsCopy.put(id, a.copy()));
            incidents.forEach((id, i) -> incidentsCopy.put(id, i.copy()));
        }

        void restore() {
            alerts = alertsCopy;
            incidents = incidentsCopy;
            history = historyCopy;
            alertSeq = alertSeqCopy;
            incidentSeq = incidentSeqCopy;
            historySeq = historySeqCopy;
        }
    }
}
