package com.alertrelay.core.store;

import com.alertrelay.core.model.Alert;
import com.alertrelay.core.model.AlertHistory;
import com.alertrelay.core.model.Incident;
import com.alertrelay.core.model.IncidentStatus;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Persistence boundary for alerts, incidents and alert history.
 *
 * <h3>Entity ownership</h3>
 * <p>
 * Implementations return detached copies. Callers mutate the copy and write
 * it back with the matching {@code update} method.
 * </p>
 *
 * <h3>Transactions</h3>
 * <p>
 * {@link #inTransaction(Supplier)} runs the work atomically: if it throws,
 * every write made inside it is undone and the exception is rethrown.
 * Nested calls behave as savepoints, so an inner failure rolls back only the
 * inner work.
 * </p>
 *
 * <p>
 * All methods may throw {@link StoreException}.
 * </p>
 *
 * @since 1.0.0
 */
public interface AlertStore {

    // ---------------------------------------------------------------
    // Alerts
    // ---------------------------------------------------------------

    /**
     * Insert a new alert. The store assigns {@code id}, {@code receivedAt} and
     * {@code updatedAt}.
     *
     * @return the saved row
     */
    Alert createAlert(Alert alert);

    /**
     * @throws StoreException if the alert has no id or no longer exists
     */
    Alert updateAlert(Alert alert);

    Optional<Alert> findAlert(long id);

    List<Alert> findAlerts(AlertQuery query);

    default Optional<Alert> findFirstAlert(AlertQuery query) {
        return findAlerts(query).stream().findFirst();
    }

    default long countAlerts(AlertQuery query) {
        return findAlerts(query).size();
    }

    // ---------------------------------------------------------------
    // Incidents
    // ---------------------------------------------------------------

    Incident createIncident(Incident incident);

    Incident updateIncident(Incident incident);

    Optional<Incident> findIncident(long id);

    /**
     * @param statuses statuses to include; empty means all
     * @return matching incidents, oldest first
     */
    List<Incident> findIncidents(Set<IncidentStatus> statuses);

    // ---------------------------------------------------------------
    // History
    // ---------------------------------------------------------------

    AlertHistory appendHistory(AlertHistory entry);

    List<AlertHistory> historyOf(long alertId);

    // ---------------------------------------------------------------
    // Transactions
    // ---------------------------------------------------------------

    <T> T inTransaction(Supplier<T> work);
}
