package com.alertrelay.core.lifecycle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one {@link AlertLifecycleEngine} call.
 *
 * <p>
 * Counts only reflect work that was committed; errors are accumulated rather
 * than thrown so a partially failed payload still yields a complete summary.
 * </p>
 *
 * @since 1.0.0
 */
public final class ProcessingResult {

    private int alertsCreated;
    private int alertsUpdated;
    private int alertsResolved;
    private int incidentsCreated;
    private int incidentsUpdated;
    private int incidentsResolved;
    private final List<String> errors = new ArrayList<>();

    public static ProcessingResult failure(String error) {
        ProcessingResult result = new ProcessingResult();
        result.addError(error);
        return result;
    }

    void alertCreated() {
        alertsCreated++;
    }

    void alertUpdated() {
        alertsUpdated++;
    }

    void alertResolved() {
        alertsResolved++;
    }

    void incidentCreated() {
        incidentsCreated++;
    }

    void incidentUpdated() {
        incidentsUpdated++;
    }

    void incidentResolved() {
        incidentsResolved++;
    }

    public void addError(String error) {
        errors.add(error);
    }

    /**
     * Add another result's counts and errors into this one.
     */
    public void merge(ProcessingResult other) {
        alertsCreated += other.alertsCreated;
        alertsUpdated += other.alertsUpdated;
        alertsResolved += other.alertsResolved;
        incidentsCreated += other.incidentsCreated;
        incidentsUpdated += other.incidentsUpdated;
        incidentsResolved += other.incidentsResolved;
        errors.addAll(other.errors);
    }

    public int getAlertsCreated() {
        return alertsCreated;
    }

    public int getAlertsUpdated() {
        return alertsUpdated;
    }

    public int getAlertsResolved() {
        return alertsResolved;
    }

    public int getIncidentsCreated() {
        return incidentsCreated;
    }

    public int getIncidentsUpdated() {
        return incidentsUpdated;
    }

    public int getIncidentsResolved() {
        return incidentsResolved;
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public int totalProcessed() {
        return alertsCreated + alertsUpdated + alertsResolved;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @return counts and errors under snake_case keys, as reported in pipeline output
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("alerts_created", alertsCreated);
        map.put("alerts_updated", alertsUpdated);
        map.put("alerts_resolved", alertsResolved);
        map.put("incidents_created", incidentsCreated);
        map.put("incidents_updated", incidentsUpdated);
        map.put("incidents_resolved", incidentsResolved);
        map.put("total_processed", totalProcessed());
        map.put("errors", List.copyOf(errors));
        return map;
    }

    @Override
    public String toString() {
        return "ProcessingResult{created=" + alertsCreated + ", updated=" + alertsUpdated
                + ", resolved=" + alertsResolved + ", incidentsCreated=" + incidentsCreated
                + ", incidentsUpdated=" + incidentsUpdated + ", incidentsResolved=" + incidentsResolved
                + ", errors=" + errors + '}';
    }
}
