package com.alertrelay.core.lifecycle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregate outcome of {@link CheckAlertBridge#runChecksAndAlert}.
 *
 * @since 1.0.0
 */
public final class CheckAlertResult {

    private int checksRun;
    private final ProcessingResult processing = new ProcessingResult();
    private final List<String> errors = new ArrayList<>();

    void checkCompleted(ProcessingResult result) {
        checksRun++;
        processing.merge(result);
        errors.addAll(result.getErrors());
    }

    void addError(String error) {
        errors.add(error);
    }

    public int getChecksRun() {
        return checksRun;
    }

    public int getAlertsCreated() {
        return processing.getAlertsCreated();
    }

    public int getAlertsUpdated() {
        return processing.getAlertsUpdated();
    }

    public int getAlertsResolved() {
        return processing.getAlertsResolved();
    }

    public int getIncidentsCreated() {
        return processing.getIncidentsCreated();
    }

    public int getIncidentsUpdated() {
        return processing.getIncidentsUpdated();
    }

    public int getIncidentsResolved() {
        return processing.getIncidentsResolved();
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return "CheckAlertResult{checksRun=" + checksRun + ", " + processing + ", errors=" + errors + '}';
    }
}
