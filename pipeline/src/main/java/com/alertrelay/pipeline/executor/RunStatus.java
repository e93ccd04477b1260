package com.alertrelay.pipeline.executor;

/**
 * Terminal state of a pipeline run.
 *
 * @since 1.0.0
 */
public enum RunStatus {

    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
