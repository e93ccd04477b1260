package com.alertrelay.pipeline.intelligence;

/**
 * Problem area a {@link Recommendation} addresses.
 *
 * @since 1.0.0
 */
public enum RecommendationType {

    MEMORY("memory"),
    DISK("disk"),
    CPU("cpu"),
    PROCESS("process"),
    NETWORK("network"),
    GENERAL("general");

    private final String value;

    RecommendationType(String value) {
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
