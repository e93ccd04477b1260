package com.alertrelay.pipeline.node;

import java.util.Locale;
import java.util.Optional;

/**
 * The node kinds a pipeline definition may reference.
 *
 * @since 1.0.0
 */
public enum NodeType {

    INGEST("ingest", "Ingest"),
    CONTEXT("context", "Context"),
    INTELLIGENCE("intelligence", "Intelligence"),
    NOTIFY("notify", "Notify"),
    TRANSFORM("transform", "Transform");

    private final String value;
    private final String displayName;

    NodeType(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    /**
     * @return the name used in pipeline definitions, e.g. {@code ingest}
     */
    public String value() {
        return value;
    }

    /**
     * @return capitalized name used as the prefix of fault messages
     */
    public String displayName() {
        return displayName;
    }

    public static Optional<NodeType> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (NodeType type : values()) {
            if (type.value.equals(v)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}
