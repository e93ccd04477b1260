package com.alertrelay.core.registry;

import java.util.List;

/**
 * Thrown when a name is looked up in a {@link NamedRegistry} that has no entry
 * for it. The message names the kind of entry and lists the available names.
 *
 * @since 1.0.0
 */
public class UnknownEntryException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String kind;
    private final String requested;

    public UnknownEntryException(String kind, String requested, List<String> available) {
        super("Unknown " + kind + ": " + requested + ". Available: " + String.join(", ", available));
        this.kind = kind;
        this.requested = requested;
    }

    /**
     * @return entry kind, e.g. {@code driver} or {@code checker}
     */
    public String getKind() {
        return kind;
    }

    public String getRequested() {
        return requested;
    }
}
