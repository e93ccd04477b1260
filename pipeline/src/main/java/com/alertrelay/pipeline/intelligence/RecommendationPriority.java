package com.alertrelay.pipeline.intelligence;

import java.util.Locale;

/**
 * Urgency of a {@link Recommendation}, lowest first.
 *
 * @since 1.0.0
 */
public enum RecommendationPriority {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    RecommendationPriority(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * @return the matching priority, {@code null} when unrecognized
     */
    public static RecommendationPriority fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (RecommendationPriority p : values()) {
            if (p.value.equals(v)) {
                return p;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
