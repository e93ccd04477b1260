package com.alertrelay.pipeline.intelligence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable remediation hint produced by an {@link AnalysisProvider}.
 *
 * @since 1.0.0
 */
public final class Recommendation {

    private final RecommendationType type;
    private final RecommendationPriority priority;
    private final String title;
    private final String description;
    private final Map<String, Object> details;
    private final List<String> actions;
    private final Long incidentId;

    private Recommendation(Builder b) {
        this.type = b.type;
        this.priority = b.priority;
        this.title = b.title;
        this.description = b.description;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(b.details));
        this.actions = List.copyOf(b.actions);
        this.incidentId = b.incidentId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public RecommendationType getType() {
        return type;
    }

    public RecommendationPriority getPriority() {
        return priority;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public List<String> getActions() {
        return actions;
    }

    public Long getIncidentId() {
        return incidentId;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type.value());
        map.put("priority", priority.value());
        map.put("title", title);
        map.put("description", description);
        map.put("details", new LinkedHashMap<>(details));
        map.put("actions", new ArrayList<>(actions));
        map.put("incident_id", incidentId);
        return map;
    }

    public static final class Builder {
        private RecommendationType type = RecommendationType.GENERAL;
        private RecommendationPriority priority = RecommendationPriority.MEDIUM;
        private String title;
        private String description = "";
        private final Map<String, Object> details = new LinkedHashMap<>();
        private final List<String> actions = new ArrayList<>();
        private Long incidentId;

        private Builder() {
        }

        public Builder type(RecommendationType type) {
            this.type = type;
            return this;
        }

        public Builder priority(RecommendationPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder detail(String key, Object value) {
            this.details.put(key, value);
            return this;
        }

        public Builder action(String action) {
            this.actions.add(action);
            return this;
        }

        public Builder incidentId(Long incidentId) {
            this.incidentId = incidentId;
            return this;
        }

        public Recommendation build() {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(priority, "priority must not be null");
            if (title == null || title.isBlank()) {
                throw new IllegalArgumentException("title must not be null or blank");
            }
            if (description == null) {
                description = "";
            }
            return new Recommendation(this);
        }
    }

    @Override
    public String toString() {
        return "Recommendation{" +
                "type=" + type +
                ", priority=" + priority +
                ", title='" + title + '\'' +
                '}';
    }
}
