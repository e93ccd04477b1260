package com.alertrelay.core.store;

import com.alertrelay.core.model.Alert;
import com.alertrelay.core.model.AlertStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Filter and ordering for alert lookups.
 *
 * <p>
 * Every set criterion must match (logical AND). The receive-time range is
 * inclusive at the start and exclusive at the end. Results are ordered by
 * {@code receivedAt}, ties broken by id.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertQuery {

    /** Result ordering. */
    public enum Order {
        NEWEST_FIRST,
        OLDEST_FIRST
    }

    private static final Comparator<Alert> OLDEST_FIRST = Comparator
            .comparing(Alert::getReceivedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Alert::getId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final String fingerprint;
    private final String source;
    private final AlertStatus status;
    private final Long incidentId;
    private final String groupKey;
    private final Instant receivedFrom;
    private final Instant receivedBefore;
    private final Order order;

    private AlertQuery(Builder builder) {
        this.fingerprint = builder.fingerprint;
        this.source = builder.source;
        this.status = builder.status;
        this.incidentId = builder.incidentId;
        this.groupKey = builder.groupKey;
        this.receivedFrom = builder.receivedFrom;
        this.receivedBefore = builder.receivedBefore;
        this.order = Objects.requireNonNull(builder.order, "order must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return query matching the dedup key ({@code fingerprint}, {@code source})
     */
    public static AlertQuery byKey(String fingerprint, String source) {
        return builder().fingerprint(fingerprint).source(source).build();
    }

    public static AlertQuery firingIn(long incidentId) {
        return builder().incidentId(incidentId).status(AlertStatus.FIRING).build();
    }

    public static AlertQuery attachedTo(long incidentId) {
        return builder().incidentId(incidentId).build();
    }

    public static class Builder {
        private String fingerprint;
        private String source;
        private AlertStatus status;
        private Long incidentId;
        private String groupKey;
        private Instant receivedFrom;
        private Instant receivedBefore;
        private Order order = Order.OLDEST_FIRST;

        public Builder fingerprint(String fingerprint) {
            this.fingerprint = fingerprint;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder incidentId(Long incidentId) {
            this.incidentId = incidentId;
            return this;
        }

        public Builder groupKey(String groupKey) {
            this.groupKey = groupKey;
            return this;
        }

        /** Inclusive lower bound on {@code receivedAt}. */
        public Builder receivedFrom(Instant receivedFrom) {
            this.receivedFrom = receivedFrom;
            return this;
        }

        /** Exclusive upper bound on {@code receivedAt}. */
        public Builder receivedBefore(Instant receivedBefore) {
            this.receivedBefore = receivedBefore;
            return this;
        }

        public Builder order(Order order) {
            this.order = order;
            return this;
        }

        public AlertQuery build() {
            return new AlertQuery(this);
        }
    }

    /**
     * Evaluate the filter against one alert. Store implementations without a
     * native query language use this directly.
     */
    public boolean matches(Alert alert) {
        if (fingerprint != null && !fingerprint.equals(alert.getFingerprint())) {
            return false;
        }
        if (source != null && !source.equals(alert.getSource())) {
            return false;
        }
        if (status != null && status != alert.getStatus()) {
            return false;
        }
        if (incidentId != null && !incidentId.equals(alert.getIncidentId())) {
            return false;
        }
        if (groupKey != null && !groupKey.equals(alert.getGroupKey())) {
            return false;
        }
        Instant received = alert.getReceivedAt();
        if (receivedFrom != null && (received == null || received.isBefore(receivedFrom))) {
            return false;
        }
        return receivedBefore == null || (received != null && received.isBefore(receivedBefore));
    }

    public Comparator<Alert> comparator() {
        return order == Order.OLDEST_FIRST ? OLDEST_FIRST : OLDEST_FIRST.reversed();
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getSource() {
        return source;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public Long getIncidentId() {
        return incidentId;
    }

    public String getGroupKey() {
        return groupKey;
    }

    public Instant getReceivedFrom() {
        return receivedFrom;
    }

    public Instant getReceivedBefore() {
        return receivedBefore;
    }

    public Order getOrder() {
        return order;
    }

    @Override
    public String toString() {
        return "AlertQuery{fingerprint=" + fingerprint + ", source=" + source + ", status=" + status
                + ", incidentId=" + incidentId + ", groupKey=" + groupKey + ", order=" + order + '}';
    }
}
