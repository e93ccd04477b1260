package com.alertrelay.core.driver;

import com.alertrelay.core.model.NormalizedPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Base class carrying the behaviour shared by all concrete drivers.
 *
 * <p>
 * Subclasses implement {@link #accepts(PayloadView)} and
 * {@link #parseValid(PayloadView)}. This class guarantees the
 * {@link SourceDriver} contract around them: {@code validate} never throws
 * and {@code parse} rejects exactly what {@code validate} rejects.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class AbstractSourceDriver implements SourceDriver {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractSourceDriver.class);

    private final String name;
    private final String displayName;
    private final Clock clock;

    protected AbstractSourceDriver(String name, String displayName, Clock clock) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.displayName = Objects.requireNonNull(displayName, "displayName must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final boolean validate(Map<String, Object> payload) {
        if (payload == null) {
            return false;
        }
        try {
            return accepts(PayloadView.of(payload));
        } catch (RuntimeException e) {
            LOG.debug("Driver '{}' rejected payload after error: {}", name, e.toString());
            return false;
        }
    }

    @Override
    public final NormalizedPayload parse(Map<String, Object> payload) {
        if (!validate(payload)) {
            throw new InvalidPayloadException("Invalid " + displayName + " payload");
        }
        return parseValid(PayloadView.of(payload));
    }

    /**
     * Shape predicate. May assume a non-null payload; exceptions are treated
     * as a rejection.
     */
    protected abstract boolean accepts(PayloadView payload);

    /**
     * Parse a payload already accepted by {@link #accepts(PayloadView)}.
     */
    protected abstract NormalizedPayload parseValid(PayloadView payload);

    // ---------------------------------------------------------------
    // Helpers for subclasses
    // ---------------------------------------------------------------

    protected Instant now() {
        return clock.instant();
    }

    protected Clock clock() {
        return clock;
    }

    /**
     * @return parsed timestamp, or the driver clock's current instant
     */
    protected Instant timestampOrNow(Object raw) {
        return Timestamps.parse(raw).orElseGet(this::now);
    }

    /**
     * Vendors such as Alertmanager put an end time far in the future on alerts
     * that are still firing. Anything more than one calendar year ahead of the
     * driver clock is treated as "no end time".
     *
     * @return {@code endedAt}, or {@code null} when it lies too far ahead
     */
    protected Instant dropFarFuture(Instant endedAt) {
        if (endedAt == null) {
            return null;
        }
        int endYear = endedAt.atZone(ZoneOffset.UTC).getYear();
        int nowYear = now().atZone(ZoneOffset.UTC).getYear();
        return endYear > nowYear + 1 ? null : endedAt;
    }

    /**
     * @return {@code preferred} if non-empty, otherwise a generated fingerprint
     */
    protected String fingerprintOr(String preferred, Map<String, String> labels, String alertName) {
        if (preferred != null && !preferred.isEmpty()) {
            return preferred;
        }
        return generateFingerprint(labels, alertName);
    }

    protected static String lower(String value) {
        return value != null ? value.trim().toLowerCase(Locale.ROOT) : "";
    }

    protected static String upper(String value) {
        return value != null ? value.trim().toUpperCase(Locale.ROOT) : "";
    }

    protected static NormalizedPayload.Builder payloadOf(String source, PayloadView payload) {
        return NormalizedPayload.builder()
                .source(source)
                .rawPayload(payload.raw());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + name + "}";
    }
}
