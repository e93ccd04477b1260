package com.alertrelay.core.lifecycle;

import com.alertrelay.core.check.CheckResult;
import com.alertrelay.core.check.Checker;
import com.alertrelay.core.check.CheckerRegistry;
import com.alertrelay.core.driver.Fingerprints;
import com.alertrelay.core.model.AlertSeverity;
import com.alertrelay.core.model.AlertStatus;
import com.alertrelay.core.model.NormalizedAlert;
import com.alertrelay.core.model.NormalizedPayload;
import com.alertrelay.core.registry.UnknownEntryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Turns health-check results into alerts and feeds them through the
 * {@link AlertLifecycleEngine}.
 *
 * <p>
 * Every (checker, host) pair maps to one fingerprint, so a warning result
 * followed by an ok result for the same checker fires and then resolves the
 * same alert row. Alerts carry the {@code checker} and {@code hostname}
 * labels, which is what groups them into one incident per checker and host.
 * </p>
 *
 * @since 1.0.0
 */
public class CheckAlertBridge {

    private static final Logger LOG = LoggerFactory.getLogger(CheckAlertBridge.class);

    public static final String SOURCE = "server-checkers";

    private final AlertLifecycleEngine engine;
    private final String hostname;

    public CheckAlertBridge(AlertLifecycleEngine engine, String hostname) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.hostname = Objects.requireNonNull(hostname, "hostname must not be null");
    }

    /**
     * Convert one result into a normalized alert.
     *
     * @param result      checker output
     * @param extraLabels labels merged over the defaults, may be {@code null}
     */
    public NormalizedAlert toAlert(CheckResult result, Map<String, String> extraLabels) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("hostname", hostname);
        labels.put("checker", result.getCheckerName());
        if (extraLabels != null) {
            labels.putAll(extraLabels);
        }
        Map<String, String> annotations = new LinkedHashMap<>();
        result.getMetrics().forEach((key, value) -> {
            if (value instanceof String || value instanceof Number || value instanceof Boolean) {
                labels.put("metric_" + key, String.valueOf(value));
            }
            annotations.put(key, String.valueOf(value));
        });

        String description = result.getMessage();
        if (result.getError() != null && !result.getError().isEmpty()) {
            description = description + "\nError: " + result.getError();
        }

        AlertStatus status = result.isOk() ? AlertStatus.RESOLVED : AlertStatus.FIRING;
        Instant now = engine.clock().instant();

        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("checker_name", result.getCheckerName());
        raw.put("status", result.getStatus().value());
        raw.put("message", result.getMessage());
        raw.put("metrics", result.getMetrics());
        raw.put("error", result.getError());

        return NormalizedAlert.builder()
                .fingerprint(fingerprint(result.getCheckerName()))
                .name(result.getCheckerName().toUpperCase(Locale.ROOT) + " Check Alert")
                .status(status)
                .severity(severityOf(result))
                .description(description)
                .labels(labels)
                .annotations(annotations)
                .startedAt(now)
                .endedAt(status == AlertStatus.RESOLVED ? now : null)
                .rawPayload(raw)
                .build();
    }

    /**
     * @return 16 hex characters derived from {@code checker:hostname}
     */
    public String fingerprint(String checkerName) {
        return Fingerprints.sha256Prefix(checkerName + ":" + hostname);
    }

    public ProcessingResult processCheckResult(CheckResult result, Map<String, String> extraLabels) {
        NormalizedPayload payload = NormalizedPayload.builder()
                .source(SOURCE)
                .alert(toAlert(result, extraLabels))
                .build();
        return engine.process(payload);
    }

    /**
     * Run checkers and push every result through the engine.
     *
     * @param registry     checker registry
     * @param checkerNames names to run; {@code null} runs all enabled checkers
     * @param extraLabels  labels added to every alert, may be {@code null}
     * @return aggregate counts; per-checker failures are recorded, not thrown
     */
    public CheckAlertResult runChecksAndAlert(CheckerRegistry registry, List<String> checkerNames,
            Map<String, String> extraLabels) {
        CheckAlertResult aggregate = new CheckAlertResult();
        List<String> names = checkerNames != null ? checkerNames : registry.enabledNames();
        for (String name : names) {
            try {
                Checker checker = registry.create(name);
                CheckResult result = checker.check();
                aggregate.checkCompleted(processCheckResult(result, extraLabels));
            } catch (UnknownEntryException e) {
                aggregate.addError(e.getMessage());
            } catch (RuntimeException e) {
                LOG.warn("Checker '{}' failed", name, e);
                aggregate.addError(name + ": " + e.getMessage());
            }
        }
        return aggregate;
    }

    static AlertSeverity severityOf(CheckResult result) {
        return switch (result.getStatus()) {
            case CRITICAL -> AlertSeverity.CRITICAL;
            case OK -> AlertSeverity.INFO;
            case WARNING, UNKNOWN -> AlertSeverity.WARNING;
        };
    }

    public String hostname() {
        return hostname;
    }
}
