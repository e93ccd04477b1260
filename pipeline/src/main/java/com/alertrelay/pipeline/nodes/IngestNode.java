package com.alertrelay.pipeline.nodes;

import com.alertrelay.core.driver.PayloadView;
import com.alertrelay.core.lifecycle.AlertLifecycleEngine;
import com.alertrelay.core.lifecycle.ProcessingResult;
import com.alertrelay.core.model.Alert;
import com.alertrelay.core.store.AlertQuery;
import com.alertrelay.pipeline.node.AbstractPipelineNode;
import com.alertrelay.pipeline.node.NodeContext;
import com.alertrelay.pipeline.node.NodeResult;
import com.alertrelay.pipeline.node.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Feeds the run's webhook payload through the lifecycle engine.
 *
 * <h3>Input</h3>
 * <p>
 * The alert payload is the context payload's {@code payload} entry when the
 * context carries one, otherwise the whole context payload. The driver comes
 * from config {@code driver}, then from the payload's {@code driver} entry,
 * and is auto-detected when neither is set.
 * </p>
 *
 * <h3>Output</h3>
 * <p>
 * The engine's counts plus {@code source}. When the newest alert received
 * during this node's run belongs to an incident, also {@code incident_id},
 * {@code alert_fingerprint} and {@code severity}; the executor propagates the
 * incident id to later nodes.
 * </p>
 *
 * @since 1.0.0
 */
public class IngestNode extends AbstractPipelineNode {

    private static final Logger LOG = LoggerFactory.getLogger(IngestNode.class);

    private final AlertLifecycleEngine engine;

    public IngestNode(AlertLifecycleEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    @Override
    public NodeType type() {
        return NodeType.INGEST;
    }

    @Override
    protected void run(NodeContext context, Map<String, Object> config, NodeResult result) {
        Map<String, Object> contextPayload = context.getPayload();
        Object alertPayload = contextPayload.containsKey("payload")
                ? contextPayload.get("payload")
                : contextPayload;
        if (!(alertPayload instanceof Map<?, ?> raw)) {
            result.addError("payload must be a JSON object");
            return;
        }
        Map<String, Object> payload = PayloadView.of(raw).raw();

        String driver = configString(config, "driver");
        if (driver == null && contextPayload.get("driver") instanceof String s && !s.isBlank()) {
            driver = s;
        }

        Instant before = engine.clock().instant();
        ProcessingResult processed = engine.processWebhook(payload, driver);

        result.put("alerts_created", processed.getAlertsCreated())
                .put("alerts_updated", processed.getAlertsUpdated())
                .put("alerts_resolved", processed.getAlertsResolved())
                .put("incidents_created", processed.getIncidentsCreated())
                .put("incidents_updated", processed.getIncidentsUpdated())
                .put("incidents_resolved", processed.getIncidentsResolved())
                .put("source", context.getSource());
        processed.getErrors().forEach(result::addError);

        Optional<Alert> latest = engine.store().findFirstAlert(AlertQuery.builder()
                .receivedFrom(before)
                .order(AlertQuery.Order.NEWEST_FIRST)
                .build());
        latest.filter(alert -> alert.getIncidentId() != null).ifPresent(alert -> {
            result.put("incident_id", alert.getIncidentId())
                    .put("alert_fingerprint", alert.getFingerprint())
                    .put("severity", alert.getSeverity().value());
            LOG.debug("Ingest linked run {} to incident {}", context.getRunId(), alert.getIncidentId());
        });
    }

    @Override
    public List<String> validateConfig(Map<String, Object> config) {
        Object driver = config != null ? config.get("driver") : null;
        if (driver != null && !(driver instanceof String)) {
            return List.of("'driver' must be a string");
        }
        return List.of();
    }
}
