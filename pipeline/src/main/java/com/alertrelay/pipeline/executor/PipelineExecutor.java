package com.alertrelay.pipeline.executor;

import com.alertrelay.pipeline.config.NodeDefinition;
import com.alertrelay.pipeline.config.PipelineDefinition;
import com.alertrelay.pipeline.node.NodeContext;
import com.alertrelay.pipeline.node.NodeResult;
import com.alertrelay.pipeline.node.NodeRegistry;
import com.alertrelay.pipeline.node.NodeType;
import com.alertrelay.pipeline.node.PipelineNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Runs a {@link PipelineDefinition} node by node.
 *
 * <h3>Execution model</h3>
 * <ul>
 * <li>Nodes run strictly in definition order on the calling thread.</li>
 * <li>A node is skipped when a node listed in its {@code skipIfErrors}, or
 * named by its {@code skipIfCondition} ({@code <node>.has_errors}), reported
 * errors.</li>
 * <li>Each executed node's output is appended to the shared
 * {@link NodeContext}; an {@code incident_id} from an ingest node becomes the
 * run's incident.</li>
 * <li>A failing node stops the run only when it is marked
 * {@code required}; otherwise its errors are kept and the run goes on.</li>
 * </ul>
 *
 * <p>
 * Exceptions escaping a node are logged and turned into an error result, so
 * {@link #execute} itself does not throw for node faults.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineExecutor.class);

    private static final String HAS_ERRORS_SUFFIX = ".has_errors";

    private final NodeRegistry nodes;

    public PipelineExecutor(NodeRegistry nodes) {
        this.nodes = Objects.requireNonNull(nodes, "nodes must not be null");
    }

    /**
     * Check a definition against the registered node types.
     *
     * @return every problem found; empty when the definition can run
     */
    public List<String> validate(PipelineDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        List<String> errors = new ArrayList<>(definition.structuralErrors());
        for (NodeDefinition node : definition.getNodes()) {
            if (node == null || node.getId() == null || node.getType() == null) {
                continue;
            }
            if (!nodes.contains(node.getType())) {
                errors.add("Node " + node.getId() + " has unknown type: " + node.getType()
                        + ". Available: " + nodes.types());
                continue;
            }
            for (String error : nodes.create(node.getType()).validateConfig(node.effectiveConfig())) {
                errors.add("Node " + node.getId() + ": " + error);
            }
        }
        return errors;
    }

    public PipelineRunResult execute(PipelineDefinition definition, Map<String, Object> payload, String source) {
        return execute(definition, payload, source, null, null, null);
    }

    /**
     * Run every node of {@code definition}.
     *
     * @param traceId     correlation id; generated when {@code null}
     * @param environment deployment environment, e.g. {@code production}
     * @param incidentId  incident the run starts with, may be {@code null}
     * @return the run summary, never {@code null}
     */
    public PipelineRunResult execute(PipelineDefinition definition, Map<String, Object> payload,
            String source, String traceId, String environment, Long incidentId) {
        Objects.requireNonNull(definition, "definition must not be null");
        long start = System.nanoTime();
        NodeContext context = new NodeContext(
                traceId != null ? traceId : UUID.randomUUID().toString(),
                UUID.randomUUID().toString(),
                payload, source, environment, incidentId);
        PipelineRunResult.Builder run = PipelineRunResult.builder()
                .traceId(context.getTraceId())
                .runId(context.getRunId())
                .definition(definition.getName(), definition.getVersion());

        List<String> invalid = validate(definition);
        if (!invalid.isEmpty()) {
            LOG.warn("Pipeline '{}' rejected: {}", definition.getName(), invalid);
            return run.failed("Invalid pipeline definition: " + String.join("; ", invalid))
                    .incidentId(incidentId)
                    .durationMs(elapsedMs(start))
                    .build();
        }

        LOG.info("Pipeline '{}' v{} started, run={} trace={}",
                definition.getName(), definition.getVersion(), context.getRunId(), context.getTraceId());
        Map<String, NodeResult> results = new LinkedHashMap<>();

        for (NodeDefinition node : definition.getNodes()) {
            String skipReason = skipReason(node, results);
            if (skipReason != null) {
                LOG.info("Skipping node '{}': {}", node.getId(), skipReason);
                NodeResult skipped = NodeResult.skipped(node.getId(), node.getType(), skipReason);
                results.put(node.getId(), skipped);
                run.skipped(skipped);
                continue;
            }

            NodeResult result = runNode(node, context);
            results.put(node.getId(), result);
            run.executed(result);
            context.recordOutput(node.getId(), result.getOutput());

            if (NodeType.INGEST.value().equals(node.getType())
                    && result.getOutput().get("incident_id") instanceof Number id) {
                context.setIncidentId(id.longValue());
            }

            if (result.hasErrors()) {
                if (node.isRequired()) {
                    String error = "Node " + node.getId() + " failed: " + String.join("; ", result.getErrors());
                    LOG.warn("Pipeline '{}' stopped: {}", definition.getName(), error);
                    run.failed(error);
                    break;
                }
                LOG.warn("Node '{}' reported errors: {}", node.getId(), result.getErrors());
            }
        }

        PipelineRunResult finished = run.incidentId(context.getIncidentId())
                .durationMs(elapsedMs(start))
                .build();
        LOG.info("Pipeline '{}' {} in {} ms, executed={} skipped={}",
                definition.getName(), finished.getStatus(), Math.round(finished.getDurationMs()),
                finished.getExecutedNodes(), finished.getSkippedNodes());
        return finished;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private NodeResult runNode(NodeDefinition node, NodeContext context) {
        long start = System.nanoTime();
        try {
            PipelineNode handler = nodes.create(node.getType());
            return handler.execute(context, node.effectiveConfig());
        } catch (RuntimeException e) {
            LOG.error("Node '{}' threw", node.getId(), e);
            NodeResult failed = new NodeResult(node.getId(), node.getType());
            failed.addError(e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            failed.setDurationMs(elapsedMs(start));
            return failed;
        }
    }

    private static String skipReason(NodeDefinition node, Map<String, NodeResult> results) {
        for (String upstream : node.getSkipIfErrors()) {
            NodeResult result = results.get(upstream);
            if (result != null && result.hasErrors()) {
                return "Node " + upstream + " had errors";
            }
        }
        String condition = node.getSkipIfCondition();
        if (condition != null && condition.endsWith(HAS_ERRORS_SUFFIX)) {
            String upstream = condition.substring(0, condition.length() - HAS_ERRORS_SUFFIX.length());
            NodeResult result = results.get(upstream);
            if (result != null && result.hasErrors()) {
                return "Condition met: " + condition;
            }
        }
        return null;
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
