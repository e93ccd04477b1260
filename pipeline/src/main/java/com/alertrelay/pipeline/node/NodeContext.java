package com.alertrelay.pipeline.node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-run state shared by the nodes of one pipeline execution.
 *
 * <h3>Previous outputs</h3>
 * <p>
 * Outputs are appended in execution order and never replaced: recording a
 * second output for the same node id is a programming error. Looking up a
 * node that has not run (or was skipped before recording) yields an empty
 * map.
 * </p>
 *
 * <h3>Incident propagation</h3>
 * <p>
 * The incident id starts as whatever the caller supplied and may be set by
 * the executor once an ingest node reports one. Later nodes read it from
 * here.
 * </p>
 *
 * @since 1.0.0
 */
public final class NodeContext {

    private final String traceId;
    private final String runId;
    private final Map<String, Object> payload;
    private final String source;
    private final String environment;
    private final Map<String, Map<String, Object>> previousOutputs = new LinkedHashMap<>();
    private Long incidentId;

    public NodeContext(String traceId, String runId, Map<String, Object> payload,
            String source, String environment, Long incidentId) {
        this.traceId = Objects.requireNonNull(traceId, "traceId must not be null");
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
        this.payload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Map.of();
        this.source = source;
        this.environment = environment != null ? environment : "production";
        this.incidentId = incidentId;
    }

    /**
     * Append the output of a node that just ran.
     *
     * @throws IllegalStateException if an output is already recorded for {@code nodeId}
     */
    public void recordOutput(String nodeId, Map<String, Object> output) {
        if (previousOutputs.containsKey(nodeId)) {
            throw new IllegalStateException("Output already recorded for node: " + nodeId);
        }
        previousOutputs.put(nodeId, output != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(output))
                : Map.of());
    }

    /**
     * @return the output of {@code nodeId}, or an empty map if it has none
     */
    public Map<String, Object> previous(String nodeId) {
        return previousOutputs.getOrDefault(nodeId, Map.of());
    }

    /**
     * @return outputs in execution order
     */
    public Map<String, Map<String, Object>> previousOutputs() {
        return Collections.unmodifiableMap(previousOutputs);
    }

    public String getTraceId() {
        return traceId;
    }

    public String getRunId() {
        return runId;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public String getSource() {
        return source;
    }

    public String getEnvironment() {
        return environment;
    }

    public Long getIncidentId() {
        return incidentId;
    }

    public void setIncidentId(Long incidentId) {
        this.incidentId = incidentId;
    }

    @Override
    public String toString() {
        return "NodeContext{" +
                "traceId='" + traceId + '\'' +
                ", runId='" + runId + '\'' +
                ", source='" + source + '\'' +
                ", environment='" + environment + '\'' +
                ", incidentId=" + incidentId +
                ", previousOutputs=" + previousOutputs.keySet() +
                '}';
    }
}
