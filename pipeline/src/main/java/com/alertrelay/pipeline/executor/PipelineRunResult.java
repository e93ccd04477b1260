package com.alertrelay.pipeline.executor;

import com.alertrelay.pipeline.node.NodeResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable summary of one pipeline run.
 *
 * @since 1.0.0
 */
public final class PipelineRunResult {

    private final String traceId;
    private final String runId;
    private final String definitionName;
    private final String definitionVersion;
    private final RunStatus status;
    private final Long incidentId;
    private final List<String> executedNodes;
    private final List<String> skippedNodes;
    private final Map<String, NodeResult> nodeResults;
    private final double durationMs;
    private final String error;

    private PipelineRunResult(Builder b) {
        this.traceId = b.traceId;
        this.runId = b.runId;
        this.definitionName = b.definitionName;
        this.definitionVersion = b.definitionVersion;
        this.status = b.status;
        this.incidentId = b.incidentId;
        this.executedNodes = List.copyOf(b.executedNodes);
        this.skippedNodes = List.copyOf(b.skippedNodes);
        this.nodeResults = Collections.unmodifiableMap(new LinkedHashMap<>(b.nodeResults));
        this.durationMs = b.durationMs;
        this.error = b.error;
    }

    static Builder builder() {
        return new Builder();
    }

    public String getTraceId() {
        return traceId;
    }

    public String getRunId() {
        return runId;
    }

    public String getDefinitionName() {
        return definitionName;
    }

    public String getDefinitionVersion() {
        return definitionVersion;
    }

    public RunStatus getStatus() {
        return status;
    }

    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }

    public Long getIncidentId() {
        return incidentId;
    }

    public List<String> getExecutedNodes() {
        return executedNodes;
    }

    public List<String> getSkippedNodes() {
        return skippedNodes;
    }

    /**
     * @return results keyed by node id, in definition order
     */
    public Map<String, NodeResult> getNodeResults() {
        return nodeResults;
    }

    public NodeResult nodeResult(String nodeId) {
        return nodeResults.get(nodeId);
    }

    public double getDurationMs() {
        return durationMs;
    }

    /**
     * @return failure description when {@link #getStatus()} is failed, else {@code null}
     */
    public String getError() {
        return error;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> results = new LinkedHashMap<>();
        nodeResults.forEach((id, result) -> results.put(id, result.toMap()));

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("trace_id", traceId);
        map.put("run_id", runId);
        map.put("definition", definitionName);
        map.put("definition_version", definitionVersion);
        map.put("status", status.value());
        map.put("incident_id", incidentId);
        map.put("executed_nodes", new ArrayList<>(executedNodes));
        map.put("skipped_nodes", new ArrayList<>(skippedNodes));
        map.put("node_results", results);
        map.put("duration_ms", durationMs);
        map.put("error", error);
        return map;
    }

    static final class Builder {
        private String traceId;
        private String runId;
        private String definitionName;
        private String definitionVersion;
        private RunStatus status = RunStatus.COMPLETED;
        private Long incidentId;
        private final List<String> executedNodes = new ArrayList<>();
        private final List<String> skippedNodes = new ArrayList<>();
        private final Map<String, NodeResult> nodeResults = new LinkedHashMap<>();
        private double durationMs;
        private String error;

        Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        Builder definition(String name, String version) {
            this.definitionName = name;
            this.definitionVersion = version;
            return this;
        }

        Builder failed(String error) {
            this.status = RunStatus.FAILED;
            this.error = error;
            return this;
        }

        Builder incidentId(Long incidentId) {
            this.incidentId = incidentId;
            return this;
        }

        Builder executed(NodeResult result) {
            executedNodes.add(result.getNodeId());
            nodeResults.put(result.getNodeId(), result);
            return this;
        }

        Builder skipped(NodeResult result) {
            skippedNodes.add(result.getNodeId());
            nodeResults.put(result.getNodeId(), result);
            return this;
        }

        Builder durationMs(double durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        PipelineRunResult build() {
            return new PipelineRunResult(this);
        }
    }

    @Override
    public String toString() {
        return "PipelineRunResult{" +
                "runId='" + runId + '\'' +
                ", definition='" + definitionName + '\'' +
                ", status=" + status +
                ", executedNodes=" + executedNodes +
                ", skippedNodes=" + skippedNodes +
                ", error='" + error + '\'' +
                '}';
    }
}
