package com.alertrelay.pipeline.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one node execution.
 *
 * <p>
 * A node fills its result while it runs: output entries, soft errors and
 * finally the elapsed time. Errors never escape a node as exceptions; the
 * executor inspects {@link #hasErrors()} instead.
 * </p>
 *
 * @since 1.0.0
 */
public final class NodeResult {

    private final String nodeId;
    private final String nodeType;
    private final Map<String, Object> output = new LinkedHashMap<>();
    private final List<String> errors = new ArrayList<>();
    private double durationMs;
    private boolean skipped;
    private String skipReason;

    public NodeResult(String nodeId, String nodeType) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId must not be null");
        this.nodeType = Objects.requireNonNull(nodeType, "nodeType must not be null");
    }

    /**
     * A result for a node the executor decided not to run.
     */
    public static NodeResult skipped(String nodeId, String nodeType, String reason) {
        NodeResult result = new NodeResult(nodeId, nodeType);
        result.skipped = true;
        result.skipReason = reason;
        return result;
    }

    public NodeResult put(String key, Object value) {
        output.put(key, value);
        return this;
    }

    public NodeResult putAll(Map<String, ?> values) {
        output.putAll(values);
        return this;
    }

    public NodeResult addError(String error) {
        errors.add(error);
        return this;
    }

    public void setDurationMs(double durationMs) {
        this.durationMs = durationMs;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getNodeType() {
        return nodeType;
    }

    /**
     * @return live view of the output map; callers must not modify it
     */
    public Map<String, Object> getOutput() {
        return Collections.unmodifiableMap(output);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public double getDurationMs() {
        return durationMs;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public String getSkipReason() {
        return skipReason;
    }

    /**
     * @return plain map with snake_case keys for serialization
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("node_id", nodeId);
        map.put("node_type", nodeType);
        map.put("output", new LinkedHashMap<>(output));
        map.put("errors", new ArrayList<>(errors));
        map.put("duration_ms", durationMs);
        map.put("skipped", skipped);
        map.put("skip_reason", skipReason);
        return map;
    }

    @Override
    public String toString() {
        return "NodeResult{" +
                "nodeId='" + nodeId + '\'' +
                ", nodeType='" + nodeType + '\'' +
                ", errors=" + errors +
                ", skipped=" + skipped +
                ", durationMs=" + durationMs +
                '}';
    }
}
