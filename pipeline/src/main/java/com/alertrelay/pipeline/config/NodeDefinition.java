package com.alertrelay.pipeline.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One node entry of a {@link PipelineDefinition}.
 *
 * <p>
 * Mutable bean populated by SnakeYAML. The free-form {@code config} map is
 * handed to the node as-is, plus the node {@code id}.
 * </p>
 *
 * @since 1.0.0
 */
public class NodeDefinition {

    private String id;
    private String type;
    private Map<String, Object> config = new LinkedHashMap<>();
    private boolean required;
    private List<String> skipIfErrors = new ArrayList<>();
    private String skipIfCondition;

    public NodeDefinition() {
    }

    /**
     * Convenience for programmatic definitions.
     */
    public static NodeDefinition of(String id, String type, Map<String, Object> config) {
        NodeDefinition node = new NodeDefinition();
        node.setId(id);
        node.setType(type);
        node.setConfig(config);
        return node;
    }

    /**
     * @return the config plus {@code id}, as passed to the node
     */
    public Map<String, Object> effectiveConfig() {
        Map<String, Object> effective = new LinkedHashMap<>(config);
        effective.put("id", id);
        return effective;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Map<String, Object> getConfig() {
        return Collections.unmodifiableMap(config);
    }

    public void setConfig(Map<String, Object> config) {
        this.config = config != null ? new LinkedHashMap<>(config) : new LinkedHashMap<>();
    }

    public boolean isRequired() {
        return required;
    }

    public void setRequired(boolean required) {
        this.required = required;
    }

    public List<String> getSkipIfErrors() {
        return Collections.unmodifiableList(skipIfErrors);
    }

    public void setSkipIfErrors(List<String> skipIfErrors) {
        this.skipIfErrors = skipIfErrors != null ? new ArrayList<>(skipIfErrors) : new ArrayList<>();
    }

    /**
     * @return condition of the form {@code <node>.has_errors}, or {@code null}
     */
    public String getSkipIfCondition() {
        return skipIfCondition;
    }

    public void setSkipIfCondition(String skipIfCondition) {
        this.skipIfCondition = skipIfCondition;
    }

    @Override
    public String toString() {
        return "NodeDefinition{" +
                "id='" + id + '\'' +
                ", type='" + type + '\'' +
                ", required=" + required +
                ", skipIfErrors=" + skipIfErrors +
                '}';
    }
}
