package com.alertrelay.pipeline.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level bean for a pipeline YAML document.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * name: default
 * version: "1"
 * nodes:
 *   - id: ingest
 *     type: ingest
 *     required: true
 *   - id: analyze
 *     type: intelligence
 *     config:
 *       provider: local
 *     skipIfErrors: [ingest]
 * </pre>
 *
 * <p>
 * {@link #validate()} checks structure only. Whether node types exist and
 * node configs are usable is checked against a node registry by the
 * executor.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineDefinition {

    private String name = "pipeline";
    private String version;
    private String description = "";
    private List<NodeDefinition> nodes = new ArrayList<>();

    public PipelineDefinition() {
    }

    public static PipelineDefinition of(String name, String version, List<NodeDefinition> nodes) {
        PipelineDefinition definition = new PipelineDefinition();
        definition.setName(name);
        definition.setVersion(version);
        definition.setNodes(nodes);
        return definition;
    }

    /**
     * @return structural problems, in node order; empty when valid
     */
    public List<String> structuralErrors() {
        List<String> errors = new ArrayList<>();
        if (version == null || version.isBlank()) {
            errors.add("Missing 'version' in config");
        }
        if (nodes.isEmpty()) {
            errors.add("Pipeline has no nodes defined");
            return errors;
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < nodes.size(); i++) {
            NodeDefinition node = nodes.get(i);
            if (node == null) {
                errors.add("Node " + i + " is empty");
                continue;
            }
            if (node.getId() == null || node.getId().isBlank()) {
                errors.add("Node " + i + " missing 'id'");
            } else if (!seen.add(node.getId())) {
                errors.add("Duplicate node id: " + node.getId());
            }
            if (node.getType() == null || node.getType().isBlank()) {
                errors.add("Node " + i + " missing 'type'");
            }
        }
        return errors;
    }

    /**
     * @throws IllegalStateException listing every structural problem
     */
    public void validate() {
        List<String> errors = structuralErrors();
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Pipeline definition validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<NodeDefinition> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public void setNodes(List<NodeDefinition> nodes) {
        this.nodes = nodes != null ? new ArrayList<>(nodes) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "PipelineDefinition{" +
                "name='" + name + '\'' +
                ", version='" + version + '\'' +
                ", nodes=" + nodes +
                '}';
    }
}
