package com.alertrelay.pipeline.nodes;

import com.alertrelay.pipeline.node.AbstractPipelineNode;
import com.alertrelay.pipeline.node.NodeContext;
import com.alertrelay.pipeline.node.NodeResult;
import com.alertrelay.pipeline.node.NodeType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reshapes the output of an earlier node. Has no side effects.
 *
 * <h3>Config</h3>
 * <ul>
 * <li>{@code source_node} (required): id of the node whose output is read</li>
 * <li>{@code extract}: dot path selecting part of that output</li>
 * <li>{@code filter_field} + {@code filter_value}: keep only list items whose
 * field equals the value, ignoring case; {@code filter_priority} is shorthand
 * for filtering on {@code priority}</li>
 * <li>{@code mapping}: target key to dot path over the whole source output</li>
 * </ul>
 *
 * <p>
 * Output: {@code transformed} (the mapped object when {@code mapping} is set,
 * otherwise the extracted and filtered data) and {@code source_node}.
 * </p>
 *
 * @since 1.0.0
 */
public class TransformNode extends AbstractPipelineNode {

    @Override
    public NodeType type() {
        return NodeType.TRANSFORM;
    }

    @Override
    protected void run(NodeContext context, Map<String, Object> config, NodeResult result) {
        String sourceNode = configString(config, "source_node");
        if (sourceNode == null) {
            result.addError("Missing required field: source_node");
            return;
        }
        Map<String, Object> source = context.previous(sourceNode);

        Object data = DotPaths.get(source, configString(config, "extract"));

        String filterField = configString(config, "filter_field");
        String filterValue = configString(config, "filter_value");
        String filterPriority = configString(config, "filter_priority");
        if (filterPriority != null) {
            filterField = filterField != null ? filterField : "priority";
            filterValue = filterValue != null ? filterValue : filterPriority;
        }
        if (filterField != null && filterValue != null && data instanceof List<?> items) {
            data = filter(items, filterField, filterValue);
        }

        Object transformed = data;
        if (config.get("mapping") instanceof Map<?, ?> mapping) {
            Map<String, Object> mapped = new LinkedHashMap<>();
            mapping.forEach((target, path) ->
                    mapped.put(String.valueOf(target), DotPaths.get(source, String.valueOf(path))));
            transformed = mapped;
        }

        result.put("transformed", transformed)
                .put("source_node", sourceNode);
    }

    @Override
    public List<String> validateConfig(Map<String, Object> config) {
        List<String> errors = new ArrayList<>();
        if (config == null || configString(config, "source_node") == null) {
            errors.add("Missing required field: source_node");
            return errors;
        }
        Object mapping = config.get("mapping");
        if (mapping != null && !(mapping instanceof Map<?, ?> m
                && m.values().stream().allMatch(String.class::isInstance))) {
            errors.add("'mapping' must map target keys to dot paths");
        }
        return errors;
    }

    private static List<Object> filter(List<?> items, String field, String value) {
        List<Object> kept = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof Map<?, ?> map) {
                Object actual = map.get(field);
                if (actual != null && String.valueOf(actual).equalsIgnoreCase(value)) {
                    kept.add(item);
                }
            }
        }
        return kept;
    }
}
