package com.alertrelay.pipeline.node;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Base class for the built-in nodes.
 *
 * <p>
 * Handles what every node does the same way: resolving the node id from the
 * config, timing the run, and turning an unexpected {@link RuntimeException}
 * into an error of the form {@code "<Type> error: <message>"} so that a
 * faulty node never aborts the pipeline.
 * </p>
 *
 * <p>
 * Also carries the lenient config accessors shared by the nodes. Definition
 * configs come from YAML or JSON, so a value may arrive as a string, a list
 * or a number depending on how the author wrote it.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class AbstractPipelineNode implements PipelineNode {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractPipelineNode.class);

    @Override
    public final NodeResult execute(NodeContext context, Map<String, Object> config) {
        Map<String, Object> cfg = config != null ? config : Map.of();
        NodeResult result = new NodeResult(nodeId(cfg), type().value());
        long start = System.nanoTime();
        try {
            run(context, cfg, result);
        } catch (RuntimeException e) {
            LOG.error("{} node '{}' failed unexpectedly", type().displayName(), result.getNodeId(), e);
            result.addError(type().displayName() + " error: " + e.getMessage());
        }
        result.setDurationMs((System.nanoTime() - start) / 1_000_000.0);
        return result;
    }

    /**
     * Node body. Record problems on {@code result}; anything thrown is caught
     * by {@link #execute(NodeContext, Map)}.
     */
    protected abstract void run(NodeContext context, Map<String, Object> config, NodeResult result);

    protected String nodeId(Map<String, Object> config) {
        String id = configString(config, "id");
        return id != null ? id : type().value();
    }

    // ---------------------------------------------------------------
    // Config accessors
    // ---------------------------------------------------------------

    /**
     * @return the value as a trimmed string, {@code null} when absent or blank
     */
    protected static String configString(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) {
            return null;
        }
        String s = String.valueOf(value).trim();
        return s.isEmpty() ? null : s;
    }

    protected static boolean configBoolean(Map<String, Object> config, String key, boolean defaultValue) {
        Object value = config.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s && !s.isBlank()) {
            return switch (s.trim().toLowerCase(Locale.ROOT)) {
                case "true", "yes", "on", "1" -> true;
                default -> false;
            };
        }
        return defaultValue;
    }

    /**
     * @throws IllegalArgumentException if the value is present but not numeric
     */
    protected static Long configLong(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got: " + value, e);
        }
    }

    /**
     * Read a value that may be written as a single string or a list of strings.
     *
     * @return the strings in order; {@code null} when the key is absent
     */
    protected static List<String> configStringList(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) {
            return null;
        }
        List<String> names = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null && !String.valueOf(item).isBlank()) {
                    names.add(String.valueOf(item).trim());
                }
            }
        } else if (!String.valueOf(value).isBlank()) {
            names.add(String.valueOf(value).trim());
        }
        return names;
    }

    /**
     * @return an error message when {@code key} holds something other than a
     *         string or a list of strings, otherwise {@code null}
     */
    protected static String checkStringOrList(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null || value instanceof String) {
            return null;
        }
        if (value instanceof List<?> list && list.stream().allMatch(String.class::isInstance)) {
            return null;
        }
        return "'" + key + "' must be a string or a list of strings";
    }
}
