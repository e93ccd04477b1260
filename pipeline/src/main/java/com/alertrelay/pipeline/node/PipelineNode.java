package com.alertrelay.pipeline.node;

import java.util.List;
import java.util.Map;

/**
 * Contract for a single pipeline step.
 *
 * <p>
 * Implementations report domain problems through
 * {@link NodeResult#getErrors()} and do not throw for them. Nodes are
 * created once per registry lookup and hold no per-run state; everything a
 * run needs travels in the {@link NodeContext}.
 * </p>
 *
 * @since 1.0.0
 */
public interface PipelineNode {

    NodeType type();

    /**
     * Run the node.
     *
     * @param context shared run state; never {@code null}
     * @param config  node configuration from the definition, including its {@code id}
     * @return the result, with errors recorded rather than thrown
     */
    NodeResult execute(NodeContext context, Map<String, Object> config);

    /**
     * Check a node configuration before any node runs.
     *
     * @return human-readable problems; empty when the config is usable
     */
    default List<String> validateConfig(Map<String, Object> config) {
        return List.of();
    }
}
