package com.alertrelay.pipeline.node;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AbstractPipelineNode}.
 */
class AbstractPipelineNodeTest {

    private NodeContext context;

    @BeforeEach
    void setUp() {
        context = new NodeContext("t", "r", Map.of(), "test", "test", null);
    }

    /** Echoes parsed config values into its output, or throws on demand. */
    private static final class EchoNode extends AbstractPipelineNode {

        @Override
        public NodeType type() {
            return NodeType.TRANSFORM;
        }

        @Override
        protected void run(NodeContext context, Map<String, Object> config, NodeResult result) {
            if (configBoolean(config, "explode", false)) {
                throw new IllegalStateException("kaboom");
            }
            result.put("names", configStringList(config, "names"))
                    .put("limit", configLong(config, "limit"))
                    .put("label", configString(config, "label"));
        }
    }

    @Test
    @DisplayName("Should use the configured id, else the type name")
    void shouldResolveNodeId() {
        EchoNode node = new EchoNode();

        assertThat(node.execute(context, Map.of("id", "shape")).getNodeId()).isEqualTo("shape");
        assertThat(node.execute(context, Map.of()).getNodeId()).isEqualTo("transform");
        assertThat(node.execute(context, null).getNodeId()).isEqualTo("transform");
    }

    @Test
    @DisplayName("Should turn an unexpected exception into a typed error")
    void shouldCatchUnexpectedFault() {
        NodeResult result = new EchoNode().execute(context, Map.of("explode", true));

        assertThat(result.getErrors()).containsExactly("Transform error: kaboom");
        assertThat(result.getDurationMs()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    @DisplayName("Should read lenient config values")
    void shouldReadLenientConfig() {
        NodeResult single = new EchoNode().execute(context,
                Map.of("names", "disk", "limit", "25", "label", "  x  "));
        NodeResult list = new EchoNode().execute(context,
                Map.of("names", List.of("cpu", "disk"), "limit", 7, "label", " "));

        assertThat(single.getOutput()).containsEntry("names", List.of("disk"))
                .containsEntry("limit", 25L)
                .containsEntry("label", "x");
        assertThat(list.getOutput()).containsEntry("names", List.of("cpu", "disk"))
                .containsEntry("limit", 7L)
                .containsEntry("label", null);
    }

    @Test
    @DisplayName("Should report a non-numeric value as a node error")
    void shouldRejectNonNumericValue() {
        NodeResult result = new EchoNode().execute(context, Map.of("limit", "soon"));

        assertThat(result.getErrors()).singleElement().asString()
                .startsWith("Transform error: limit must be a number");
    }
}
