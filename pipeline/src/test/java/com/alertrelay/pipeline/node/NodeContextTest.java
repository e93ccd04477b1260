package com.alertrelay.pipeline.node;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link NodeContext}.
 */
class NodeContextTest {

    private NodeContext context;

    @BeforeEach
    void setUp() {
        context = new NodeContext("trace-1", "run-1", Map.of("k", "v"), "grafana", null, null);
    }

    @Test
    @DisplayName("Should default the environment to production")
    void shouldDefaultEnvironment() {
        assertThat(context.getEnvironment()).isEqualTo("production");
        assertThat(context.getIncidentId()).isNull();
    }

    @Test
    @DisplayName("Should return an empty map for a node that has not run")
    void shouldReturnEmptyForMissingNode() {
        assertThat(context.previous("nope")).isEmpty();
    }

    @Test
    @DisplayName("Should keep outputs in execution order")
    void shouldKeepOutputsInOrder() {
        context.recordOutput("b", Map.of("x", 1));
        context.recordOutput("a", Map.of("y", 2));

        assertThat(context.previousOutputs()).containsOnlyKeys("b", "a");
        assertThat(context.previousOutputs().keySet()).containsExactly("b", "a");
        assertThat(context.previous("a")).containsEntry("y", 2);
    }

    @Test
    @DisplayName("Should reject a second output for the same node")
    void shouldRejectDuplicateOutput() {
        context.recordOutput("a", Map.of());

        assertThatThrownBy(() -> context.recordOutput("a", Map.of("x", 1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("a");
    }

    @Test
    @DisplayName("Should snapshot recorded outputs and the payload")
    void shouldSnapshotInputs() {
        Map<String, Object> output = new HashMap<>();
        output.put("count", 1);
        context.recordOutput("a", output);
        output.put("count", 2);

        assertThat(context.previous("a")).containsEntry("count", 1);
        assertThat(context.getPayload()).containsEntry("k", "v");
    }
}
