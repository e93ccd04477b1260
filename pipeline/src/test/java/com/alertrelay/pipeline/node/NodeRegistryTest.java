package com.alertrelay.pipeline.node;

import com.alertrelay.core.registry.UnknownEntryException;
import com.alertrelay.pipeline.nodes.TransformNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link NodeRegistry}.
 */
class NodeRegistryTest {

    @Test
    @DisplayName("Should register nodes under their type value")
    void shouldRegisterByType() {
        NodeRegistry registry = NodeRegistry.builder().register(new TransformNode()).build();

        assertThat(registry.types()).containsExactly("transform");
        assertThat(registry.contains("transform")).isTrue();
        assertThat(registry.create("transform")).isInstanceOf(TransformNode.class);
    }

    @Test
    @DisplayName("Should name the kind and the available types for an unknown type")
    void shouldRejectUnknownType() {
        NodeRegistry registry = NodeRegistry.builder().register(new TransformNode()).build();

        assertThatThrownBy(() -> registry.create("llm"))
                .isInstanceOf(UnknownEntryException.class)
                .hasMessage("Unknown node type: llm. Available: transform");
    }

    @Test
    @DisplayName("Should reject two nodes of the same type")
    void shouldRejectDuplicateType() {
        NodeRegistry.Builder builder = NodeRegistry.builder().register(new TransformNode());

        assertThatThrownBy(() -> builder.register(new TransformNode()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Duplicate node type name: transform");
    }
}
