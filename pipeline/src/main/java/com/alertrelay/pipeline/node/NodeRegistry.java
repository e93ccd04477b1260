package com.alertrelay.pipeline.node;

import com.alertrelay.core.registry.NamedRegistry;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Node types available to pipeline definitions, keyed by
 * {@link NodeType#value()}.
 *
 * @since 1.0.0
 */
public final class NodeRegistry {

    private final NamedRegistry<PipelineNode> registry;

    private NodeRegistry(NamedRegistry<PipelineNode> registry) {
        this.registry = registry;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws com.alertrelay.core.registry.UnknownEntryException for unregistered types
     */
    public PipelineNode create(String type) {
        return registry.create(type);
    }

    public boolean contains(String type) {
        return registry.contains(type);
    }

    public List<String> types() {
        return registry.names();
    }

    public static final class Builder {

        private final NamedRegistry.Builder<PipelineNode> delegate = NamedRegistry.builder("node type");

        private Builder() {
        }

        /**
         * Register a node whose factory reports its own type.
         */
        public Builder register(PipelineNode node) {
            Objects.requireNonNull(node, "node must not be null");
            Supplier<PipelineNode> factory = () -> node;
            delegate.register(node.type().value(), factory);
            return this;
        }

        public NodeRegistry build() {
            return new NodeRegistry(delegate.build());
        }
    }

    @Override
    public String toString() {
        return "NodeRegistry{types=" + types() + '}';
    }
}
