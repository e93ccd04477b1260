package com.alertrelay.core.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Ordered name-to-factory registry.
 *
 * <p>
 * Used for every pluggable collaborator: source drivers, checkers, analysis
 * providers, notification drivers and pipeline node types. Registration
 * order is preserved and is significant wherever callers iterate (driver
 * detection relies on it).
 * </p>
 *
 * <p>
 * Instances are built once at startup and passed by reference. They are
 * immutable after construction, so sharing between threads is safe.
 * </p>
 *
 * @param <T> entry type
 * @since 1.0.0
 */
public final class NamedRegistry<T> {

    private static final Logger LOG = LoggerFactory.getLogger(NamedRegistry.class);

    private final String kind;
    private final Map<String, Supplier<? extends T>> factories;

    private NamedRegistry(Builder<T> builder) {
        this.kind = Objects.requireNonNull(builder.kind, "kind must not be null");
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(builder.factories));
        LOG.info("Registered {} {}(s): {}", factories.size(), kind, factories.keySet());
    }

    /**
     * @param kind human-readable entry kind used in error messages
     */
    public static <T> Builder<T> builder(String kind) {
        return new Builder<>(kind);
    }

    /**
     * Instantiate the entry registered under {@code name}.
     *
     * @param name registered name
     * @return a new instance from the registered factory
     * @throws UnknownEntryException if nothing is registered under the name
     */
    public T create(String name) {
        Supplier<? extends T> factory = name != null ? factories.get(name) : null;
        if (factory == null) {
            throw new UnknownEntryException(kind, name, names());
        }
        return factory.get();
    }

    public boolean contains(String name) {
        return name != null && factories.containsKey(name);
    }

    /**
     * @return registered names in registration order
     */
    public List<String> names() {
        return List.copyOf(factories.keySet());
    }

    public String kind() {
        return kind;
    }

    public int size() {
        return factories.size();
    }

    /**
     * Fluent builder. Registering the same name twice is a programming error.
     */
    public static final class Builder<T> {
        private final String kind;
        private final Map<String, Supplier<? extends T>> factories = new LinkedHashMap<>();

        private Builder(String kind) {
            this.kind = kind;
        }

        public Builder<T> register(String name, Supplier<? extends T> factory) {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(factory, "factory must not be null");
            if (factories.putIfAbsent(name, factory) != null) {
                throw new IllegalArgumentException("Duplicate " + kind + " name: " + name);
            }
            return this;
        }

        public NamedRegistry<T> build() {
            return new NamedRegistry<>(this);
        }
    }

    @Override
    public String toString() {
        return "NamedRegistry{" + kind + "=" + new ArrayList<>(factories.keySet()) + '}';
    }
}
