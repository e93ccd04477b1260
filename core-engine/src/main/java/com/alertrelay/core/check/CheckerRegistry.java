package com.alertrelay.core.check;

import com.alertrelay.core.registry.NamedRegistry;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Registry of {@link Checker} factories with an operator skip list.
 *
 * <p>
 * Skipped checkers stay resolvable by name through {@link #create(String)};
 * they are only left out of {@link #enabledNames()}, which is what "run all
 * enabled checkers" iterates.
 * </p>
 *
 * @since 1.0.0
 */
public final class CheckerRegistry {

    private final NamedRegistry<Checker> registry;
    private final Set<String> skipped;
    private final boolean skipAll;

    public CheckerRegistry(NamedRegistry<Checker> registry, Collection<String> skipped, boolean skipAll) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.skipped = skipped != null ? Set.copyOf(skipped) : Set.of();
        this.skipAll = skipAll;
    }

    /**
     * Convenience for building a registry with nothing skipped.
     */
    public static CheckerRegistry of(List<Checker> checkers) {
        NamedRegistry.Builder<Checker> builder = NamedRegistry.builder("checker");
        for (Checker checker : checkers) {
            Supplier<Checker> factory = () -> checker;
            builder.register(checker.name(), factory);
        }
        return new CheckerRegistry(builder.build(), Set.of(), false);
    }

    /**
     * @throws com.alertrelay.core.registry.UnknownEntryException for unknown names
     */
    public Checker create(String name) {
        return registry.create(name);
    }

    public boolean contains(String name) {
        return registry.contains(name);
    }

    public List<String> names() {
        return registry.names();
    }

    /**
     * @return registered names minus the skip list; empty when skip-all is set
     */
    public List<String> enabledNames() {
        if (skipAll) {
            return List.of();
        }
        return registry.names().stream()
                .filter(name -> !skipped.contains(name))
                .toList();
    }
}
