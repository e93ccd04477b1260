package com.alertrelay.pipeline.intelligence;

import com.alertrelay.core.registry.NamedRegistry;
import com.alertrelay.core.store.AlertStore;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Analysis providers by name.
 *
 * @since 1.0.0
 */
public final class ProviderRegistry {

    private final NamedRegistry<AnalysisProvider> registry;

    public ProviderRegistry(NamedRegistry<AnalysisProvider> registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Registry holding the built-in {@code local} keyword provider.
     *
     * @param store used to read the alerts attached to an incident; may be {@code null}
     */
    public static ProviderRegistry standard(AlertStore store) {
        return of(List.of(new KeywordRecommendationProvider(store)));
    }

    public static ProviderRegistry of(List<AnalysisProvider> providers) {
        NamedRegistry.Builder<AnalysisProvider> builder = NamedRegistry.builder("provider");
        for (AnalysisProvider provider : providers) {
            Supplier<AnalysisProvider> factory = () -> provider;
            builder.register(provider.name(), factory);
        }
        return new ProviderRegistry(builder.build());
    }

    /**
     * @throws com.alertrelay.core.registry.UnknownEntryException for unknown names
     */
    public AnalysisProvider create(String name) {
        return registry.create(name);
    }

    public boolean contains(String name) {
        return registry.contains(name);
    }

    public List<String> names() {
        return registry.names();
    }
}
