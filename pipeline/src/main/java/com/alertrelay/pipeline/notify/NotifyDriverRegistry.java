package com.alertrelay.pipeline.notify;

import com.alertrelay.core.registry.NamedRegistry;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Notification drivers by name.
 *
 * @since 1.0.0
 */
public final class NotifyDriverRegistry {

    private final NamedRegistry<NotifyDriver> registry;

    public NotifyDriverRegistry(NamedRegistry<NotifyDriver> registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Registry holding the built-in {@code log} driver.
     */
    public static NotifyDriverRegistry standard() {
        return of(List.of(new LogNotifyDriver()));
    }

    public static NotifyDriverRegistry of(List<NotifyDriver> drivers) {
        NamedRegistry.Builder<NotifyDriver> builder = NamedRegistry.builder("notify driver");
        for (NotifyDriver driver : drivers) {
            Supplier<NotifyDriver> factory = () -> driver;
            builder.register(driver.name(), factory);
        }
        return new NotifyDriverRegistry(builder.build());
    }

    /**
     * @throws com.alertrelay.core.registry.UnknownEntryException for unknown names
     */
    public NotifyDriver create(String name) {
        return registry.create(name);
    }

    public boolean contains(String name) {
        return registry.contains(name);
    }

    public List<String> names() {
        return registry.names();
    }
}
