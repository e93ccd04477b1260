package com.alertrelay.pipeline.notify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A configured destination: a name, the driver that serves it and the
 * driver's settings.
 *
 * @since 1.0.0
 */
public final class NotificationChannel {

    private final String name;
    private final String driver;
    private final Map<String, Object> config;
    private final boolean active;

    public NotificationChannel(String name, String driver, Map<String, Object> config, boolean active) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.config = config != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(config))
                : Map.of();
        this.active = active;
    }

    public static NotificationChannel active(String name, String driver, Map<String, Object> config) {
        return new NotificationChannel(name, driver, config, true);
    }

    public String getName() {
        return name;
    }

    public String getDriver() {
        return driver;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public boolean isActive() {
        return active;
    }

    @Override
    public String toString() {
        return "NotificationChannel{" +
                "name='" + name + '\'' +
                ", driver='" + driver + '\'' +
                ", active=" + active +
                '}';
    }
}
