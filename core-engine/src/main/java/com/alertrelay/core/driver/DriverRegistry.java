package com.alertrelay.core.driver;

import com.alertrelay.core.registry.NamedRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered registry of {@link SourceDriver}s with payload auto-detection.
 *
 * <h3>Detection order</h3>
 * <p>
 * {@link #detect(Map)} asks every driver except the catch-all, in
 * registration order, whether it accepts the payload. The first one that
 * does wins; there is no scoring between overlapping predicates. Only when
 * none accepts is the catch-all {@value GenericWebhookDriver#NAME} driver
 * tried.
 * </p>
 *
 * <p>
 * The standard order is alertmanager, grafana, pagerduty, datadog, newrelic,
 * opsgenie, zabbix, generic. Drivers whose predicate is a key-count heuristic
 * (newrelic, zabbix) sit late so stricter shapes match first.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriverRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DriverRegistry.class);

    private final NamedRegistry<SourceDriver> drivers;

    public DriverRegistry(NamedRegistry<SourceDriver> drivers) {
        this.drivers = Objects.requireNonNull(drivers, "drivers must not be null");
    }

    /**
     * Build the registry with every bundled driver, sharing one clock.
     *
     * @param clock clock used for "now" defaults when payloads omit timestamps
     */
    public static DriverRegistry standard(Clock clock) {
        Objects.requireNonNull(clock, "clock must not be null");
        return new DriverRegistry(NamedRegistry.<SourceDriver>builder("driver")
                .register(AlertmanagerDriver.NAME, () -> new AlertmanagerDriver(clock))
                .register(GrafanaDriver.NAME, () -> new GrafanaDriver(clock))
                .register(PagerDutyDriver.NAME, () -> new PagerDutyDriver(clock))
                .register(DatadogDriver.NAME, () -> new DatadogDriver(clock))
                .register(NewRelicDriver.NAME, () -> new NewRelicDriver(clock))
                .register(OpsGenieDriver.NAME, () -> new OpsGenieDriver(clock))
                .register(ZabbixDriver.NAME, () -> new ZabbixDriver(clock))
                .register(GenericWebhookDriver.NAME, () -> new GenericWebhookDriver(clock))
                .build());
    }

    /**
     * @throws com.alertrelay.core.registry.UnknownEntryException if no driver has that name
     */
    public SourceDriver get(String name) {
        return drivers.create(name);
    }

    /**
     * Find the driver for a payload of unknown origin.
     *
     * @param payload parsed webhook body, may be {@code null}
     * @return the first accepting driver, or empty when not even the catch-all accepts
     */
    public Optional<SourceDriver> detect(Map<String, Object> payload) {
        for (String name : drivers.names()) {
            if (GenericWebhookDriver.NAME.equals(name)) {
                continue;
            }
            SourceDriver driver = drivers.create(name);
            if (driver.validate(payload)) {
                LOG.debug("Detected driver '{}' for payload", name);
                return Optional.of(driver);
            }
        }
        if (drivers.contains(GenericWebhookDriver.NAME)) {
            SourceDriver generic = drivers.create(GenericWebhookDriver.NAME);
            if (generic.validate(payload)) {
                LOG.debug("Falling back to '{}' driver", GenericWebhookDriver.NAME);
                return Optional.of(generic);
            }
        }
        return Optional.empty();
    }

    public List<String> names() {
        return drivers.names();
    }
}
