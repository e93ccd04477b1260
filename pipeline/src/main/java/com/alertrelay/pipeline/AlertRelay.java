package com.alertrelay.pipeline;

import com.alertrelay.core.check.Checker;
import com.alertrelay.core.check.CheckerRegistry;
import com.alertrelay.core.driver.DriverRegistry;
import com.alertrelay.core.lifecycle.AlertLifecycleEngine;
import com.alertrelay.core.lifecycle.CheckAlertBridge;
import com.alertrelay.core.lifecycle.IncidentManager;
import com.alertrelay.core.registry.NamedRegistry;
import com.alertrelay.core.store.AlertStore;
import com.alertrelay.core.store.CheckRunStore;
import com.alertrelay.core.store.InMemoryAlertStore;
import com.alertrelay.core.store.InMemoryCheckRunStore;
import com.alertrelay.pipeline.config.PipelineDefinition;
import com.alertrelay.pipeline.config.PipelineDefinitionLoader;
import com.alertrelay.pipeline.config.RelayConfig;
import com.alertrelay.pipeline.executor.PipelineExecutor;
import com.alertrelay.pipeline.executor.PipelineRunResult;
import com.alertrelay.pipeline.intelligence.ProviderRegistry;
import com.alertrelay.pipeline.node.NodeRegistry;
import com.alertrelay.pipeline.nodes.ContextNode;
import com.alertrelay.pipeline.nodes.IngestNode;
import com.alertrelay.pipeline.nodes.IntelligenceNode;
import com.alertrelay.pipeline.nodes.NotifyNode;
import com.alertrelay.pipeline.nodes.TransformNode;
import com.alertrelay.pipeline.notify.ChannelStore;
import com.alertrelay.pipeline.notify.InMemoryChannelStore;
import com.alertrelay.pipeline.notify.NotifyDriverRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Assembled Alert Relay runtime.
 *
 * <p>
 * Built once at startup from a {@link RelayConfig} plus the stores and
 * registries, then shared. Anything not supplied to the {@link Builder} gets
 * an in-memory or built-in default: in-memory stores, the standard source
 * drivers, the {@code local} analysis provider and the {@code log} notify
 * driver.
 * </p>
 *
 * <pre>
 * AlertRelay relay = AlertRelay.builder()
 *         .config(RelayConfig.fromEnvironment())
 *         .checker(diskChecker)
 *         .build();
 * PipelineRunResult run = relay.run(relay.loadDefinition(), payload, "alertmanager");
 * </pre>
 *
 * @since 1.0.0
 */
public final class AlertRelay {

    private static final Logger LOG = LoggerFactory.getLogger(AlertRelay.class);

    private final RelayConfig config;
    private final AlertLifecycleEngine engine;
    private final IncidentManager incidents;
    private final CheckerRegistry checkers;
    private final CheckAlertBridge bridge;
    private final ChannelStore channels;
    private final CheckRunStore checkRuns;
    private final NodeRegistry nodes;
    private final PipelineExecutor executor;

    private AlertRelay(Builder b) {
        this.config = b.config;
        AlertStore store = b.alertStore != null ? b.alertStore : new InMemoryAlertStore(b.clock);
        this.checkRuns = b.checkRunStore != null ? b.checkRunStore : new InMemoryCheckRunStore(b.clock);
        this.channels = b.channelStore != null ? b.channelStore : new InMemoryChannelStore();

        this.engine = AlertLifecycleEngine.builder()
                .drivers(DriverRegistry.standard(b.clock))
                .store(store)
                .clock(b.clock)
                .autoCreateIncidents(config.isAutoCreateIncidents())
                .autoResolveIncidents(config.isAutoResolveIncidents())
                .build();
        this.incidents = new IncidentManager(store, b.clock);

        NamedRegistry.Builder<Checker> checkerBuilder = NamedRegistry.builder("checker");
        for (Checker checker : b.checkers) {
            Supplier<Checker> factory = () -> checker;
            checkerBuilder.register(checker.name(), factory);
        }
        this.checkers = new CheckerRegistry(checkerBuilder.build(),
                config.getCheckersSkip(), config.isCheckersSkipAll());
        this.bridge = new CheckAlertBridge(engine, config.getHostname());

        ProviderRegistry providers = b.providers != null ? b.providers : ProviderRegistry.standard(store);
        NotifyDriverRegistry notifyDrivers = b.notifyDrivers != null ? b.notifyDrivers : NotifyDriverRegistry.standard();

        this.nodes = NodeRegistry.builder()
                .register(new IngestNode(engine))
                .register(new ContextNode(checkers, checkRuns, bridge))
                .register(new IntelligenceNode(providers, store, config.getIntelligenceTimeoutMs()))
                .register(new NotifyNode(channels, notifyDrivers))
                .register(new TransformNode())
                .build();
        this.executor = new PipelineExecutor(nodes);
        LOG.info("Alert Relay ready: {}", config);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Run {@code definition} in the configured environment.
     */
    public PipelineRunResult run(PipelineDefinition definition, Map<String, Object> payload, String source) {
        return executor.execute(definition, payload, source, null, config.getEnvironment(), null);
    }

    /**
     * Load the configured definition: the {@code pipelinePath} file when set,
     * otherwise the usual {@link PipelineDefinitionLoader#load()} resolution.
     */
    public PipelineDefinition loadDefinition() {
        String path = config.getPipelinePath();
        return path.isBlank() ? PipelineDefinitionLoader.load() : PipelineDefinitionLoader.fromFile(path);
    }

    public RelayConfig config() {
        return config;
    }

    public AlertLifecycleEngine engine() {
        return engine;
    }

    public IncidentManager incidents() {
        return incidents;
    }

    public CheckerRegistry checkers() {
        return checkers;
    }

    public CheckAlertBridge bridge() {
        return bridge;
    }

    public ChannelStore channels() {
        return channels;
    }

    public CheckRunStore checkRuns() {
        return checkRuns;
    }

    public NodeRegistry nodes() {
        return nodes;
    }

    public PipelineExecutor executor() {
        return executor;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static final class Builder {
        private RelayConfig config;
        private Clock clock = Clock.systemUTC();
        private AlertStore alertStore;
        private CheckRunStore checkRunStore;
        private ChannelStore channelStore;
        private final List<Checker> checkers = new ArrayList<>();
        private ProviderRegistry providers;
        private NotifyDriverRegistry notifyDrivers;

        private Builder() {
        }

        public Builder config(RelayConfig config) {
            this.config = config;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder alertStore(AlertStore alertStore) {
            this.alertStore = alertStore;
            return this;
        }

        public Builder checkRunStore(CheckRunStore checkRunStore) {
            this.checkRunStore = checkRunStore;
            return this;
        }

        public Builder channelStore(ChannelStore channelStore) {
            this.channelStore = channelStore;
            return this;
        }

        public Builder checker(Checker checker) {
            this.checkers.add(Objects.requireNonNull(checker, "checker must not be null"));
            return this;
        }

        public Builder providers(ProviderRegistry providers) {
            this.providers = providers;
            return this;
        }

        public Builder notifyDrivers(NotifyDriverRegistry notifyDrivers) {
            this.notifyDrivers = notifyDrivers;
            return this;
        }

        public AlertRelay build() {
            if (config == null) {
                config = RelayConfig.builder().build();
            }
            Objects.requireNonNull(clock, "clock must not be null");
            return new AlertRelay(this);
        }
    }
}
