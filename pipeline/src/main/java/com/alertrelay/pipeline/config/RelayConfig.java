package com.alertrelay.pipeline.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Typed, immutable runtime configuration for Alert Relay.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configurable through container env vars or a shell
 * environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class RelayConfig {

    // ---------------------------------------------------------------
    // Runtime
    // ---------------------------------------------------------------
    private final String environment;
    private final String hostname;

    // ---------------------------------------------------------------
    // Incidents
    // ---------------------------------------------------------------
    private final boolean autoCreateIncidents;
    private final boolean autoResolveIncidents;

    // ---------------------------------------------------------------
    // Intelligence
    // ---------------------------------------------------------------
    private final long intelligenceTimeoutMs;

    // ---------------------------------------------------------------
    // Checkers
    // ---------------------------------------------------------------
    private final List<String> checkersSkip;
    private final boolean checkersSkipAll;

    // ---------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------
    private final String pipelinePath;

    private RelayConfig(Builder b) {
        this.environment = b.environment;
        this.hostname = b.hostname;
        this.autoCreateIncidents = b.autoCreateIncidents;
        this.autoResolveIncidents = b.autoResolveIncidents;
        this.intelligenceTimeoutMs = b.intelligenceTimeoutMs;
        this.checkersSkip = List.copyOf(b.checkersSkip);
        this.checkersSkipAll = b.checkersSkipAll;
        this.pipelinePath = b.pipelinePath;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link RelayConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static RelayConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static RelayConfig fromEnvironment(Function<String, String> lookup) {
        try {
            return new Builder()
                    .environment(env(lookup, "RELAY_ENVIRONMENT", "production"))
                    .hostname(env(lookup, "RELAY_HOSTNAME", "localhost"))
                    .autoCreateIncidents(parseBooleanEnv(lookup, "RELAY_AUTO_CREATE_INCIDENTS", "true"))
                    .autoResolveIncidents(parseBooleanEnv(lookup, "RELAY_AUTO_RESOLVE_INCIDENTS", "true"))
                    .intelligenceTimeoutMs(Long.parseLong(env(lookup, "RELAY_INTELLIGENCE_TIMEOUT_MS", "1000")))
                    .checkersSkip(parseListEnv(lookup, "RELAY_CHECKERS_SKIP"))
                    .checkersSkipAll(parseBooleanEnv(lookup, "RELAY_CHECKERS_SKIP_ALL", "false"))
                    .pipelinePath(env(lookup, "RELAY_PIPELINE_PATH", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getEnvironment() {
        return environment;
    }

    public String getHostname() {
        return hostname;
    }

    public boolean isAutoCreateIncidents() {
        return autoCreateIncidents;
    }

    public boolean isAutoResolveIncidents() {
        return autoResolveIncidents;
    }

    public long getIntelligenceTimeoutMs() {
        return intelligenceTimeoutMs;
    }

    public List<String> getCheckersSkip() {
        return checkersSkip;
    }

    public boolean isCheckersSkipAll() {
        return checkersSkipAll;
    }

    /**
     * @return definition file path, empty when the classpath default applies
     */
    public String getPipelinePath() {
        return pipelinePath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RelayConfig}.
     *
     * <p>
     * The {@link #build()} method rejects blank environment and hostname
     * values and an intelligence timeout below one millisecond.
     * </p>
     */
    public static class Builder {
        private String environment = "production";
        private String hostname = "localhost";
        private boolean autoCreateIncidents = true;
        private boolean autoResolveIncidents = true;
        private long intelligenceTimeoutMs = 1000;
        private List<String> checkersSkip = new ArrayList<>();
        private boolean checkersSkipAll;
        private String pipelinePath = "";

        public Builder environment(String v) {
            this.environment = v;
            return this;
        }

        public Builder hostname(String v) {
            this.hostname = v;
            return this;
        }

        public Builder autoCreateIncidents(boolean v) {
            this.autoCreateIncidents = v;
            return this;
        }

        public Builder autoResolveIncidents(boolean v) {
            this.autoResolveIncidents = v;
            return this;
        }

        public Builder intelligenceTimeoutMs(long v) {
            this.intelligenceTimeoutMs = v;
            return this;
        }

        public Builder checkersSkip(List<String> v) {
            this.checkersSkip = v != null ? new ArrayList<>(v) : new ArrayList<>();
            return this;
        }

        public Builder checkersSkipAll(boolean v) {
            this.checkersSkipAll = v;
            return this;
        }

        public Builder pipelinePath(String v) {
            this.pipelinePath = v != null ? v : "";
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link RelayConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public RelayConfig build() {
            requireNonBlank(environment, "environment");
            requireNonBlank(hostname, "hostname");
            if (intelligenceTimeoutMs < 1) {
                throw new IllegalArgumentException(
                        "intelligenceTimeoutMs must be >= 1, got: " + intelligenceTimeoutMs);
            }
            return new RelayConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Function<String, String> lookup, String name, String defaultValue) {
        String value = lookup.apply(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static boolean parseBooleanEnv(Function<String, String> lookup, String name, String defaultValue) {
        String value = env(lookup, name, defaultValue).toLowerCase(Locale.ROOT);
        return switch (value) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new IllegalStateException(
                    "Failed to parse boolean environment variable " + name + ": " + value);
        };
    }

    private static List<String> parseListEnv(Function<String, String> lookup, String name) {
        return Arrays.stream(env(lookup, name, "").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    public String toString() {
        return "RelayConfig{" +
                "environment='" + environment + '\'' +
                ", hostname='" + hostname + '\'' +
                ", autoCreateIncidents=" + autoCreateIncidents +
                ", autoResolveIncidents=" + autoResolveIncidents +
                ", intelligenceTimeoutMs=" + intelligenceTimeoutMs +
                ", checkersSkip=" + checkersSkip +
                ", checkersSkipAll=" + checkersSkipAll +
                ", pipelinePath='" + pipelinePath + '\'' +
                '}';
    }
}
