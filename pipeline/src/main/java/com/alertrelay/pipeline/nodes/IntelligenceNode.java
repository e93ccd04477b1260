package com.alertrelay.pipeline.nodes;

import com.alertrelay.core.json.JsonPayloads;
import com.alertrelay.core.model.Incident;
import com.alertrelay.core.registry.UnknownEntryException;
import com.alertrelay.core.store.AlertStore;
import com.alertrelay.pipeline.intelligence.AnalysisProvider;
import com.alertrelay.pipeline.intelligence.ProviderRegistry;
import com.alertrelay.pipeline.intelligence.Recommendation;
import com.alertrelay.pipeline.intelligence.RecommendationPriority;
import com.alertrelay.pipeline.intelligence.RecommendationType;
import com.alertrelay.pipeline.node.AbstractPipelineNode;
import com.alertrelay.pipeline.node.NodeContext;
import com.alertrelay.pipeline.node.NodeResult;
import com.alertrelay.pipeline.node.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Asks an analysis provider for recommendations about the run's incident.
 *
 * <h3>Deadline</h3>
 * <p>
 * The provider runs on a single-use daemon thread and is awaited for at most
 * {@code timeout_ms} (config) or the node default. On timeout the call is
 * abandoned: its thread is left to finish on its own and whatever it
 * eventually returns is discarded. A timeout or a provider exception yields
 * an empty recommendation list with {@code timed_out} or
 * {@code provider_error} set. Neither is a node error.
 * </p>
 *
 * <h3>Fast path</h3>
 * <p>
 * In the {@code test} and {@code ci} environments, or with config
 * {@code fast_path: true}, the provider is not called and a single canned
 * low-priority recommendation is returned.
 * </p>
 *
 * @since 1.0.0
 */
public class IntelligenceNode extends AbstractPipelineNode {

    private static final Logger LOG = LoggerFactory.getLogger(IntelligenceNode.class);

    private static final Set<String> FAST_PATH_ENVIRONMENTS = Set.of("test", "ci");

    private final ProviderRegistry providers;
    private final AlertStore store;
    private final long defaultTimeoutMs;

    /**
     * @param providers        provider registry
     * @param store            used to load the incident; may be {@code null}
     * @param defaultTimeoutMs deadline when the node config sets none
     */
    public IntelligenceNode(ProviderRegistry providers, AlertStore store, long defaultTimeoutMs) {
        if (defaultTimeoutMs < 1) {
            throw new IllegalArgumentException("defaultTimeoutMs must be >= 1, got: " + defaultTimeoutMs);
        }
        this.providers = Objects.requireNonNull(providers, "providers must not be null");
        this.store = store;
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    @Override
    public NodeType type() {
        return NodeType.INTELLIGENCE;
    }

    @Override
    protected void run(NodeContext context, Map<String, Object> config, NodeResult result) {
        String providerName = configString(config, "provider");
        if (providerName == null) {
            result.addError("Missing provider in config");
            return;
        }
        AnalysisProvider provider;
        try {
            provider = providers.create(providerName);
        } catch (UnknownEntryException e) {
            result.addError(e.getMessage());
            return;
        }

        Long incidentId = context.getIncidentId();
        List<Map<String, Object>> recommendations;
        boolean timedOut = false;
        String providerError = null;
        boolean fastPath = isFastPath(context, config);

        if (fastPath) {
            recommendations = List.of(fastPathRecommendation(incidentId).toMap());
        } else {
            Incident incident = incidentId != null && store != null
                    ? store.findIncident(incidentId).orElse(null)
                    : null;
            Long configured = configLong(config, "timeout_ms");
            long timeoutMs = configured != null ? configured : defaultTimeoutMs;

            List<?> raw = List.of();
            ExecutorService worker = Executors.newSingleThreadExecutor(task -> {
                Thread thread = new Thread(task, "intelligence-" + providerName);
                thread.setDaemon(true);
                return thread;
            });
            try {
                Future<List<?>> future = worker.submit(() -> provider.run(incident));
                List<?> returned = future.get(timeoutMs, TimeUnit.MILLISECONDS);
                raw = returned != null ? returned : List.of();
            } catch (TimeoutException e) {
                LOG.warn("Provider '{}' did not answer within {} ms", providerName, timeoutMs);
                timedOut = true;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                LOG.warn("Provider '{}' failed", providerName, cause);
                providerError = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                providerError = "Interrupted while waiting for provider";
            } finally {
                // no interrupt: an abandoned call finishes on its own thread
                worker.shutdown();
            }
            recommendations = normalize(raw);
        }

        result.put("provider", providerName)
                .put("recommendations", recommendations)
                .put("summary", firstString(recommendations, "title"))
                .put("probable_cause", firstString(recommendations, "description"))
                .put("incident_id", incidentId)
                .put("fast_path", fastPath)
                .put("timed_out", timedOut);
        if (providerError != null) {
            result.put("provider_error", providerError);
        }
    }

    @Override
    public List<String> validateConfig(Map<String, Object> config) {
        List<String> errors = new ArrayList<>();
        if (config == null || configString(config, "provider") == null) {
            errors.add("'provider' is required for intelligence nodes");
            return errors;
        }
        Object timeout = config.get("timeout_ms");
        if (timeout != null && !(timeout instanceof Number n && n.longValue() > 0)) {
            errors.add("'timeout_ms' must be a positive number");
        }
        return errors;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static boolean isFastPath(NodeContext context, Map<String, Object> config) {
        String environment = context.getEnvironment().toLowerCase(Locale.ROOT);
        return FAST_PATH_ENVIRONMENTS.contains(environment) || configBoolean(config, "fast_path", false);
    }

    private static Recommendation fastPathRecommendation(Long incidentId) {
        return Recommendation.builder()
                .type(RecommendationType.GENERAL)
                .priority(RecommendationPriority.LOW)
                .title("Fast-path analysis")
                .description("Provider call skipped in fast-path mode.")
                .incidentId(incidentId)
                .build();
    }

    /**
     * Turn whatever a provider returned into plain maps.
     */
    static List<Map<String, Object>> normalize(List<?> raw) {
        List<Map<String, Object>> normalized = new ArrayList<>(raw.size());
        for (Object item : raw) {
            if (item == null) {
                continue;
            }
            if (item instanceof Recommendation recommendation) {
                normalized.add(recommendation.toMap());
            } else if (item instanceof Map<?, ?> map) {
                Map<String, Object> copy = new LinkedHashMap<>();
                map.forEach((k, v) -> copy.put(String.valueOf(k), v));
                normalized.add(copy);
            } else {
                normalized.add(beanToMap(item));
            }
        }
        return normalized;
    }

    private static Map<String, Object> beanToMap(Object item) {
        if (!(item instanceof CharSequence) && !(item instanceof Number) && !(item instanceof Boolean)) {
            try {
                return JsonPayloads.toMap(item);
            } catch (IllegalArgumentException e) {
                LOG.debug("Recommendation of type {} is not a bean: {}", item.getClass().getName(), e.getMessage());
            }
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("value", String.valueOf(item));
        return wrapped;
    }

    private static String firstString(List<Map<String, Object>> recommendations, String key) {
        if (recommendations.isEmpty()) {
            return "";
        }
        Object value = recommendations.get(0).get(key);
        return value != null ? String.valueOf(value) : "";
    }
}
