package com.alertrelay.pipeline.intelligence;

import com.alertrelay.core.model.Incident;

import java.util.List;

/**
 * Produces remediation recommendations for an incident.
 *
 * <p>
 * The result list may hold {@link Recommendation}s, plain maps or arbitrary
 * beans; the intelligence node normalizes whatever comes back into maps.
 * Calls run on a worker thread under a deadline and may be abandoned, so
 * implementations must not rely on being awaited.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnalysisProvider {

    String name();

    /**
     * @param incident the incident under analysis, {@code null} when the run has none
     */
    List<?> run(Incident incident);
}
