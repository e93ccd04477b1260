/**
 * Domain model for Alert Relay.
 *
 * <p>
 * Two families of types live here:
 * </p>
 * <ul>
 * <li>immutable parse results produced by source drivers:
 * {@link com.alertrelay.core.model.NormalizedAlert} and
 * {@link com.alertrelay.core.model.NormalizedPayload}</li>
 * <li>mutable persisted records owned by the lifecycle engine:
 * {@link com.alertrelay.core.model.Alert},
 * {@link com.alertrelay.core.model.Incident} and the append-only
 * {@link com.alertrelay.core.model.AlertHistory}</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.alertrelay.core.model;
