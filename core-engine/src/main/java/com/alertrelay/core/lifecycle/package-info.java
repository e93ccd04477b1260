/**
 * Alert and incident lifecycle.
 *
 * <p>
 * {@link com.alertrelay.core.lifecycle.AlertLifecycleEngine} owns the
 * create/update/resolve state machine and incident grouping;
 * {@link com.alertrelay.core.lifecycle.CheckAlertBridge} adapts health-check
 * results onto it; {@link com.alertrelay.core.lifecycle.IncidentManager}
 * covers manual incident transitions.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertrelay.core.lifecycle;
