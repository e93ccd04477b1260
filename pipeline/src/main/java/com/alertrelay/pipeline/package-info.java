/**
 * The pipeline half of Alert Relay: node types, the executor, runtime
 * configuration and the {@link com.alertrelay.pipeline.AlertRelay} runtime
 * that wires them to the core engine.
 *
 * @since 1.0.0
 */
package com.alertrelay.pipeline;
