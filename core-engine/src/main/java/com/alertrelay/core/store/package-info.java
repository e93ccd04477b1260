/**
 * Persistence SPI used by the lifecycle engine and the pipeline, with
 * in-memory reference implementations.
 *
 * @since 1.0.0
 */
package com.alertrelay.core.store;
