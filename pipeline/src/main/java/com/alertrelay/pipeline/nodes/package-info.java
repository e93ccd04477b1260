/**
 * The built-in pipeline nodes: {@code ingest}, {@code context},
 * {@code intelligence}, {@code notify} and {@code transform}.
 *
 * @since 1.0.0
 */
package com.alertrelay.pipeline.nodes;
