/**
 * Node abstraction shared by every pipeline step: the
 * {@link com.alertrelay.pipeline.node.PipelineNode} contract, the per-run
 * {@link com.alertrelay.pipeline.node.NodeContext} and the
 * {@link com.alertrelay.pipeline.node.NodeResult} each step produces.
 *
 * @since 1.0.0
 */
package com.alertrelay.pipeline.node;
