/**
 * Runtime configuration and YAML pipeline definitions.
 *
 * <ul>
 * <li>{@link com.alertrelay.pipeline.config.RelayConfig}: typed env-var configuration</li>
 * <li>{@link com.alertrelay.pipeline.config.PipelineDefinition} /
 * {@link com.alertrelay.pipeline.config.NodeDefinition}: SnakeYAML beans</li>
 * <li>{@link com.alertrelay.pipeline.config.PipelineDefinitionLoader}: env var, file or classpath loading</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.alertrelay.pipeline.config;
