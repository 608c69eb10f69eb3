/**
 * Application use cases: the single-observation {@link org.cerespp.application.pipeline.ActivityPipeline} and the
 * failure-isolating {@link org.cerespp.application.pipeline.BatchActivityRunner}.
 * <p>Pipelines accept a validated {@link org.cerespp.config.PipelineConfig} and surface counters via
 * {@link org.cerespp.application.port.MetricsPort}. Batch workers follow the {@code cerespp-batch-*} naming
 * convention.</p>
 *
 * @since 0.1.0
 */
package org.cerespp.application.pipeline;
