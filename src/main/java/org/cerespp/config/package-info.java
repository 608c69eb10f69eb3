/**
 * Configuration records and loaders: defaults, YAML files and CLI options merged into a {@link
 * org.cerespp.config.PipelineConfig}.
 *
 * @since 0.1.0
 */
package org.cerespp.config;
