/**
 * Metrics adapters implementing {@link org.cerespp.application.port.MetricsPort}.
 * <p>The OpenTelemetry adapter exports over OTLP when enabled; otherwise a no-op meter is used.</p>
 *
 * @since 0.1.0
 */
package org.cerespp.infrastructure.metrics;
