package org.cerespp.infrastructure.metrics;

import org.cerespp.application.port.MetricsPort;

/**
 * {@link MetricsPort} that drops every update; selected with {@code metricsExporter=none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
