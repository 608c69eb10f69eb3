package org.cerespp.application.port;

/**
 * <strong>What:</strong> Port abstracting pipeline metrics emission.
 * <p><strong>Why:</strong> Lets the pipeline record counters and step latencies without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from batch workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract ({@code pipeline.processed},
 * {@code pipeline.failed.<kind>}, {@code merge.rejected}, {@code index.coverage.missing},
 * {@code step.<name>.micros}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier, e.g. {@code pipeline.processed}; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; semantics defined by the caller (e.g. microseconds, rejected points)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
