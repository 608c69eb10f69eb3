package org.cerespp.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.cerespp.application.port.MetricsPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} backed by OpenTelemetry counters and histograms.
 * <p><strong>Role:</strong> Selected by the CLI with {@code metricsExporter=otlp}.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created lazily in concurrent maps; safe across batch
 * workers.</p>
 * <p><strong>Observability:</strong> Metric keys are lower-cased and characters outside
 * {@code [a-z0-9._-]} replaced by {@code _} (so {@code step.index:S.micros} exports as
 * {@code step.index_s.micros}); the raw key is kept in the {@code cerespp.metric.key} attribute.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("cerespp.metric.key");
  private static final String FALLBACK_METRIC_NAME = "cerespp.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /** Creates an adapter configured from system properties and environment. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.debug("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Instrument<LongCounter> instrument = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), k ->
        new Instrument<>(
            meter.counterBuilder(sanitizeName(k)).setUnit("1").setDescription("cerespp counter for " + k).build(),
            Attributes.of(METRIC_KEY_ATTRIBUTE, k)));
    instrument.delegate().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Instrument<LongHistogram> instrument = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), k ->
        new Instrument<>(
            meter.histogramBuilder(sanitizeName(k)).ofLongs().setDescription("cerespp observation for " + k).build(),
            Attributes.of(METRIC_KEY_ATTRIBUTE, k)));
    instrument.delegate().record(value, instrument.attributes());
  }

  /** Pushes pending measurements to the exporter. */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Flushes and shuts down the meter provider. */
  @Override
  public void close() {
    bootstrap.close();
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-' || c == '.';
      result.append(allowed ? c : '_');
    }
    return result.toString();
  }

  private record Instrument<T>(T delegate, Attributes attributes) {}
}
