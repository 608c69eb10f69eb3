package org.cerespp.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.cerespp.application.pipeline.ActivityPipeline;
import org.cerespp.application.port.ActivityTableSink;
import org.cerespp.application.port.MetricsPort;
import org.cerespp.application.port.StepListener;
import org.cerespp.config.PipelineConfig;
import org.cerespp.domain.mask.MaskCatalog;
import org.cerespp.infrastructure.events.CompositeStepListener;
import org.cerespp.infrastructure.events.JsonLinesStepListener;
import org.cerespp.infrastructure.events.LoggingStepListener;
import org.cerespp.infrastructure.fits.FitsMergedSpectrumWriter;
import org.cerespp.infrastructure.fits.FitsSpectrumSource;
import org.cerespp.infrastructure.metrics.NoOpMetricsAdapter;
import org.cerespp.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import org.cerespp.infrastructure.output.JsonLinesResultWriter;
import org.cerespp.infrastructure.output.TextActivityTableWriter;
import org.cerespp.infrastructure.time.SystemClockAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the FITS, table, JSON and metrics adapters around an {@link ActivityPipeline} for one CLI run
 * and closes them afterwards.
 */
final class PipelineRuntime implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PipelineRuntime.class);

  private final FitsSpectrumSource source;
  private final ActivityPipeline pipeline;
  private final List<ActivityTableSink> sinks;
  private final MetricsPort metrics;
  private final JsonLinesStepListener stepLog;

  private PipelineRuntime(
      FitsSpectrumSource source,
      ActivityPipeline pipeline,
      List<ActivityTableSink> sinks,
      MetricsPort metrics,
      JsonLinesStepListener stepLog) {
    this.source = source;
    this.pipeline = pipeline;
    this.sinks = List.copyOf(sinks);
    this.metrics = metrics;
    this.stepLog = stepLog;
  }

  /**
   * Opens every adapter the configuration asks for.
   *
   * @param config validated settings
   * @param outputDirectory directory receiving the table, JSON lines and merged spectra
   * @param metricsExporter {@code otlp} or {@code none}
   * @param stepLogFile JSON-lines step log, or {@code null} for none
   * @return open runtime; close it when done
   * @throws IOException if an output file cannot be opened
   */
  static PipelineRuntime open(
      PipelineConfig config, Path outputDirectory, String metricsExporter, Path stepLogFile)
      throws IOException {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    MetricsPort metrics = "otlp".equals(metricsExporter)
        ? new OpenTelemetryMetricsAdapter()
        : new NoOpMetricsAdapter();
    List<ActivityTableSink> sinks = new ArrayList<>();
    JsonLinesStepListener stepLog = null;
    try {
      sinks.add(new TextActivityTableWriter(outputDirectory, config.missingValue()));
      if (config.json()) {
        sinks.add(new JsonLinesResultWriter(outputDirectory.resolve(JsonLinesResultWriter.DEFAULT_FILE_NAME)));
      }
      List<StepListener> listeners = new ArrayList<>();
      listeners.add(new LoggingStepListener(metrics));
      if (stepLogFile != null) {
        stepLog = new JsonLinesStepListener(stepLogFile);
        listeners.add(stepLog);
      }
      FitsMergedSpectrumWriter mergedSink = config.save1d() ? new FitsMergedSpectrumWriter(outputDirectory) : null;
      ActivityPipeline pipeline = new ActivityPipeline(
          config,
          MaskCatalog.builtIn(),
          mergedSink,
          new CompositeStepListener(listeners),
          metrics,
          new SystemClockAdapter());
      FitsSpectrumSource source = new FitsSpectrumSource(config.fluxLayer(), config.errorLayer());
      return new PipelineRuntime(source, pipeline, sinks, metrics, stepLog);
    } catch (IOException | RuntimeException ex) {
      new PipelineRuntime(null, null, sinks, metrics, stepLog).close();
      throw ex;
    }
  }

  FitsSpectrumSource source() {
    return source;
  }

  ActivityPipeline pipeline() {
    return pipeline;
  }

  List<ActivityTableSink> sinks() {
    return sinks;
  }

  MetricsPort metrics() {
    return metrics;
  }

  /** Closes sinks, the step log and the metrics exporter; close failures are logged. */
  @Override
  public void close() {
    for (ActivityTableSink sink : sinks) {
      try {
        sink.close();
      } catch (IOException ex) {
        log.warn("Failed to close result sink {}", sink.getClass().getSimpleName(), ex);
      }
    }
    if (stepLog != null) {
      try {
        stepLog.close();
      } catch (IOException ex) {
        log.warn("Failed to close step log", ex);
      }
    }
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }
}
