package org.cerespp.application.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.cerespp.application.port.ClockPort;
import org.cerespp.application.port.MergedSpectrumSink;
import org.cerespp.application.port.MetricsPort;
import org.cerespp.application.port.StepListener;
import org.cerespp.config.PipelineConfig;
import org.cerespp.domain.activity.ActivityIndexCalculator;
import org.cerespp.domain.activity.ActivityIndices;
import org.cerespp.domain.activity.IndexDefinition;
import org.cerespp.domain.activity.IndexDefinitions;
import org.cerespp.domain.activity.IndexName;
import org.cerespp.domain.activity.IndexValue;
import org.cerespp.domain.ccf.CcfProfile;
import org.cerespp.domain.ccf.CrossCorrelator;
import org.cerespp.domain.ccf.PeakFitter;
import org.cerespp.domain.ccf.RvFitResult;
import org.cerespp.domain.error.ConvergenceException;
import org.cerespp.domain.error.CoverageException;
import org.cerespp.domain.error.InvalidRvException;
import org.cerespp.domain.error.MergeDataException;
import org.cerespp.domain.mask.MaskCatalog;
import org.cerespp.domain.mask.SpectralMask;
import org.cerespp.domain.merge.EchelleMerger;
import org.cerespp.domain.merge.MergeResult;
import org.cerespp.domain.spectrum.Observation;
import org.cerespp.domain.spectrum.Order;
import org.cerespp.domain.spectrum.RestFrameShifter;
import org.cerespp.infrastructure.events.SafeStepListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one observation through correlation, peak fit, rest-frame shift, merge and
 * activity indices.
 * <p><strong>Why:</strong> Turns a reduced echelle spectrum into the per-epoch row of the activity table.</p>
 * <p><strong>Role:</strong> Application-layer use case composing the domain numeric stages.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Emit {@code mask-correlation}, {@code peak-fit}, {@code rest-frame}, {@code merge} and
 *   {@code index:<name>} step boundaries.</li>
 *   <li>Convert fit, shift and merge failures into a failed {@link ProcessingResult} for this observation only.</li>
 *   <li>Collect per-index coverage gaps without dropping the other indices.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls; one instance may serve all batch workers when its
 * listener, metrics and sink are thread-safe.</p>
 * <p><strong>Observability:</strong> Emits {@code pipeline.*}, {@code merge.rejected},
 * {@code index.coverage.missing} and {@code step.*.micros} metrics; MDC key {@code spectrum} names the input.</p>
 *
 * @since 0.1.0
 */
public final class ActivityPipeline {
  private static final Logger log = LoggerFactory.getLogger(ActivityPipeline.class);

  /** MDC key holding the file being processed. */
  public static final String MDC_SPECTRUM = "spectrum";

  static final String STEP_CORRELATION = "mask-correlation";
  static final String STEP_PEAK_FIT = "peak-fit";
  static final String STEP_REST_FRAME = "rest-frame";
  static final String STEP_MERGE = "merge";
  static final String STEP_INDEX_PREFIX = "index:";

  private final PipelineConfig config;
  private final MaskCatalog masks;
  private final CrossCorrelator correlator;
  private final PeakFitter fitter;
  private final RestFrameShifter shifter = new RestFrameShifter();
  private final EchelleMerger merger = new EchelleMerger();
  private final ActivityIndexCalculator calculator;
  private final Map<String, ActivityIndexCalculator> instrumentCalculators;
  private final MergedSpectrumSink mergedSink;
  private final StepListener listener;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a pipeline.
   *
   * @param config validated settings; must not be {@code null}
   * @param masks mask table; must not be {@code null}
   * @param mergedSink receives the merged spectrum when {@link PipelineConfig#save1d()} is set; may be
   *     {@code null} otherwise
   * @param listener step listener; {@code null} means none. Listener failures are logged and ignored.
   * @param metrics metrics port; {@code null} means {@link MetricsPort#NO_OP}
   * @param clock step timing clock; {@code null} means {@link ClockPort#SYSTEM}
   * @throws IllegalArgumentException if {@code save1d} is requested without a sink
   */
  public ActivityPipeline(
      PipelineConfig config,
      MaskCatalog masks,
      MergedSpectrumSink mergedSink,
      StepListener listener,
      MetricsPort metrics,
      ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.masks = Objects.requireNonNull(masks, "masks");
    if (config.save1d() && mergedSink == null) {
      throw new IllegalArgumentException("output.save1d requires a merged spectrum sink");
    }
    this.mergedSink = config.save1d() ? mergedSink : null;
    this.listener = SafeStepListener.wrap(listener);
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.correlator =
        new CrossCorrelator(
            config.velocityGrid(), config.windowKms(), config.windowSamples(), config.maxGridPoints());
    this.fitter = new PeakFitter(config.fitHalfWindowKms(), config.fitMinSamples(), config.fitMaxIterations());
    this.calculator =
        new ActivityIndexCalculator(
            IndexDefinitions.standard(config.sIndexCalibration()), config.minBandPixels());
    Map<String, ActivityIndexCalculator> perInstrument = new HashMap<>();
    for (Map.Entry<String, Double> entry : config.sIndexCalibrationByInstrument().entrySet()) {
      perInstrument.put(
          entry.getKey(),
          new ActivityIndexCalculator(IndexDefinitions.standard(entry.getValue()), config.minBandPixels()));
    }
    this.instrumentCalculators = Map.copyOf(perInstrument);
  }

  /** @return settings this pipeline was built with */
  public PipelineConfig config() {
    return config;
  }

  /**
   * Processes an observation with the configured mask.
   *
   * @param observation loaded observation
   * @return result; failed stages are reported through {@link ProcessingResult#failure()}
   */
  public ProcessingResult process(Observation observation) {
    return process(observation, masks.get(config.mask()));
  }

  /**
   * Processes an observation with a mask named at call time.
   *
   * @param observation loaded observation
   * @param maskId mask identifier, e.g. {@code K5}
   * @return result; failed stages are reported through {@link ProcessingResult#failure()}
   * @throws org.cerespp.domain.error.UnknownMaskException if {@code maskId} is not a supported mask; raised
   *     before any numeric work
   */
  public ProcessingResult process(Observation observation, String maskId) {
    return process(observation, masks.resolve(maskId));
  }

  private ProcessingResult process(Observation observation, SpectralMask mask) {
    Objects.requireNonNull(observation, "observation");
    String previous = MDC.get(MDC_SPECTRUM);
    MDC.put(MDC_SPECTRUM, observation.source().getFileName().toString());
    try {
      return run(observation, mask);
    } finally {
      if (previous == null) {
        MDC.remove(MDC_SPECTRUM);
      } else {
        MDC.put(MDC_SPECTRUM, previous);
      }
    }
  }

  private ProcessingResult run(Observation observation, SpectralMask mask) {
    Map<String, Double> timings = new LinkedHashMap<>();
    log.debug(
        "Processing {} target={} orders={} mask={}",
        observation.source(),
        observation.target(),
        observation.orders().size(),
        mask.id());

    CcfProfile profile =
        step(STEP_CORRELATION, timings, () -> correlator.correlate(observation.orders(), mask));
    log.debug("CCF computed with {} of {} valid samples", profile.validCount(), profile.size());

    RvFitResult fit;
    try {
      fit = step(STEP_PEAK_FIT, timings, () -> fitter.fit(profile));
    } catch (ConvergenceException ex) {
      return fail(observation, timings, null, FailureKind.CONVERGENCE, ex);
    }
    if (!fit.hasBis()) {
      log.info("Bisector span not measurable for {}", observation.target());
    }

    List<Order> restFrame;
    try {
      restFrame = step(STEP_REST_FRAME, timings, () -> shifter.toRestFrame(observation.orders(), fit.rv()));
    } catch (InvalidRvException ex) {
      return fail(observation, timings, fit, FailureKind.INVALID_RV, ex);
    }

    MergeResult merged;
    try {
      merged = step(STEP_MERGE, timings, () -> merger.merge(restFrame));
    } catch (MergeDataException ex) {
      return fail(observation, timings, fit, FailureKind.MERGE, ex);
    }
    int rejected = merged.rejected().size();
    metrics.observe("merge.rejected", rejected);
    if (rejected > 0) {
      log.debug("Merge excluded {} wavelength samples without usable flux/error", rejected);
    }

    ActivityIndices indices = computeIndices(calculatorFor(observation), merged, timings);

    Optional<Path> artifact = Optional.empty();
    Optional<ProcessingResult.Failure> failure = Optional.empty();
    if (mergedSink != null) {
      try {
        artifact = Optional.of(mergedSink.write(observation.target(), observation.bjd(), merged.spectrum()));
      } catch (IOException ex) {
        log.error("Failed to write merged spectrum for {}", observation.source(), ex);
        metrics.increment("pipeline.failed." + FailureKind.OUTPUT.metricSuffix());
        failure = Optional.of(new ProcessingResult.Failure(FailureKind.OUTPUT, ex.getMessage()));
      }
    }

    if (failure.isEmpty()) {
      metrics.increment("pipeline.processed");
    }
    log.info(
        "Processed {} target={} rv={} km/s e_rv={} fwhm={} snr={} indices={}/{}",
        observation.source().getFileName(),
        observation.target(),
        format(fit.rv()),
        format(fit.rvError()),
        format(fit.fwhm()),
        format(merged.spectrum().signalToNoise()),
        indices.values().size(),
        calculator.definitions().size());
    return new ProcessingResult(
        observation.source(),
        observation.target(),
        observation.instrument(),
        observation.bjd(),
        Optional.of(fit),
        Optional.of(indices),
        artifact,
        merged.spectrum().signalToNoise(),
        rejected,
        timings,
        failure);
  }

  private ActivityIndexCalculator calculatorFor(Observation observation) {
    ActivityIndexCalculator specific =
        instrumentCalculators.get(observation.instrument().toUpperCase(Locale.ROOT));
    if (specific == null) {
      return calculator;
    }
    log.debug("Using S index calibration {} for instrument {}",
        config.sIndexCalibrationFor(observation.instrument()), observation.instrument());
    return specific;
  }

  private ActivityIndices computeIndices(
      ActivityIndexCalculator indexCalculator, MergeResult merged, Map<String, Double> timings) {
    Map<IndexName, IndexValue> values = new EnumMap<>(IndexName.class);
    Map<IndexName, CoverageException> missing = new EnumMap<>(IndexName.class);
    for (IndexDefinition definition : indexCalculator.definitions()) {
      String name = STEP_INDEX_PREFIX + definition.name().label();
      try {
        values.put(definition.name(), step(name, timings, () -> indexCalculator.compute(merged.spectrum(), definition)));
      } catch (CoverageException ex) {
        missing.put(definition.name(), ex);
        metrics.increment("index.coverage.missing");
        log.info("{}", ex.getMessage());
      }
    }
    return new ActivityIndices(values, missing);
  }

  private ProcessingResult fail(
      Observation observation,
      Map<String, Double> timings,
      RvFitResult fit,
      FailureKind kind,
      RuntimeException cause) {
    metrics.increment("pipeline.failed." + kind.metricSuffix());
    log.warn("Processing {} failed ({}): {}", observation.source().getFileName(), kind, cause.getMessage());
    return new ProcessingResult(
        observation.source(),
        observation.target(),
        observation.instrument(),
        observation.bjd(),
        Optional.ofNullable(fit),
        Optional.empty(),
        Optional.empty(),
        Double.NaN,
        0,
        timings,
        Optional.of(new ProcessingResult.Failure(kind, cause.getMessage())));
  }

  private <T> T step(String name, Map<String, Double> timings, Supplier<T> body) {
    listener.onStepStarted(name);
    long start = clock.nanoTime();
    try {
      return body.get();
    } finally {
      long elapsedNanos = Math.max(0L, clock.nanoTime() - start);
      double seconds = elapsedNanos / 1e9;
      timings.put(name, seconds);
      metrics.observe("step." + name.replace(':', '.') + ".micros", elapsedNanos / 1_000L);
      listener.onStepCompleted(name, seconds);
    }
  }

  private static String format(double value) {
    return Double.isFinite(value) ? String.format(Locale.ROOT, "%.4f", value) : "n/a";
  }
}
