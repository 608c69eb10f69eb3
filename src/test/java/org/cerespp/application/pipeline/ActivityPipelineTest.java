package org.cerespp.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.cerespp.application.port.MergedSpectrumSink;
import org.cerespp.application.port.StepListener;
import org.cerespp.config.PipelineConfig;
import org.cerespp.domain.activity.IndexName;
import org.cerespp.domain.ccf.RvFitResult;
import org.cerespp.domain.error.UnknownMaskException;
import org.cerespp.domain.mask.MaskCatalog;
import org.cerespp.domain.mask.MaskId;
import org.cerespp.domain.merge.MergedSpectrum;
import org.cerespp.domain.spectrum.Observation;
import org.cerespp.domain.spectrum.Order;
import org.cerespp.testutil.RecordingMetricsPort;
import org.cerespp.testutil.RecordingStepListener;
import org.cerespp.testutil.SyntheticSpectra;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ActivityPipelineTest {
  private static final double INJECTED_RV = 15.0;
  private static Observation observation;

  private final RecordingStepListener listener = new RecordingStepListener();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @BeforeAll
  static void buildObservation() {
    List<Order> orders = SyntheticSpectra.absorptionOrders(
        MaskCatalog.builtIn().get(MaskId.G2), INJECTED_RV, 3880.0, 6700.0, 0.02, 4);
    observation = SyntheticSpectra.observation("star.fits", orders);
  }

  @Test
  void processesSyntheticObservationEndToEnd() {
    ActivityPipeline pipeline = pipeline(Map.of());

    ProcessingResult result = pipeline.process(observation);

    assertTrue(result.succeeded(), () -> "failure: " + result.failure());
    RvFitResult fit = result.rvFit().orElseThrow();
    assertEquals(INJECTED_RV, fit.rv(), 0.05);
    assertTrue(fit.contrast() > 0);
    assertEquals("HDstar", result.target());
    assertTrue(result.signalToNoise() > 0);
    for (IndexName name : IndexName.values()) {
      assertTrue(result.indices().orElseThrow().get(name).isPresent(), name.label());
    }
    assertEquals(1, metrics.count("pipeline.processed"));
    assertTrue(metrics.hasObservation("step.mask-correlation.micros"));
    assertTrue(metrics.hasObservation("step.index.S.micros"));
    assertTrue(result.mergedSpectrumPath().isEmpty());
  }

  @Test
  void stepsRunInPipelineOrder() {
    pipeline(Map.of()).process(observation);

    List<String> starts = new ArrayList<>();
    for (String event : listener.events()) {
      if (event.startsWith("start:")) {
        starts.add(event.substring("start:".length()));
      }
    }
    assertEquals(
        List.of("mask-correlation", "peak-fit", "rest-frame", "merge",
            "index:S", "index:Halpha", "index:HeI", "index:NaID1", "index:NaID2", "index:NaID1D2"),
        starts);
    assertEquals(starts.size() * 2, listener.events().size());
  }

  @Test
  void unknownMaskFailsBeforeAnyStep() {
    ActivityPipeline pipeline = pipeline(Map.of());

    assertThrows(UnknownMaskException.class, () -> pipeline.process(observation, "X9"));
    assertTrue(listener.events().isEmpty());
    assertEquals(0, metrics.count("pipeline.processed"));
  }

  @Test
  void spectrumWithoutMaskCoverageIsAConvergenceFailure() {
    Order featureless = SyntheticSpectra.constantOrder(0, 7000.0, 7100.0, 0.05, 1.0, 0.01);
    Observation empty = SyntheticSpectra.observation("flat.fits", List.of(featureless));

    ProcessingResult result = pipeline(Map.of()).process(empty);

    assertFalse(result.succeeded());
    assertEquals(FailureKind.CONVERGENCE, result.failure().orElseThrow().kind());
    assertTrue(result.indices().isEmpty());
    assertEquals(1, metrics.count("pipeline.failed.convergence"));
    assertTrue(listener.events().contains("end:peak-fit"));
    assertFalse(listener.events().contains("start:merge"));
  }

  @Test
  void mergedSpectrumIsHandedToSinkWhenRequested() {
    List<MergedSpectrum> written = new ArrayList<>();
    MergedSpectrumSink sink = (target, bjd, spectrum) -> {
      written.add(spectrum);
      return Path.of(target + ".fits");
    };
    ActivityPipeline pipeline = new ActivityPipeline(
        PipelineConfig.fromMap(Map.of("ccf.rvMin", "-40", "ccf.rvMax", "40", "save1d", "true")),
        MaskCatalog.builtIn(), sink, listener, metrics, null);

    ProcessingResult result = pipeline.process(observation);

    assertEquals(1, written.size());
    assertEquals(Path.of("HDstar.fits"), result.mergedSpectrumPath().orElseThrow());
  }

  @Test
  void failingListenerDoesNotAbortProcessing() {
    ActivityPipeline pipeline = new ActivityPipeline(
        config(Map.of()),
        MaskCatalog.builtIn(),
        null,
        new StepListener() {
          @Override
          public void onStepStarted(String name) {
            throw new IllegalStateException("listener down");
          }

          @Override
          public void onStepCompleted(String name, double durationSeconds) {}
        },
        metrics,
        null);

    assertTrue(pipeline.process(observation).succeeded());
  }

  @Test
  void instrumentCalibrationScalesOnlyThatInstrumentsSIndex() {
    Observation harps = new Observation(
        observation.source(), observation.target(), "HARPS", observation.bjd(), observation.orders());
    ActivityPipeline calibrated = pipeline(Map.of("activity.sIndexCalibration.harps", "2.5"));

    double base = pipeline(Map.of()).process(harps).indices().orElseThrow().get(IndexName.S).orElseThrow().value();
    ProcessingResult harpsResult = calibrated.process(harps);
    ProcessingResult otherResult = calibrated.process(observation);

    assertEquals(2.5 * base, harpsResult.indices().orElseThrow().get(IndexName.S).orElseThrow().value(), 1e-9);
    assertEquals(base, otherResult.indices().orElseThrow().get(IndexName.S).orElseThrow().value(), 1e-9);
    assertEquals(
        otherResult.indices().orElseThrow().get(IndexName.HALPHA).orElseThrow().value(),
        harpsResult.indices().orElseThrow().get(IndexName.HALPHA).orElseThrow().value(),
        1e-12);
  }

  @Test
  void save1dWithoutSinkIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new ActivityPipeline(config(Map.of("save1d", "true")), MaskCatalog.builtIn(), null, null, null, null));
  }

  private ActivityPipeline pipeline(Map<String, String> overrides) {
    return new ActivityPipeline(config(overrides), MaskCatalog.builtIn(), null, listener, metrics, null);
  }

  private static PipelineConfig config(Map<String, String> overrides) {
    Map<String, String> options = new HashMap<>(Map.of("ccf.rvMin", "-40", "ccf.rvMax", "40"));
    options.putAll(overrides);
    return PipelineConfig.fromMap(options);
  }
}
