package org.cerespp.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.cerespp.application.port.ActivityTableSink;
import org.cerespp.application.port.SpectrumSource;
import org.cerespp.config.PipelineConfig;
import org.cerespp.domain.mask.MaskCatalog;
import org.cerespp.domain.mask.MaskId;
import org.cerespp.domain.spectrum.Observation;
import org.cerespp.domain.spectrum.Order;
import org.cerespp.testutil.RecordingMetricsPort;
import org.cerespp.testutil.SyntheticSpectra;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class BatchActivityRunnerTest {
  private static List<Order> goodOrders;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final RecordingSink sink = new RecordingSink();

  @BeforeAll
  static void buildOrders() {
    goodOrders = SyntheticSpectra.absorptionOrders(
        MaskCatalog.builtIn().get(MaskId.G2), -8.0, 5000.0, 6200.0, 0.02, 2);
  }

  @Test
  void failuresAreIsolatedPerInput() throws IOException {
    BatchActivityRunner runner = runner(1);

    List<ProcessingResult> results =
        runner.run(List.of(Path.of("a.fits"), Path.of("missing.fits"), Path.of("flat.fits"), Path.of("b.fits")));

    assertEquals(4, results.size());
    assertTrue(results.get(0).succeeded());
    assertEquals(FailureKind.LOAD, results.get(1).failure().orElseThrow().kind());
    assertEquals(FailureKind.CONVERGENCE, results.get(2).failure().orElseThrow().kind());
    assertTrue(results.get(3).succeeded());
    assertEquals(-8.0, results.get(3).rvFit().orElseThrow().rv(), 0.05);
    assertEquals(1, metrics.count("pipeline.failed.load"));
    assertEquals(1, metrics.count("pipeline.failed.convergence"));
    assertEquals(2, metrics.count("pipeline.processed"));
  }

  @Test
  void parallelRunPublishesInInputOrder() throws IOException {
    BatchActivityRunner runner = runner(3);
    List<Path> inputs = List.of(
        Path.of("a.fits"), Path.of("flat.fits"), Path.of("b.fits"), Path.of("missing.fits"), Path.of("c.fits"));

    List<ProcessingResult> results = runner.run(inputs);

    List<Path> published = new ArrayList<>();
    for (ProcessingResult result : sink.results) {
      published.add(result.source());
    }
    assertEquals(inputs, published);
    assertEquals(5, results.size());
    assertEquals(3, results.stream().filter(ProcessingResult::succeeded).count());
  }

  @Test
  void runtimeExceptionFromSourceIsALoadFailure() {
    SpectrumSource broken = file -> {
      throw new IllegalStateException("corrupt header");
    };
    BatchActivityRunner runner = new BatchActivityRunner(broken, pipeline(), List.of(sink), metrics, 1);

    ProcessingResult result = runner.processOne(Path.of("x.fits"));

    assertFalse(result.succeeded());
    assertEquals(FailureKind.LOAD, result.failure().orElseThrow().kind());
    assertTrue(result.failure().orElseThrow().message().contains("corrupt header"));
  }

  @Test
  void sinkFailureMarksThatInputAndBatchContinues() {
    ActivityTableSink failingOnce = new ActivityTableSink() {
      private boolean failed;

      @Override
      public void write(ProcessingResult result) throws IOException {
        if (!failed) {
          failed = true;
          throw new IOException("disk full");
        }
        sink.write(result);
      }
    };
    BatchActivityRunner runner = new BatchActivityRunner(this::load, pipeline(), List.of(failingOnce), metrics, 1);

    List<ProcessingResult> results = runner.run(List.of(Path.of("a.fits"), Path.of("b.fits"), Path.of("c.fits")));

    assertEquals(3, results.size());
    ProcessingResult first = results.get(0);
    assertEquals(FailureKind.OUTPUT, first.failure().orElseThrow().kind());
    assertEquals("disk full", first.failure().orElseThrow().message());
    assertTrue(first.rvFit().isPresent());
    assertTrue(results.get(1).succeeded());
    assertTrue(results.get(2).succeeded());
    assertEquals(2, sink.results.size());
    assertEquals(1, metrics.count("pipeline.failed.output"));
  }

  @Test
  void parallelSinkFailureDoesNotStopOtherInputs() {
    ActivityTableSink failingOnA = result -> {
      if (result.source().equals(Path.of("a.fits"))) {
        throw new IOException("disk full");
      }
      sink.write(result);
    };
    BatchActivityRunner runner = new BatchActivityRunner(this::load, pipeline(), List.of(failingOnA), metrics, 3);

    List<ProcessingResult> results = runner.run(List.of(Path.of("a.fits"), Path.of("b.fits"), Path.of("c.fits")));

    assertEquals(FailureKind.OUTPUT, results.get(0).failure().orElseThrow().kind());
    assertTrue(results.get(1).succeeded());
    assertTrue(results.get(2).succeeded());
    assertEquals(2, sink.results.size());
  }

  @Test
  void workersMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new BatchActivityRunner(this::load, pipeline(), null, null, 0));
  }

  private BatchActivityRunner runner(int workers) {
    return new BatchActivityRunner(this::load, pipeline(), List.of(sink), metrics, workers);
  }

  private ActivityPipeline pipeline() {
    PipelineConfig config = PipelineConfig.fromMap(Map.of("ccf.rvMin", "-30", "ccf.rvMax", "30"));
    return new ActivityPipeline(config, MaskCatalog.builtIn(), null, null, metrics, null);
  }

  private Observation load(Path file) throws IOException {
    String name = file.getFileName().toString();
    if (name.startsWith("missing")) {
      throw new NoSuchFileException(name);
    }
    if (name.startsWith("flat")) {
      return SyntheticSpectra.observation(name, List.of(SyntheticSpectra.constantOrder(0, 7000.0, 7050.0, 0.05, 1.0, 0.01)));
    }
    return new Observation(file, name, "TEST", 2458000.5, goodOrders);
  }

  private static final class RecordingSink implements ActivityTableSink {
    private final List<ProcessingResult> results = new ArrayList<>();

    @Override
    public synchronized void write(ProcessingResult result) {
      results.add(result);
    }
  }
}
