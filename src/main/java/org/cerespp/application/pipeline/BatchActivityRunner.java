package org.cerespp.application.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.cerespp.application.port.ActivityTableSink;
import org.cerespp.application.port.MetricsPort;
import org.cerespp.application.port.SpectrumSource;
import org.cerespp.domain.spectrum.Observation;
import org.cerespp.infrastructure.exec.ExecutorFactories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Processes many observations and collects one result per input, in input order.
 * <p><strong>Why:</strong> A failing spectrum must not stop the rest of a night's batch.</p>
 * <p><strong>Role:</strong> Application-layer driver around {@link ActivityPipeline}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load each input through {@link SpectrumSource}; load errors become {@link FailureKind#LOAD} results.</li>
 *   <li>Run inputs on {@code workers} threads and hand results to the sinks in input order.</li>
 *   <li>Sink write errors become {@link FailureKind#OUTPUT} on that input's result.</li>
 *   <li>Never throw because of a single input.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #run(List)} may be called from one thread at a time.</p>
 *
 * @since 0.1.0
 */
public final class BatchActivityRunner {
  private static final Logger log = LoggerFactory.getLogger(BatchActivityRunner.class);

  private final SpectrumSource source;
  private final ActivityPipeline pipeline;
  private final List<ActivityTableSink> sinks;
  private final MetricsPort metrics;
  private final int workers;

  /**
   * Creates a runner.
   *
   * @param source spectrum loader; must not be {@code null}
   * @param pipeline single-observation pipeline; must not be {@code null}
   * @param sinks result sinks written in input order; may be empty
   * @param metrics metrics port; {@code null} means {@link MetricsPort#NO_OP}
   * @param workers worker threads; must be positive
   */
  public BatchActivityRunner(
      SpectrumSource source,
      ActivityPipeline pipeline,
      List<ActivityTableSink> sinks,
      MetricsPort metrics,
      int workers) {
    this.source = Objects.requireNonNull(source, "source");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.sinks = sinks == null ? List.of() : List.copyOf(sinks);
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    this.workers = workers;
  }

  /**
   * Processes the inputs.
   *
   * @param inputs files to process
   * @return one result per input, same order
   */
  public List<ProcessingResult> run(List<Path> inputs) {
    Objects.requireNonNull(inputs, "inputs");
    log.info("Batch starting with {} input(s) on {} worker(s)", inputs.size(), workers);
    List<ProcessingResult> results = workers == 1 ? runSequential(inputs) : runParallel(inputs);
    long failed = results.stream().filter(r -> !r.succeeded()).count();
    log.info("Batch finished: {} succeeded, {} failed", results.size() - failed, failed);
    return results;
  }

  /**
   * Processes a single input, converting every failure into a result.
   *
   * @param input file to process
   * @return result for {@code input}
   */
  public ProcessingResult processOne(Path input) {
    String previous = MDC.get(ActivityPipeline.MDC_SPECTRUM);
    MDC.put(ActivityPipeline.MDC_SPECTRUM, String.valueOf(input.getFileName()));
    try {
      Observation observation;
      try {
        observation = source.load(input);
      } catch (IOException | RuntimeException ex) {
        metrics.increment("pipeline.failed." + FailureKind.LOAD.metricSuffix());
        log.warn("Failed to load {}: {}", input, ex.getMessage());
        log.debug("Load failure detail for {}", input, ex);
        return ProcessingResult.loadFailure(input, ex.getMessage());
      }
      try {
        return pipeline.process(observation);
      } catch (RuntimeException ex) {
        metrics.increment("pipeline.failed." + FailureKind.INTERNAL.metricSuffix());
        log.error("Unexpected failure processing {}", input, ex);
        return internalFailure(observation, ex);
      }
    } finally {
      if (previous == null) {
        MDC.remove(ActivityPipeline.MDC_SPECTRUM);
      } else {
        MDC.put(ActivityPipeline.MDC_SPECTRUM, previous);
      }
    }
  }

  private List<ProcessingResult> runSequential(List<Path> inputs) {
    List<ProcessingResult> results = new ArrayList<>(inputs.size());
    for (Path input : inputs) {
      results.add(publish(processOne(input)));
    }
    return results;
  }

  private List<ProcessingResult> runParallel(List<Path> inputs) {
    ExecutorService executor =
        ExecutorFactories.newWorkerPool(
            workers,
            "cerespp-batch",
            (thread, ex) -> log.error("Uncaught exception in batch worker {}", thread.getName(), ex));
    List<ProcessingResult> results = new ArrayList<>(inputs.size());
    try {
      List<Future<ProcessingResult>> futures = new ArrayList<>(inputs.size());
      for (Path input : inputs) {
        futures.add(executor.submit(() -> processOne(input)));
      }
      for (int i = 0; i < futures.size(); i++) {
        results.add(publish(await(futures.get(i), inputs.get(i))));
      }
    } finally {
      executor.shutdownNow();
      try {
        if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
          log.warn("Batch workers did not terminate within 5 seconds");
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for batch workers to stop");
      }
    }
    return results;
  }

  private ProcessingResult await(Future<ProcessingResult> future, Path input) {
    try {
      return future.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      log.warn("Interrupted while waiting for {}", input);
      return failure(input, "interrupted");
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      metrics.increment("pipeline.failed." + FailureKind.INTERNAL.metricSuffix());
      log.error("Batch worker failed on {}", input, cause);
      return failure(input, String.valueOf(cause.getMessage()));
    }
  }

  private ProcessingResult publish(ProcessingResult result) {
    ProcessingResult.Failure sinkFailure = null;
    for (ActivityTableSink sink : sinks) {
      try {
        sink.write(result);
      } catch (IOException ex) {
        log.warn("Failed to write result for {}: {}", result.source(), ex.getMessage());
        log.debug("Sink failure detail for {}", result.source(), ex);
        if (sinkFailure == null) {
          sinkFailure = new ProcessingResult.Failure(FailureKind.OUTPUT, ex.getMessage());
        }
      }
    }
    if (sinkFailure == null) {
      return result;
    }
    metrics.increment("pipeline.failed." + FailureKind.OUTPUT.metricSuffix());
    return result.failure().isPresent() ? result : result.withFailure(sinkFailure);
  }

  private static ProcessingResult failure(Path input, String message) {
    return new ProcessingResult(
        input,
        null,
        null,
        Double.NaN,
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Double.NaN,
        0,
        null,
        Optional.of(new ProcessingResult.Failure(FailureKind.INTERNAL, message)));
  }

  private static ProcessingResult internalFailure(Observation observation, RuntimeException ex) {
    return new ProcessingResult(
        observation.source(),
        observation.target(),
        observation.instrument(),
        observation.bjd(),
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Double.NaN,
        0,
        null,
        Optional.of(new ProcessingResult.Failure(FailureKind.INTERNAL, ex.getMessage())));
  }
}
