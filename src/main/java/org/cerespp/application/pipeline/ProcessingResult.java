package org.cerespp.application.pipeline;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.cerespp.domain.activity.ActivityIndices;
import org.cerespp.domain.ccf.RvFitResult;

/**
 * <strong>What:</strong> Outcome of processing one observation, successful or not.
 * <p><strong>Role:</strong> Produced by {@link ActivityPipeline} and {@link BatchActivityRunner}; consumed by the
 * result sinks and the CLI summary.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * <p>Stages that did not run are explicitly absent: a failed peak fit leaves {@link #rvFit()} and
 * {@link #indices()} empty, and {@link #failure()} names the cause.</p>
 *
 * @param source input file
 * @param target target name from the input header
 * @param instrument instrument identifier from the input header
 * @param bjd barycentric Julian date; NaN when the input could not be read
 * @param rvFit radial velocity and profile diagnostics, if the peak fit succeeded
 * @param indices activity indices, if the merge succeeded
 * @param mergedSpectrumPath path of the written 1-D rest-frame artifact, if one was requested and written
 * @param signalToNoise signal to noise of the merged spectrum; NaN when no merge happened
 * @param rejectedPoints merged-grid wavelengths excluded for lack of usable data
 * @param stepSeconds wall time per named step, in execution order
 * @param failure cause of a failed or partial run
 * @since 0.1.0
 */
public record ProcessingResult(
    Path source,
    String target,
    String instrument,
    double bjd,
    Optional<RvFitResult> rvFit,
    Optional<ActivityIndices> indices,
    Optional<Path> mergedSpectrumPath,
    double signalToNoise,
    int rejectedPoints,
    Map<String, Double> stepSeconds,
    Optional<Failure> failure) {

  /**
   * Normalizes absent values and copies the timing map.
   */
  public ProcessingResult {
    Objects.requireNonNull(source, "source");
    target = target == null || target.isBlank() ? "unknown" : target;
    instrument = instrument == null || instrument.isBlank() ? "unknown" : instrument;
    rvFit = Objects.requireNonNullElse(rvFit, Optional.empty());
    indices = Objects.requireNonNullElse(indices, Optional.empty());
    mergedSpectrumPath = Objects.requireNonNullElse(mergedSpectrumPath, Optional.empty());
    failure = Objects.requireNonNullElse(failure, Optional.empty());
    stepSeconds = stepSeconds == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(stepSeconds));
  }

  /**
   * Creates a result for an input that could not be loaded.
   *
   * @param source input file
   * @param message failure description
   * @return failed result with every measurement absent
   */
  public static ProcessingResult loadFailure(Path source, String message) {
    return new ProcessingResult(
        source,
        null,
        null,
        Double.NaN,
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Double.NaN,
        0,
        Map.of(),
        Optional.of(new Failure(FailureKind.LOAD, message)));
  }

  /**
   * Copies this result with a failure recorded; measurements are kept.
   *
   * @param cause failure to record
   * @return copy carrying {@code cause}
   */
  public ProcessingResult withFailure(Failure cause) {
    return new ProcessingResult(
        source,
        target,
        instrument,
        bjd,
        rvFit,
        indices,
        mergedSpectrumPath,
        signalToNoise,
        rejectedPoints,
        stepSeconds,
        Optional.of(Objects.requireNonNull(cause, "cause")));
  }

  /** @return {@code true} when no failure was recorded */
  public boolean succeeded() {
    return failure.isEmpty();
  }

  /**
   * Why a run failed.
   *
   * @param kind failure category
   * @param message human-readable cause
   */
  public record Failure(FailureKind kind, String message) {
    public Failure {
      Objects.requireNonNull(kind, "kind");
      message = message == null ? "" : message;
    }
  }
}
