package org.cerespp.application.port;

/**
 * <strong>What:</strong> Receives named step boundaries while an observation is processed.
 * <p><strong>Role:</strong> Optional progress capability of the pipeline. Step names are
 * {@code mask-correlation}, {@code peak-fit}, {@code rest-frame}, {@code merge} and {@code index:<name>}.</p>
 * <p><strong>Thread-safety:</strong> Batch workers may call one listener concurrently for different inputs.</p>
 *
 * @since 0.1.0
 */
public interface StepListener {
  /**
   * Called before a step runs.
   *
   * @param name step name
   */
  void onStepStarted(String name);

  /**
   * Called after a step finished, whether it succeeded or not.
   *
   * @param name step name
   * @param durationSeconds wall time spent in the step
   */
  void onStepCompleted(String name, double durationSeconds);

  /** Listener that ignores every event. */
  StepListener NO_OP = new StepListener() {
    @Override public void onStepStarted(String name) {}

    @Override public void onStepCompleted(String name, double durationSeconds) {}
  };
}
