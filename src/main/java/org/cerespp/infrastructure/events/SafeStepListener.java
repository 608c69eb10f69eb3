package org.cerespp.infrastructure.events;

import org.cerespp.application.port.StepListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decorator that keeps listener failures out of the pipeline.
 * <p><strong>Role:</strong> Wraps every listener handed to {@code ActivityPipeline}; a throwing listener is
 * logged at WARN and processing continues.</p>
 * <p><strong>Thread-safety:</strong> As thread-safe as the delegate.</p>
 *
 * @since 0.1.0
 */
public final class SafeStepListener implements StepListener {
  private static final Logger log = LoggerFactory.getLogger(SafeStepListener.class);

  private final StepListener delegate;

  private SafeStepListener(StepListener delegate) {
    this.delegate = delegate;
  }

  /**
   * Wraps {@code listener} unless it is already safe.
   *
   * @param listener listener to guard; {@code null} yields {@link StepListener#NO_OP}
   * @return guarded listener
   */
  public static StepListener wrap(StepListener listener) {
    if (listener == null || listener == StepListener.NO_OP) {
      return StepListener.NO_OP;
    }
    if (listener instanceof SafeStepListener) {
      return listener;
    }
    return new SafeStepListener(listener);
  }

  @Override
  public void onStepStarted(String name) {
    try {
      delegate.onStepStarted(name);
    } catch (RuntimeException ex) {
      log.warn("Step listener failed on start of {}", name, ex);
    }
  }

  @Override
  public void onStepCompleted(String name, double durationSeconds) {
    try {
      delegate.onStepCompleted(name, durationSeconds);
    } catch (RuntimeException ex) {
      log.warn("Step listener failed on completion of {}", name, ex);
    }
  }
}
