package org.cerespp.infrastructure.events;

import java.util.ArrayList;
import java.util.List;
import org.cerespp.application.port.StepListener;

/**
 * Fans step events out to several listeners in registration order. Each delegate is guarded by
 * {@link SafeStepListener}, so one failing listener does not starve the others.
 *
 * @since 0.1.0
 */
public final class CompositeStepListener implements StepListener {
  private final List<StepListener> delegates;

  public CompositeStepListener(List<StepListener> delegates) {
    List<StepListener> guarded = new ArrayList<>();
    if (delegates != null) {
      for (StepListener delegate : delegates) {
        if (delegate != null) {
          guarded.add(SafeStepListener.wrap(delegate));
        }
      }
    }
    this.delegates = List.copyOf(guarded);
  }

  @Override
  public void onStepStarted(String name) {
    for (StepListener delegate : delegates) {
      delegate.onStepStarted(name);
    }
  }

  @Override
  public void onStepCompleted(String name, double durationSeconds) {
    for (StepListener delegate : delegates) {
      delegate.onStepCompleted(name, durationSeconds);
    }
  }
}
