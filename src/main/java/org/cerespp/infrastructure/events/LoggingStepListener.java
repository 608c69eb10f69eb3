package org.cerespp.infrastructure.events;

import java.util.Locale;
import org.cerespp.application.port.MetricsPort;
import org.cerespp.application.port.StepListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes step boundaries to the SLF4J log.
 * <p><strong>Role:</strong> Default progress listener of the CLI; start events at DEBUG, completions at INFO
 * (or DEBUG for index steps).</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe across batch workers.</p>
 * <p><strong>Observability:</strong> Increments {@code steps.completed} per completed step.</p>
 *
 * @since 0.1.0
 */
public final class LoggingStepListener implements StepListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingStepListener.class);

  private final MetricsPort metrics;

  public LoggingStepListener(MetricsPort metrics) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  public LoggingStepListener() {
    this(MetricsPort.NO_OP);
  }

  @Override
  public void onStepStarted(String name) {
    log.debug("step.started name={}", name);
  }

  @Override
  public void onStepCompleted(String name, double durationSeconds) {
    metrics.increment("steps.completed");
    String seconds = String.format(Locale.ROOT, "%.3f", durationSeconds);
    if (name.startsWith("index:")) {
      log.debug("step.completed name={} seconds={}", name, seconds);
    } else {
      log.info("step.completed name={} seconds={}", name, seconds);
    }
  }
}
