package org.cerespp.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.cerespp.application.pipeline.ActivityPipeline;
import org.cerespp.application.port.StepListener;
import org.cerespp.testutil.RecordingMetricsPort;
import org.cerespp.testutil.RecordingStepListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class StepListenerAdaptersTest {

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void safeListenerContainsDelegateFailures() {
    StepListener throwing = new StepListener() {
      @Override
      public void onStepStarted(String name) {
        throw new IllegalStateException("boom");
      }

      @Override
      public void onStepCompleted(String name, double durationSeconds) {
        throw new IllegalStateException("boom");
      }
    };
    StepListener safe = SafeStepListener.wrap(throwing);

    assertDoesNotThrow(() -> {
      safe.onStepStarted("merge");
      safe.onStepCompleted("merge", 0.1);
    });
    assertSame(safe, SafeStepListener.wrap(safe));
    assertSame(StepListener.NO_OP, SafeStepListener.wrap(null));
  }

  @Test
  void compositeDeliversToRemainingListenersAfterFailure() {
    RecordingStepListener first = new RecordingStepListener();
    RecordingStepListener last = new RecordingStepListener();
    StepListener failing = new StepListener() {
      @Override
      public void onStepStarted(String name) {
        throw new IllegalStateException("listener down");
      }

      @Override
      public void onStepCompleted(String name, double durationSeconds) {}
    };

    CompositeStepListener composite = new CompositeStepListener(List.of(first, failing, last));
    composite.onStepStarted("peak-fit");
    composite.onStepCompleted("peak-fit", 0.02);

    assertEquals(List.of("start:peak-fit", "end:peak-fit"), first.events());
    assertEquals(List.of("start:peak-fit", "end:peak-fit"), last.events());
  }

  @Test
  void loggingListenerCountsCompletedSteps() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    LoggingStepListener listener = new LoggingStepListener(metrics);

    listener.onStepStarted("merge");
    listener.onStepCompleted("merge", 0.5);
    listener.onStepCompleted("index:S", 0.001);

    assertEquals(2, metrics.count("steps.completed"));
  }

  @Test
  void jsonListenerWritesOneLinePerEvent() throws Exception {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    AtomicLong ticks = new AtomicLong(1_000);
    JsonLinesStepListener listener = new JsonLinesStepListener(out, ticks::incrementAndGet);

    MDC.put(ActivityPipeline.MDC_SPECTRUM, "obs-7.fits");
    listener.onStepStarted("rest-frame");
    MDC.remove(ActivityPipeline.MDC_SPECTRUM);
    listener.onStepCompleted("rest-frame", 0.125);
    listener.close();

    String[] lines = out.toString(StandardCharsets.UTF_8).split("\n");
    assertEquals(2, lines.length);
    assertTrue(lines[0].startsWith("{\"event\":\"started\",\"step\":\"rest-frame\",\"spectrum\":\"obs-7.fits\""));
    assertTrue(lines[0].contains("\"monotonicNanos\":1001"));
    assertFalse(lines[0].contains("seconds"));
    assertTrue(lines[1].contains("\"seconds\":0.125"));
    assertFalse(lines[1].contains("spectrum"));
  }
}
