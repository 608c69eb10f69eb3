package org.cerespp.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <strong>What:</strong> Factory helpers for the batch worker pool.
 * <p><strong>Why:</strong> Centralizes thread naming and uncaught-exception handling for pipeline workers.</p>
 * <p><strong>Thread-safety:</strong> Stateless; returned executors are thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Creates a fixed-size pool whose queue holds every submitted observation.
   *
   * @param size number of worker threads; must be positive
   * @param prefix thread name prefix; defaults to {@code cerespp-worker} when blank
   * @param handler uncaught exception handler; may be {@code null}
   * @return configured executor; callers own shutdown
   * @throws IllegalArgumentException if {@code size <= 0}
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "cerespp-worker" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(false);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
