package org.cerespp.application.port;

/**
 * <strong>What:</strong> Port supplying monotonic timestamps for step timing.
 * <p><strong>Role:</strong> Consumed by {@code ActivityPipeline}; tests inject deterministic clocks.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent reads.</p>
 *
 * @since 0.1.0
 * @see org.cerespp.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns a monotonic timestamp.
   *
   * @return nanoseconds from an arbitrary origin; only differences are meaningful
   */
  long nanoTime();

  /** Default clock backed by {@link System#nanoTime()}. */
  ClockPort SYSTEM = System::nanoTime;
}
