package org.cerespp.infrastructure.time;

import org.cerespp.application.port.ClockPort;

/**
 * {@link ClockPort} backed by {@link System#nanoTime()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  public SystemClockAdapter() {}

  @Override
  public long nanoTime() {
    return System.nanoTime();
  }
}
