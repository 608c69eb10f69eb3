package org.cerespp.application.port;

import java.io.IOException;
import org.cerespp.application.pipeline.ProcessingResult;

/**
 * <strong>What:</strong> Output port receiving per-observation results.
 * <p><strong>Role:</strong> Implemented by the whitespace activity table and the JSON-lines result log.</p>
 * <p><strong>Thread-safety:</strong> Implementations must serialize concurrent writes.</p>
 *
 * @since 0.1.0
 */
public interface ActivityTableSink extends AutoCloseable {
  /**
   * Records one result, successful or failed.
   *
   * @param result processing outcome
   * @throws IOException if the sink cannot write
   */
  void write(ProcessingResult result) throws IOException;

  /**
   * Flushes buffered rows.
   *
   * @throws IOException if flushing fails
   */
  default void flush() throws IOException {}

  @Override
  default void close() throws IOException {}
}
