package org.cerespp.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Writes user-facing output (help, dry-run plans, per-file summaries) to standard output.
 *
 * <p>Diagnostics go through SLF4J instead; tests can capture this stream with
 * {@link #setWriterForTesting(PrintWriter)}.</p>
 *
 * @since 0.1.0
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints one line.
   *
   * @param message text to print
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints lines in order and flushes once.
   *
   * @param lines text lines; {@code null} prints nothing
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
