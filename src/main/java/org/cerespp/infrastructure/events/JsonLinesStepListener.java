package org.cerespp.infrastructure.events;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.cerespp.application.port.ClockPort;
import org.cerespp.application.port.StepListener;
import org.cerespp.application.pipeline.ActivityPipeline;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Appends one JSON object per step event to a structured log file.
 * <p><strong>Role:</strong> Optional listener enabled with {@code logFile=PATH}; each line carries the event,
 * the step name, the input ({@code spectrum} MDC value) and, for completions, the duration.</p>
 * <p><strong>Thread-safety:</strong> Writes are serialized on the instance.</p>
 * <p><strong>Failure handling:</strong> I/O errors surface as {@link UncheckedIOException}; the pipeline's
 * {@link SafeStepListener} logs and ignores them.</p>
 *
 * @since 0.1.0
 */
public final class JsonLinesStepListener implements StepListener, AutoCloseable {
  private static final JsonFactory JSON = new JsonFactory();

  private final OutputStream out;
  private final ClockPort clock;

  /**
   * Opens {@code file} for appending.
   *
   * @param file destination file; parent directories are created
   * @throws IOException if the file cannot be opened
   */
  public JsonLinesStepListener(Path file) throws IOException {
    this(open(file), ClockPort.SYSTEM);
  }

  JsonLinesStepListener(OutputStream out, ClockPort clock) {
    this.out = Objects.requireNonNull(out, "out");
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
  }

  @Override
  public void onStepStarted(String name) {
    write("started", name, Double.NaN);
  }

  @Override
  public void onStepCompleted(String name, double durationSeconds) {
    write("completed", name, durationSeconds);
  }

  @Override
  public synchronized void close() throws IOException {
    out.close();
  }

  private void write(String event, String name, double seconds) {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream(128);
    try (JsonGenerator gen = JSON.createGenerator(buffer, JsonEncoding.UTF8)) {
      gen.writeStartObject();
      gen.writeStringField("event", event);
      gen.writeStringField("step", name);
      String spectrum = MDC.get(ActivityPipeline.MDC_SPECTRUM);
      if (spectrum != null) {
        gen.writeStringField("spectrum", spectrum);
      }
      if (Double.isFinite(seconds)) {
        gen.writeNumberField("seconds", seconds);
      }
      gen.writeNumberField("monotonicNanos", clock.nanoTime());
      gen.writeStringField("thread", Thread.currentThread().getName());
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode step event " + name, ex);
    }
    buffer.write('\n');
    synchronized (this) {
      try {
        buffer.writeTo(out);
        out.flush();
      } catch (IOException ex) {
        throw new UncheckedIOException("Failed to append step event " + name, ex);
      }
    }
  }

  private static OutputStream open(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    return Files.newOutputStream(file, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
  }
}
