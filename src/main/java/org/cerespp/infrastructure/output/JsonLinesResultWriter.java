package org.cerespp.infrastructure.output;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Objects;
import org.cerespp.application.pipeline.ProcessingResult;
import org.cerespp.application.port.ActivityTableSink;
import org.cerespp.domain.activity.ActivityIndices;
import org.cerespp.domain.activity.IndexName;
import org.cerespp.domain.activity.IndexValue;
import org.cerespp.domain.ccf.RvFitResult;
import org.cerespp.domain.error.CoverageException;

/**
 * <strong>What:</strong> Writes every {@link ProcessingResult} as one JSON object per line.
 * <p><strong>Why:</strong> Keeps failures, missing-index causes and step timings that the fixed-column table
 * cannot hold.</p>
 * <p><strong>Format:</strong> non-finite numbers are written as {@code null}; absent sections are omitted.</p>
 * <p><strong>Thread-safety:</strong> {@link #write(ProcessingResult)} is synchronized.</p>
 *
 * @since 0.1.0
 */
public final class JsonLinesResultWriter implements ActivityTableSink {
  /** Default file name inside the output directory. */
  public static final String DEFAULT_FILE_NAME = "results.jsonl";

  private static final JsonFactory JSON = new JsonFactory();

  private final OutputStream out;

  /**
   * Opens {@code file} for appending.
   *
   * @param file JSON-lines file; parent directories are created
   * @throws IOException if the file cannot be opened
   */
  public JsonLinesResultWriter(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    this.out = Files.newOutputStream(file, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
  }

  JsonLinesResultWriter(OutputStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  @Override
  public synchronized void write(ProcessingResult result) throws IOException {
    Objects.requireNonNull(result, "result");
    ByteArrayOutputStream buffer = new ByteArrayOutputStream(512);
    try (JsonGenerator gen = JSON.createGenerator(buffer, JsonEncoding.UTF8)) {
      gen.writeStartObject();
      gen.writeStringField("source", result.source().toString());
      gen.writeStringField("target", result.target());
      gen.writeStringField("instrument", result.instrument());
      number(gen, "bjd", result.bjd());
      gen.writeStringField("status", result.succeeded() ? "ok" : "failed");
      if (result.failure().isPresent()) {
        ProcessingResult.Failure failure = result.failure().get();
        gen.writeObjectFieldStart("failure");
        gen.writeStringField("kind", failure.kind().name());
        gen.writeStringField("message", failure.message());
        gen.writeEndObject();
      }
      if (result.rvFit().isPresent()) {
        writeFit(gen, result.rvFit().get());
      }
      if (result.indices().isPresent()) {
        writeIndices(gen, result.indices().get());
      }
      number(gen, "snr", result.signalToNoise());
      gen.writeNumberField("rejectedPoints", result.rejectedPoints());
      if (result.mergedSpectrumPath().isPresent()) {
        gen.writeStringField("mergedSpectrum", result.mergedSpectrumPath().get().toString());
      }
      gen.writeObjectFieldStart("steps");
      for (Map.Entry<String, Double> step : result.stepSeconds().entrySet()) {
        number(gen, step.getKey(), step.getValue());
      }
      gen.writeEndObject();
      gen.writeEndObject();
    }
    buffer.write('\n');
    buffer.writeTo(out);
    out.flush();
  }

  @Override
  public synchronized void flush() throws IOException {
    out.flush();
  }

  @Override
  public synchronized void close() throws IOException {
    out.close();
  }

  private static void writeFit(JsonGenerator gen, RvFitResult fit) throws IOException {
    gen.writeObjectFieldStart("rv");
    number(gen, "value", fit.rv());
    number(gen, "error", fit.rvError());
    number(gen, "bis", fit.bis());
    number(gen, "fwhm", fit.fwhm());
    number(gen, "fwhmError", fit.fwhmError());
    number(gen, "contrast", fit.contrast());
    number(gen, "continuum", fit.continuum());
    gen.writeNumberField("iterations", fit.iterations());
    gen.writeEndObject();
  }

  private static void writeIndices(JsonGenerator gen, ActivityIndices indices) throws IOException {
    gen.writeObjectFieldStart("indices");
    for (Map.Entry<IndexName, IndexValue> entry : indices.values().entrySet()) {
      gen.writeObjectFieldStart(entry.getKey().label());
      number(gen, "value", entry.getValue().value());
      number(gen, "error", entry.getValue().error());
      gen.writeEndObject();
    }
    gen.writeEndObject();
    if (!indices.missing().isEmpty()) {
      gen.writeObjectFieldStart("missingIndices");
      for (Map.Entry<IndexName, CoverageException> entry : indices.missing().entrySet()) {
        gen.writeStringField(entry.getKey().label(), entry.getValue().getMessage());
      }
      gen.writeEndObject();
    }
  }

  private static void number(JsonGenerator gen, String name, double value) throws IOException {
    if (Double.isFinite(value)) {
      gen.writeNumberField(name, value);
    } else {
      gen.writeNullField(name);
    }
  }
}
