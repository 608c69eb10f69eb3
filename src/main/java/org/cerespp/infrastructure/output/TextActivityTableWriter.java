package org.cerespp.infrastructure.output;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.ToDoubleFunction;
import org.cerespp.application.pipeline.FailureKind;
import org.cerespp.application.pipeline.ProcessingResult;
import org.cerespp.application.port.ActivityTableSink;
import org.cerespp.domain.activity.ActivityIndices;
import org.cerespp.domain.activity.IndexName;
import org.cerespp.domain.activity.IndexValue;
import org.cerespp.domain.ccf.RvFitResult;
import org.cerespp.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Appends one whitespace-separated row per observation to
 * {@code <out>/<target>_activities.dat}.
 * <p><strong>Format:</strong> header {@link ActivityColumns#headerLine()} written when the file is created;
 * absent values (failed fit, uncovered index, unmeasurable bisector) are written as the configured
 * placeholder.</p>
 * <p><strong>Thread-safety:</strong> {@link #write(ProcessingResult)} is synchronized.</p>
 *
 * @since 0.1.0
 */
public final class TextActivityTableWriter implements ActivityTableSink {
  private static final Logger log = LoggerFactory.getLogger(TextActivityTableWriter.class);

  private final Path outputDirectory;
  private final String missingValue;

  /**
   * Creates a writer.
   *
   * @param outputDirectory directory receiving the tables; created on first write
   * @param missingValue placeholder for absent values, e.g. {@code -999}
   */
  public TextActivityTableWriter(Path outputDirectory, String missingValue) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
    this.missingValue = Strings.requireNonBlank("missingValue", missingValue);
  }

  /**
   * Path of the table for {@code target}.
   *
   * @param target target name
   * @return table file
   */
  public Path tableFor(String target) {
    return outputDirectory.resolve(Strings.toFileToken(target) + "_activities.dat");
  }

  @Override
  public synchronized void write(ProcessingResult result) throws IOException {
    Objects.requireNonNull(result, "result");
    if (result.failure().map(f -> f.kind() == FailureKind.LOAD).orElse(false)) {
      log.debug("No table row for unreadable input {}", result.source());
      return;
    }
    Files.createDirectories(outputDirectory);
    Path table = tableFor(result.target());
    boolean fresh = !Files.exists(table) || Files.size(table) == 0;
    try (BufferedWriter writer = Files.newBufferedWriter(
        table, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
      if (fresh) {
        writer.write(ActivityColumns.headerLine());
        writer.newLine();
      }
      writer.write(formatRow(result));
      writer.newLine();
    }
  }

  /**
   * Formats the row of {@code result} in {@link ActivityColumns#NAMES} order.
   *
   * @param result processing outcome
   * @return whitespace-separated values
   */
  String formatRow(ProcessingResult result) {
    Optional<RvFitResult> fit = result.rvFit();
    Optional<ActivityIndices> indices = result.indices();
    List<String> cells = new ArrayList<>(ActivityColumns.NAMES.size());
    cells.add(number(result.bjd()));
    cells.add(fitValue(fit, RvFitResult::rv));
    cells.add(fitValue(fit, RvFitResult::rvError));
    cells.add(fitValue(fit, RvFitResult::bis));
    cells.add(fitValue(fit, RvFitResult::fwhm));
    cells.add(fitValue(fit, RvFitResult::contrast));
    addIndex(cells, indices, IndexName.S, true);
    addIndex(cells, indices, IndexName.HALPHA, true);
    addIndex(cells, indices, IndexName.HEI, true);
    addIndex(cells, indices, IndexName.NAID1, false);
    addIndex(cells, indices, IndexName.NAID2, false);
    return String.join(" ", cells);
  }

  private void addIndex(List<String> cells, Optional<ActivityIndices> indices, IndexName name, boolean withError) {
    Optional<IndexValue> value = indices.flatMap(i -> i.get(name));
    cells.add(value.map(v -> number(v.value())).orElse(missingValue));
    if (withError) {
      cells.add(value.map(v -> number(v.error())).orElse(missingValue));
    }
  }

  private String fitValue(Optional<RvFitResult> fit, ToDoubleFunction<RvFitResult> field) {
    return fit.map(f -> number(field.applyAsDouble(f))).orElse(missingValue);
  }

  private String number(double value) {
    return Double.isFinite(value) ? String.format(Locale.ROOT, "%.6f", value) : missingValue;
  }
}
