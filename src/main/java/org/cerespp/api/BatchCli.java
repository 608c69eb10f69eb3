package org.cerespp.api;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.cerespp.application.pipeline.BatchActivityRunner;
import org.cerespp.application.pipeline.ProcessingResult;
import org.cerespp.config.PipelineConfig;
import org.cerespp.domain.error.UnknownMaskException;
import org.cerespp.logging.LoggingConfigurator;
import org.cerespp.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code cerespp batch}: runs the activity pipeline over many cubes, isolating per-file failures.
 *
 * <p>Exits {@link ExitCode#SUCCESS} when at least one input was processed, even if others failed.</p>
 *
 * @since 0.1.0
 */
public final class BatchCli {
  private static final Logger log = LoggerFactory.getLogger(BatchCli.class);
  private static final String SUMMARY_USAGE =
      "usage: batch files=A.fits,B.fits|in=DIR [out=DIR] [mask=G2|K0|K5|M2] [workers=N] "
          + "[json=true|false] [save1d=true|false] [config=YAML] [logFile=PATH] [--dry-run]";
  private static final String HELP_TEXT = """
      CERES++ batch pipeline

      Usage:
        batch in=./reduced out=./results [options]
        batch files=a.fits,b.fits out=./results [options]

      Inputs (exactly one):
        files=A,B,...              Comma-separated cube paths, processed in the given order
        in=DIR                     Every *.fits file in DIR, in name order

      Optional:
        out=DIR                    Directory for activity tables and artifacts (default .)
        mask=G2|K0|K5|M2           Cross-correlation mask (default G2)
        workers=N                  Worker threads (default 1); output order stays the input order
        json=true|false            Write every result to out/results.jsonl (default false)
        save1d=true|false          Write merged rest-frame spectra as FITS (default false)
        config=YAML                YAML file with 'common' and 'batch' sections
        logFile=PATH               Write step start/end events as JSON lines
        metricsExporter=otlp|none  Metrics exporter (default none)
        --dry-run                  List the inputs and print the plan without processing
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Failed inputs are reported and skipped; the exit status is non-zero only when every input failed.
      """;

  private BatchCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for batch CLI");
    }

    Map<String, String> effective;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      effective = new LinkedHashMap<>(PipelineCliSupport.resolveOptions("batch", kv, log));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
    PipelineConfig config;
    String metricsExporter;
    List<Path> inputs;
    Path out;
    Path logFile;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(effective);
      config = PipelineConfig.fromMap(effective);
      inputs = resolveInputs(effective);
      out = Paths.validateWritableDir(Path.of(effective.getOrDefault("out", ".")), !dryRun);
      logFile = PipelineCliSupport.optionalPath(effective, "logFile");
    } catch (UnknownMaskException | IllegalArgumentException ex) {
      log.error("Invalid batch arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to list batch inputs", ex);
      return ExitCode.IO_ERROR;
    }

    if (dryRun) {
      printDryRunPlan(config, inputs, out, metricsExporter);
      return ExitCode.SUCCESS;
    }

    try (PipelineRuntime runtime = PipelineRuntime.open(config, out, metricsExporter, logFile)) {
      log.info("Configured batch pipeline: inputs={}, out={}, mask={}, workers={}, metricsExporter={}",
          inputs.size(), out, config.mask(), config.workers(), metricsExporter);
      BatchActivityRunner runner = new BatchActivityRunner(
          runtime.source(), runtime.pipeline(), runtime.sinks(), runtime.metrics(), config.workers());
      List<ProcessingResult> results = runner.run(inputs);
      long succeeded = 0;
      for (ProcessingResult result : results) {
        CliPrinter.println(PipelineCliSupport.summaryLine(result));
        if (result.succeeded()) {
          succeeded++;
        }
      }
      CliPrinter.println(String.format(Locale.ROOT, "Batch complete: %d of %d input(s) succeeded",
          succeeded, results.size()));
      if (succeeded == 0) {
        log.error("Every batch input failed");
        return ExitCode.RUNTIME_FAILURE;
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Batch I/O failure opening outputs in {}", out, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Batch configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in batch pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static List<Path> resolveInputs(Map<String, String> options) throws IOException {
    List<String> files = ConfigCliUtils.splitList(options.get("files"));
    String dir = options.get("in");
    List<Path> inputs = new ArrayList<>();
    if (!files.isEmpty()) {
      for (String file : files) {
        inputs.add(Path.of(file));
      }
    } else if (dir != null && !dir.isBlank()) {
      inputs.addAll(listFits(Path.of(dir.trim())));
      if (inputs.isEmpty()) {
        throw new IllegalArgumentException("in directory contains no *.fits files: " + dir.trim());
      }
    } else {
      throw new IllegalArgumentException("batch requires files= or in=");
    }
    return inputs;
  }

  private static List<Path> listFits(Path dir) throws IOException {
    if (!Files.isDirectory(dir)) {
      throw new IllegalArgumentException("in must be a directory: " + dir);
    }
    List<Path> found = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.fits")) {
      for (Path entry : stream) {
        if (Files.isRegularFile(entry)) {
          found.add(entry);
        }
      }
    }
    found.sort(Comparator.comparing(p -> p.getFileName().toString()));
    return found;
  }

  private static void printDryRunPlan(
      PipelineConfig config, List<Path> inputs, Path out, String metricsExporter) {
    List<String> lines = new ArrayList<>();
    lines.add("Batch dry-run: no spectrum will be processed.");
    lines.add(" Inputs           : " + inputs.size());
    for (Path in : inputs) {
      lines.add("   " + in);
    }
    lines.add(" Output directory : " + out);
    lines.add(" Workers          : " + config.workers());
    lines.add(" Metrics exporter : " + metricsExporter);
    lines.addAll(List.of(PipelineCliSupport.configLines(config)));
    lines.add(" Re-run without --dry-run to process the batch.");
    CliPrinter.printLines(lines.toArray(String[]::new));
  }
}
