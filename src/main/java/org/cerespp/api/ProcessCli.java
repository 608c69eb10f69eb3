package org.cerespp.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.cerespp.application.pipeline.ProcessingResult;
import org.cerespp.application.port.ActivityTableSink;
import org.cerespp.config.PipelineConfig;
import org.cerespp.domain.error.UnknownMaskException;
import org.cerespp.domain.spectrum.Observation;
import org.cerespp.logging.LoggingConfigurator;
import org.cerespp.validation.Paths;
import org.cerespp.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code cerespp process}: runs the activity pipeline on one reduced echelle cube.
 *
 * @since 0.1.0
 */
public final class ProcessCli {
  private static final Logger log = LoggerFactory.getLogger(ProcessCli.class);
  private static final String SUMMARY_USAGE =
      "usage: process file=PATH [out=DIR] [mask=G2|K0|K5|M2] [config=YAML] [save1d=true|false] "
          + "[json=true|false] [logFile=PATH] [--dry-run] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      CERES++ single-spectrum pipeline

      Usage:
        process file=./HARPS.2019-05-01.fits out=./results [options]

      Required:
        file=PATH                  Reduced echelle cube (wavelength, flux and error layers)

      Optional:
        out=DIR                    Directory for the activity table and artifacts (default .)
        mask=G2|K0|K5|M2           Cross-correlation mask (default G2)
        config=YAML                YAML file with 'common' and 'process' sections
        save1d=true|false          Write the merged rest-frame spectrum as FITS (default false)
        json=true|false            Append the result to out/results.jsonl (default false)
        logFile=PATH               Write step start/end events as JSON lines
        ccf.rvMin=, ccf.rvMax=, ccf.rvStep=   Velocity grid in km/s (default -200, 200, 0.25)
        activity.sIndexCalibration=K           S index calibration constant (default 1.0)
        activity.sIndexCalibration.INST=K      S index constant for instrument INST (header INST)
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --dry-run                  Validate inputs and print the plan without processing
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private ProcessCli() {}

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
      log.debug("Verbose logging enabled for process CLI");
    }

    Map<String, String> effective;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      effective = new LinkedHashMap<>(PipelineCliSupport.resolveOptions("process", kv, log));
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
    Path file;
    Path out;
    Path logFile;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(effective);
      config = PipelineConfig.fromMap(effective);
      file = Paths.requireReadableFile("file", Path.of(Strings.requireNonBlank("file", effective.get("file"))));
      out = Paths.validateWritableDir(Path.of(effective.getOrDefault("out", ".")), !dryRun);
      logFile = PipelineCliSupport.optionalPath(effective, "logFile");
    } catch (UnknownMaskException | IllegalArgumentException ex) {
      log.error("Invalid process arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, file, out, logFile, metricsExporter);
      return ExitCode.SUCCESS;
    }

    try (PipelineRuntime runtime = PipelineRuntime.open(config, out, metricsExporter, logFile)) {
      log.info("Configured process pipeline: file={}, out={}, mask={}, metricsExporter={}",
          file, out, config.mask(), metricsExporter);
      Observation observation = runtime.source().load(file);
      ProcessingResult result = runtime.pipeline().process(observation);
      List<IOException> sinkErrors = new ArrayList<>();
      for (ActivityTableSink sink : runtime.sinks()) {
        try {
          sink.write(result);
          sink.flush();
        } catch (IOException ex) {
          sinkErrors.add(ex);
        }
      }
      CliPrinter.println(PipelineCliSupport.summaryLine(result));
      if (!sinkErrors.isEmpty()) {
        throw sinkErrors.get(0);
      }
      return result.succeeded() ? ExitCode.SUCCESS : ExitCode.RUNTIME_FAILURE;
    } catch (IOException ex) {
      log.error("Process pipeline I/O failure for {}", file, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Process configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure processing {}", file, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(
      PipelineConfig config, Path file, Path out, Path logFile, String metricsExporter) {
    List<String> lines = new ArrayList<>();
    lines.add("Process dry-run: no spectrum will be processed.");
    lines.add(" Input file       : " + file);
    lines.add(" Output directory : " + out);
    lines.add(" Step log         : " + (logFile == null ? "<none>" : logFile));
    lines.add(" Metrics exporter : " + metricsExporter);
    lines.addAll(List.of(PipelineCliSupport.configLines(config)));
    lines.add(" Re-run without --dry-run to process the spectrum.");
    CliPrinter.printLines(lines.toArray(String[]::new));
  }
}
