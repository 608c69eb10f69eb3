package org.cerespp.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.cerespp.application.pipeline.ProcessingResult;
import org.cerespp.config.ConfigMerger;
import org.cerespp.config.DefaultsForMode;
import org.cerespp.config.PipelineConfig;
import org.cerespp.config.YamlConfigLoader;
import org.cerespp.domain.activity.IndexName;
import org.slf4j.Logger;

final class PipelineCliSupport {
  private PipelineCliSupport() {
    // Utility class
  }

  /**
   * Merges defaults, the optional YAML file named by {@code config=} and the CLI options.
   *
   * @throws IllegalArgumentException if the YAML file is missing or malformed, or the merge is inconsistent
   * @throws IOException if the YAML file cannot be read
   */
  static Map<String, String> resolveOptions(String mode, Map<String, String> kv, Logger log)
      throws IOException {
    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
  }

  static Path optionalPath(Map<String, String> options, String key) {
    String raw = options.get(key);
    return raw == null || raw.isBlank() ? null : Path.of(raw.trim());
  }

  static String[] configLines(PipelineConfig config) {
    return new String[] {
      " Mask             : " + config.mask(),
      " Velocity grid    : " + config.rvMin() + " .. " + config.rvMax() + " km/s step " + config.rvStep()
          + " (" + config.velocityGrid().size() + " points)",
      " Line window      : " + config.windowKms() + " km/s, " + config.windowSamples() + " samples",
      " Fit window       : +/-" + config.fitHalfWindowKms() + " km/s, max " + config.fitMaxIterations()
          + " iterations",
      " S calibration    : " + config.sIndexCalibration()
          + (config.sIndexCalibrationByInstrument().isEmpty() ? "" : " " + config.sIndexCalibrationByInstrument()),
      " Flux/error layer : " + config.fluxLayer() + "/" + config.errorLayer(),
      " Save 1-D         : " + config.save1d(),
      " JSON results     : " + config.json(),
      " Missing value    : " + config.missingValue()
    };
  }

  /** One human-readable line per processed file. */
  static String summaryLine(ProcessingResult result) {
    StringBuilder line = new StringBuilder();
    line.append(result.source() == null ? "<unknown>" : result.source().getFileName());
    line.append(" target=").append(result.target());
    line.append(String.format(Locale.ROOT, " bjd=%.6f", result.bjd()));
    result.rvFit().ifPresent(fit -> line.append(
        String.format(Locale.ROOT, " rv=%.4f+/-%.4f km/s", fit.rv(), fit.rvError())));
    result.indices().ifPresent(indices -> indices.get(IndexName.S).ifPresent(s -> line.append(
        String.format(Locale.ROOT, " S=%.4f+/-%.4f", s.value(), s.error()))));
    result.indices().ifPresent(indices -> {
      if (!indices.missing().isEmpty()) {
        line.append(" missing=").append(indices.missing().keySet());
      }
    });
    if (result.failure().isPresent()) {
      ProcessingResult.Failure failure = result.failure().get();
      line.append(" status=").append(failure.kind()).append(" (").append(failure.message()).append(')');
    } else {
      line.append(" status=OK");
    }
    return line.toString();
  }
}
