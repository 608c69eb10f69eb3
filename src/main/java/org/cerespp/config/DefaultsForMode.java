package org.cerespp.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Default key/value options for each CLI mode.
 * <p><strong>Why:</strong> Seeds {@link ConfigMerger} so YAML and CLI only need to name what they change.</p>
 * <p><strong>Thread-safety:</strong> Returns immutable maps; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults of {@code mode}.
   *
   * @param mode {@code process} or {@code batch}, case-insensitive
   * @return immutable flat map
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "process" -> buildProcessDefaults();
      case "batch" -> buildBatchDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("logFile", "");
    map.putAll(PipelineConfig.defaults().toFlatMap());
    return Map.copyOf(map);
  }

  private static Map<String, String> buildProcessDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("file", "");
    map.put("out", ".");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildBatchDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("out", ".");
    map.put("dryRun", "false");
    return map;
  }
}
