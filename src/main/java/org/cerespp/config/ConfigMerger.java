package org.cerespp.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Merges defaults, YAML and CLI options into one effective key/value map.
 * <p><strong>Why:</strong> Gives every mode the same precedence: CLI over YAML over defaults.</p>
 * <p><strong>Role:</strong> Called by the CLI entry points before {@link PipelineConfig#fromMap(Map)}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration.
   *
   * @param mode CLI mode used for mode-specific validation
   * @param yaml flattened YAML options, if a file was loaded
   * @param cli CLI key/value options; may be {@code null}
   * @param defaults mode defaults; may be {@code null}
   * @param warn receives a message for every CLI key that overrides a YAML key; may be {@code null}
   * @return immutable merged options
   * @throws IllegalArgumentException if the merged options are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    // in= and files= select the batch inputs; whichever the CLI names replaces the other
    if (cliCopy.containsKey("files") && !cliCopy.containsKey("in")) {
      merged.remove("in");
    }
    if (cliCopy.containsKey("in") && !cliCopy.containsKey("files")) {
      merged.remove("files");
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if ("batch".equalsIgnoreCase(mode)) {
      boolean hasFiles = !trim(effective.get("files")).isEmpty();
      boolean hasIn = !trim(effective.get("in")).isEmpty();
      if (hasFiles && hasIn) {
        throw new IllegalArgumentException("batch accepts either files= or in=, not both");
      }
    }
    String exporter = trim(effective.get("metricsExporter"));
    if (!exporter.isEmpty() && !exporter.equalsIgnoreCase("otlp") && !exporter.equalsIgnoreCase("none")) {
      throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + exporter + ")");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
