package org.cerespp.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Loads pipeline settings from a YAML file and flattens them into dotted keys.
 * <p><strong>Why:</strong> Observers keep per-instrument settings in one file; nested YAML sections map onto
 * the keys accepted by {@link PipelineConfig#fromMap(Map)} ({@code ccf: {rvStep: 0.5}} becomes
 * {@code ccf.rvStep=0.5}).</p>
 * <p><strong>Role:</strong> Configuration adapter feeding {@link ConfigMerger}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Reads the {@code common} section and the section named after {@code mode}; mode keys win.
   *
   * @param path YAML file location
   * @param mode CLI mode, e.g. {@code process} or {@code batch}
   * @return flattened options, or empty when the file does not exist
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the YAML is malformed or contains unsupported structures
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");

      Map<String, String> flattened = new LinkedHashMap<>();
      Object commonSection = findSection(root, "common");
      if (commonSection != null) {
        flatten(asMap(commonSection, "common"), "", flattened);
      }
      Object modeSection = findSection(root, normalizedMode);
      if (modeSection instanceof Map<?, ?> modeMap) {
        flatten(asMap(modeMap, normalizedMode), "", flattened);
      }

      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?> items) {
        target.put(composite, joinList(composite, items));
      } else {
        target.put(composite, value.toString());
      }
    }
  }

  private static String joinList(String key, Iterable<?> items) {
    StringBuilder sb = new StringBuilder();
    for (Object item : items) {
      if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML list for key " + key + " must contain scalars only");
      }
      if (sb.length() > 0) {
        sb.append(',');
      }
      sb.append(item);
    }
    return sb.toString();
  }
}
