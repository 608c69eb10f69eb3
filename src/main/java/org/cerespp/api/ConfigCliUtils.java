package org.cerespp.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /** Removes and returns the {@code config=} path so it never reaches the merged options. */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }

  /** Splits a comma-separated list, dropping blank entries. */
  static List<String> splitList(String raw) {
    List<String> items = new ArrayList<>();
    if (raw == null) {
      return items;
    }
    for (String part : raw.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        items.add(trimmed);
      }
    }
    return items;
  }
}
