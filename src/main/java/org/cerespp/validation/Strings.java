package org.cerespp.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation helpers for configuration and file naming.
 * <p><strong>Why:</strong> Prevents blank values and unsafe characters from reaching output file names.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^A-Za-z0-9._+-]");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a string is non-null, non-blank and free of control characters.
   *
   * @param name configuration key used in error messages; may be {@code null}
   * @param value string to validate
   * @return trimmed string
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the string is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Turns a header value such as a target name into a safe file-name fragment.
   *
   * @param value raw value; {@code null} or blank maps to {@code unknown}
   * @return value with whitespace and unsafe characters replaced by {@code _}
   */
  public static String toFileToken(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return UNSAFE_FILE_CHARS.matcher(value.trim()).replaceAll("_");
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
