package org.cerespp.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits raw command-line tokens into {@code key=value} arguments and bare flags.
 *
 * <p>{@code --help}/{@code -h}/{@code help} and {@code --verbose}/{@code -v}/{@code --debug} are
 * recognized anywhere; other tokens starting with a dash and containing no {@code =} are kept as
 * lower-cased flags (for example {@code --dry-run}).</p>
 *
 * @since 0.1.0
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String[] keyValueArgs;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;

  private CliInput(String[] keyValueArgs, Set<String> flags, boolean help, boolean verbose) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments.
   *
   * @param args tokens as passed to {@code main}; may be {@code null}
   * @return parsed input; blank and {@code null} tokens are dropped
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of(), false, false);
    }
    List<String> positional = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        positional.add(arg);
      }
    }
    return new CliInput(positional.toArray(String[]::new), Set.copyOf(flags), help, verbose);
  }

  /** @return non-flag tokens in their original order (command name included for the dispatcher) */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  /** @return whether a help flag was present */
  public boolean help() {
    return help;
  }

  /** @return whether a verbose flag was present */
  public boolean verbose() {
    return verbose;
  }

  /**
   * Tests for a bare flag.
   *
   * @param flag flag such as {@code --dry-run}; case-insensitive
   * @return {@code true} if present
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /** @return all flags seen, normalized */
  public Set<String> flags() {
    return flags;
  }
}
