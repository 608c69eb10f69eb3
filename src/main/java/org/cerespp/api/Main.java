package org.cerespp.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.cerespp.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher for the {@code cerespp} executable jar.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: cerespp <process|batch> [options]";
  private static final String HELP_TEXT = """
      CERES++ radial velocity and activity pipeline

      Usage:
        cerespp <command> [options]

      Commands:
        process     Measure RV, merge orders and compute activity indices for one spectrum
        batch       Run the same pipeline over a list or directory of spectra

      Global flags:
        --help      Show this message (or '<command> --help' for command options)
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = withoutFirst(args, remainder[0]);
    return switch (command) {
      case "process" -> ProcessCli.run(delegateArgs);
      case "batch" -> BatchCli.run(delegateArgs);
      default -> unknown(command);
    };
  }

  // Flags such as --help stay with the subcommand so it prints its own usage.
  private static String[] withoutFirst(String[] args, String command) {
    List<String> rest = new ArrayList<>(Arrays.asList(args));
    for (int i = 0; i < rest.size(); i++) {
      String arg = rest.get(i);
      if (arg != null && arg.trim().equals(command)) {
        rest.remove(i);
        break;
      }
    }
    return rest.toArray(String[]::new);
  }

  private static ExitCode unknown(String command) {
    log.error("Unknown command: {}", command);
    CliPrinter.println(SUMMARY_USAGE);
    return ExitCode.INVALID_ARGS;
  }
}
