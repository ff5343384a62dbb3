package ca.gc.cra.helio.api;

import ca.gc.cra.helio.logging.LoggingConfigurator;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HELIO CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: helio <acquire|inspect> [options]";
  private static final String HELP_TEXT = """
      HELIO solar image acquisition

      Usage:
        helio <command> [options]

      Commands:
        acquire     Fetch channels, reconcile timestamps, and write the image container
        inspect     Print the header and records of an existing container

      Global flags:
        --help      Show this message (or the command's help when it follows a command)
        --verbose   Enable DEBUG logging for HELIO classes
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the subcommand
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
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
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    return switch (command) {
      case "acquire" -> AcquireCli.run(input);
      case "inspect" -> InspectCli.run(input);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
