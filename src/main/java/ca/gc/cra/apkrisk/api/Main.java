package ca.gc.cra.apkrisk.api;

import ca.gc.cra.apkrisk.logging.LoggingConfigurator;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * APKRISK CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: apkrisk <assess|catalog> [options]";
  private static final String HELP_TEXT = """
      APKRISK command dispatcher

      Usage:
        apkrisk <command> [options]

      Commands:
        assess      Score one job from a job file or an artifact directory (assess --help for details)
        catalog     Print the metric table with weights and caps

      Global flags:
        --help      Show this message, or the command help when a command is given
        --verbose   Enable DEBUG logging before dispatching to the command
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
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.keyValueArgs().isEmpty()) {
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

    String command = input.keyValueArgs().get(0).toLowerCase(Locale.ROOT);
    CliInput delegate = input.dropFirst();
    return switch (command) {
      case "assess" -> AssessCli.run(delegate);
      case "catalog" -> CatalogCli.run(delegate);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
