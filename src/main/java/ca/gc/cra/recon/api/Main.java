package ca.gc.cra.recon.api;

import ca.gc.cra.recon.logging.LoggingConfigurator;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code recon} command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final Set<String> COMMANDS = Set.of("get", "count", "distinct", "top", "load");
  private static final String SUMMARY_USAGE = "usage: recon <get|count|distinct|top|load> [options]";
  private static final String HELP_TEXT = """
      recon: query and aggregate reconnaissance records

      Usage:
        recon <command> [key=value...] [flags]

      Commands:
        get       Print matching records as JSON lines
        count     Print the number of matching records
        distinct  Print the distinct values of a field
        top       Print the most frequent values of a field or pseudo-field
        load      Load NDJSON records into a collection

      Global flags:
        --help      Show this message (recon <command> --help for command options)
        --verbose   Enable DEBUG logging
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
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args raw arguments, the command word first
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String command = input.command();
    if (command == null) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (!COMMANDS.contains(command)) {
      if (input.verbose()) {
        LoggingConfigurator.enableVerboseLogging();
      }
      log.error("Unknown command: {}", command);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    return QueryCli.run(command, input);
  }
}
