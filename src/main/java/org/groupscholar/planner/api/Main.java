package org.groupscholar.planner.api;

import java.util.Arrays;
import java.util.Locale;
import org.groupscholar.planner.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code planner} dispatcher routing to the {@code plan} and {@code seed} commands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: planner <plan|seed> [key=value ...] [--flags]";
  private static final String HELP_TEXT = """
      Intervention planner

      Usage:
        planner <command> [options]

      Commands:
        plan    Score an outreach CSV and print the action plan (plan --help for details)
        seed    Plan the sample file with seed settings and store the run (seed --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first token is the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = firstCommandIndex(safeArgs);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.printBlock(HELP_TEXT);
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    CliInput global = CliInput.parse(Arrays.copyOfRange(safeArgs, 0, commandIndex));
    if (global.help()) {
      CliPrinter.printBlock(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (global.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, commandIndex + 1, safeArgs.length);
    return switch (command) {
      case "plan" -> PlanCli.run(delegateArgs);
      case "seed" -> SeedCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int firstCommandIndex(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i] == null ? "" : args[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && !arg.contains("=") && !arg.equalsIgnoreCase("help")) {
        return i;
      }
    }
    return -1;
  }
}
