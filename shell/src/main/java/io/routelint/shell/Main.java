package io.routelint.shell;

import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "routelint",
    description = "Checks ASP.NET style route patterns",
    version = "0.1.0",
    mixinStandardHelpOptions = true,
    subcommands = {CheckCommand.class, TreeCommand.class})
public final class Main implements Callable<Integer> {

  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  public static void main(String[] args) {
    int exitCode = newCommandLine().execute(args);
    System.exit(exitCode);
  }

  /**
   * Creates the command line. Option values such as {@code --format json} ignore case, and a
   * pattern file that cannot be read ends the command with an error message and its exit code.
   */
  public static CommandLine newCommandLine() {
    return new CommandLine(new Main())
        .setCaseInsensitiveEnumValuesAllowed(true)
        .setExecutionExceptionHandler(Main::handleExecutionException);
  }

  private static int handleExecutionException(
      Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) throws Exception {
    if (!(ex instanceof RouteLintException e)) {
      throw ex;
    }
    StringBuilder message = new StringBuilder("Error: ").append(e.getMessage());
    message.append(": ").append(e.file());
    if (e.getCause() != null) {
      message.append(" (").append(e.getCause().getMessage()).append(')');
    }
    System.err.println(message);
    return e.getExitCode();
  }

  @Override
  public Integer call() {
    spec.commandLine().usage(System.out);
    return 0;
  }
}
