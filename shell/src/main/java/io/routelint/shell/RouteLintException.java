package io.routelint.shell;

import java.nio.file.Path;
import picocli.CommandLine;

/**
 * Raised when the patterns of a command cannot be loaded from the pattern file. The command ends
 * with {@link CheckCommand#INPUT_ERROR}.
 */
public class RouteLintException extends Exception implements CommandLine.IExitCodeGenerator {
  private final Path file;

  public RouteLintException(String message, Path file) {
    this(message, file, null);
  }

  public RouteLintException(String message, Path file, Throwable cause) {
    super(message, cause);
    this.file = file;
  }

  /** The pattern file that could not be read. */
  public Path file() {
    return file;
  }

  @Override
  public int getExitCode() {
    return CheckCommand.INPUT_ERROR;
  }
}
