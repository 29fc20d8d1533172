package io.routelint.shell;

import io.routelint.parser.api.JavaStringLiteralConverter;
import io.routelint.parser.api.RouteCharConverter;
import io.routelint.parser.api.RoutePatternParser;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

/** Options shared by the commands that read route patterns. */
public final class PatternSource {

  @CommandLine.Parameters(
      arity = "0..*",
      paramLabel = "PATTERN",
      description = "Route patterns to process")
  private List<String> patterns = new ArrayList<>();

  @CommandLine.Option(
      names = {"-f", "--file"},
      description = "Read patterns from a file, one per line; blank lines and lines starting"
          + " with '#' are skipped")
  private Path file;

  @CommandLine.Option(
      names = {"-l", "--literal"},
      description = "Patterns are quoted Java string literals; spans refer to the literal")
  private boolean literal;

  /**
   * Returns the patterns given on the command line followed by those read from the file.
   *
   * @throws RouteLintException if the file cannot be read
   */
  List<String> load() throws RouteLintException {
    List<String> result = new ArrayList<>(patterns);
    if (file != null) {
      if (!Files.isReadable(file)) {
        throw new RouteLintException("Pattern file not readable", file);
      }
      try {
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
          if (!line.isBlank() && !line.startsWith("#")) {
            result.add(line.strip());
          }
        }
      } catch (IOException e) {
        throw new RouteLintException("Failed to read pattern file", file, e);
      }
    }
    return result;
  }

  RoutePatternParser parser() {
    RouteCharConverter converter =
        literal ? new JavaStringLiteralConverter() : RouteCharConverter.plain();
    return RoutePatternParser.create(converter);
  }
}
