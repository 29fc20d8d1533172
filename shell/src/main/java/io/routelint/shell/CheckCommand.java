package io.routelint.shell;

import com.google.gson.JsonArray;
import io.routelint.parser.api.RouteDiagnostic;
import io.routelint.parser.api.RoutePatternParser;
import io.routelint.parser.api.RoutePatternTree;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Reports the diagnostics of route patterns. Exits with 0 when every pattern is clean, 1 when
 * any pattern has diagnostics and 2 when patterns could not be read or converted.
 */
@CommandLine.Command(
    name = "check",
    description = "Report problems in route patterns",
    mixinStandardHelpOptions = true)
public final class CheckCommand implements Callable<Integer> {
  private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

  static final int CLEAN = 0;
  static final int DIAGNOSTICS_FOUND = 1;
  static final int INPUT_ERROR = 2;

  @CommandLine.Mixin private PatternSource source;

  @CommandLine.Option(
      names = "--format",
      defaultValue = "${sys:routelint.format:-TEXT}",
      description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
  private OutputFormat format;

  @Override
  public Integer call() throws RouteLintException {
    List<String> patterns = source.load();
    log.debug("Checking {} route patterns", patterns.size());

    RoutePatternParser parser = source.parser();
    int exitCode = CLEAN;
    JsonArray json = new JsonArray();
    for (String pattern : patterns) {
      RoutePatternTree tree = parser.parse(pattern);
      if (tree == null) {
        System.err.println("Error: cannot convert pattern: " + pattern);
        exitCode = INPUT_ERROR;
      } else if (tree.hasDiagnostics() && exitCode == CLEAN) {
        exitCode = DIAGNOSTICS_FOUND;
      }
      if (format == OutputFormat.JSON) {
        json.add(JsonReport.check(pattern, tree));
      } else if (tree != null) {
        printText(pattern, tree);
      }
    }
    if (format == OutputFormat.JSON) {
      System.out.println(JsonReport.toJson(json));
    }
    return exitCode;
  }

  private static void printText(String pattern, RoutePatternTree tree) {
    if (!tree.hasDiagnostics()) {
      System.out.println(pattern + ": ok");
      return;
    }
    for (RouteDiagnostic diagnostic : tree.diagnostics()) {
      System.out.println(
          pattern
              + ":"
              + diagnostic.span().start()
              + "-"
              + diagnostic.span().end()
              + ": warning: "
              + diagnostic.message());
    }
  }
}
