package io.routelint.shell;

import com.google.gson.JsonArray;
import io.routelint.parser.api.RoutePatternParser;
import io.routelint.parser.api.RoutePatternTree;
import io.routelint.parser.api.RoutePatternTreeWriter;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;

/** Prints the syntax trees of route patterns. */
@CommandLine.Command(
    name = "tree",
    description = "Print the syntax tree, diagnostics and parameters of route patterns",
    mixinStandardHelpOptions = true)
public final class TreeCommand implements Callable<Integer> {

  @CommandLine.Mixin private PatternSource source;

  @CommandLine.Option(
      names = "--format",
      defaultValue = "${sys:routelint.format:-TEXT}",
      description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
  private OutputFormat format;

  @Override
  public Integer call() throws RouteLintException {
    List<String> patterns = source.load();

    RoutePatternParser parser = source.parser();
    int exitCode = CheckCommand.CLEAN;
    JsonArray json = new JsonArray();
    for (String pattern : patterns) {
      RoutePatternTree tree = parser.parse(pattern);
      if (tree == null) {
        System.err.println("Error: cannot convert pattern: " + pattern);
        exitCode = CheckCommand.INPUT_ERROR;
      }
      if (format == OutputFormat.JSON) {
        json.add(JsonReport.tree(pattern, tree));
      } else if (tree != null) {
        System.out.println("# " + pattern);
        System.out.print(RoutePatternTreeWriter.toText(tree));
      }
    }
    if (format == OutputFormat.JSON) {
      System.out.println(JsonReport.toJson(json));
    }
    return exitCode;
  }
}
