package io.routelint.parser.api;

import io.routelint.parser.api.syntax.RoutePatternNode.CompilationUnit;
import io.routelint.parser.api.syntax.RoutePatternToken;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Result of parsing a route pattern: the syntax tree, the diagnostics in document order and the
 * declared parameters.
 *
 * <p>Trees are immutable and may be shared between threads.
 */
public final class RoutePatternTree {
  private final RouteCharSequence text;
  private final CompilationUnit root;
  private final List<RouteDiagnostic> diagnostics;
  private final Map<String, RouteParameter> parameters;

  public RoutePatternTree(
      RouteCharSequence text,
      CompilationUnit root,
      List<RouteDiagnostic> diagnostics,
      Map<String, RouteParameter> parameters) {
    this.text = text;
    this.root = root;
    this.diagnostics = List.copyOf(diagnostics);
    Map<String, RouteParameter> table = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    for (Map.Entry<String, RouteParameter> e : parameters.entrySet()) {
      table.putIfAbsent(e.getKey(), e.getValue());
    }
    this.parameters = Collections.unmodifiableMap(table);
  }

  public RouteCharSequence text() {
    return text;
  }

  public CompilationUnit root() {
    return root;
  }

  public List<RouteDiagnostic> diagnostics() {
    return diagnostics;
  }

  public boolean hasDiagnostics() {
    return !diagnostics.isEmpty();
  }

  /** Returns the parameters keyed by name. Lookups ignore case. */
  public Map<String, RouteParameter> parameters() {
    return parameters;
  }

  /** Looks up a parameter by name, ignoring case. */
  public Optional<RouteParameter> parameter(String name) {
    return Optional.ofNullable(parameters.get(name));
  }

  /**
   * Checks that the tokens of the tree, in order, cover every character of {@link #text()} exactly
   * once.
   *
   * @return {@code true} if the tree is lossless
   */
  public boolean coversText() {
    List<RoutePatternToken> tokens = new ArrayList<>();
    root.forEachToken(tokens::add);
    int index = 0;
    for (RoutePatternToken token : tokens) {
      RouteCharSequence chars = token.chars();
      for (int i = 0; i < chars.length(); i++) {
        if (index >= text.length() || !chars.get(i).equals(text.get(index))) {
          return false;
        }
        index++;
      }
    }
    return index == text.length();
  }
}
