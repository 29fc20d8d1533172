package io.routelint.parser.api.syntax;

import io.routelint.parser.api.RouteCharSequence;
import io.routelint.parser.api.RouteDiagnostic;
import io.routelint.parser.api.RoutePatternTokenKind;
import io.routelint.parser.api.TextSpan;
import java.util.ArrayList;
import java.util.List;

/**
 * An immutable token of a route pattern.
 *
 * <p>A token covers the characters it was scanned from. A <em>missing</em> token covers no
 * characters; it stands in for a token the grammar requires but the input does not contain and is
 * positioned where that token was expected.
 *
 * @param kind the token kind
 * @param chars the characters the token was scanned from
 * @param value the semantic value, or {@code null} for structural tokens
 * @param diagnostics problems attached to this token
 */
public record RoutePatternToken(
    RoutePatternTokenKind kind,
    RouteCharSequence chars,
    String value,
    List<RouteDiagnostic> diagnostics)
    implements NodeOrToken {

  public RoutePatternToken {
    if (kind == null || chars == null) {
      throw new IllegalArgumentException("kind and chars are required");
    }
    diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
  }

  /** Creates a token without value or diagnostics. */
  public static RoutePatternToken of(RoutePatternTokenKind kind, RouteCharSequence chars) {
    return new RoutePatternToken(kind, chars, null, List.of());
  }

  /** Creates a zero-width token of {@code kind} located at source {@code position}. */
  public static RoutePatternToken missing(RoutePatternTokenKind kind, int position) {
    return of(kind, RouteCharSequence.empty(position));
  }

  public boolean isMissing() {
    return chars.isEmpty();
  }

  @Override
  public TextSpan span() {
    return chars.span();
  }

  /** Returns the raw text of the token, escapes undecoded. */
  public String text() {
    return chars.createString();
  }

  public RoutePatternToken withValue(String newValue) {
    return new RoutePatternToken(kind, chars, newValue, diagnostics);
  }

  public RoutePatternToken withDiagnostics(List<RouteDiagnostic> newDiagnostics) {
    return new RoutePatternToken(kind, chars, value, newDiagnostics);
  }

  /** Attaches {@code diagnostic} unless the token already carries one. */
  public RoutePatternToken addDiagnosticIfNone(RouteDiagnostic diagnostic) {
    if (!diagnostics.isEmpty()) {
      return this;
    }
    List<RouteDiagnostic> list = new ArrayList<>(1);
    list.add(diagnostic);
    return withDiagnostics(list);
  }

  @Override
  public String toString() {
    return String.format("%s['%s']@%s", kind.displayName(), text(), span());
  }
}
