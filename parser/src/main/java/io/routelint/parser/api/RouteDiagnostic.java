package io.routelint.parser.api;

/**
 * A problem found in a route pattern. Two diagnostics are equal when both message and span are.
 *
 * @param message the human readable message
 * @param span the source span the problem is reported at
 */
public record RouteDiagnostic(String message, TextSpan span) {

  public RouteDiagnostic {
    if (message == null || span == null) {
      throw new IllegalArgumentException("message and span are required");
    }
  }

  @Override
  public String toString() {
    return span + ": " + message;
  }
}
