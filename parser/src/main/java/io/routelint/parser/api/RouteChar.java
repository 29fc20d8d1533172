package io.routelint.parser.api;

/**
 * A single character of a route pattern together with the span it occupies in the original
 * source.
 *
 * <p>The span is not necessarily one position wide: a character decoded from an escape sequence
 * such as {@code \t} covers the whole escape.
 *
 * @param value the character value
 * @param span the source span of the character
 */
public record RouteChar(char value, TextSpan span) {

  public RouteChar {
    if (span == null) {
      throw new IllegalArgumentException("span must not be null");
    }
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
