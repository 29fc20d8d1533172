package io.routelint.parser.api;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts caller-supplied source text into the {@link RouteCharSequence} the parser works on.
 *
 * <p>The converter decides how characters map back to source positions. It returns {@code null}
 * when the text cannot be converted; the parser then produces no tree.
 */
@FunctionalInterface
public interface RouteCharConverter {

  /**
   * Converts the source text.
   *
   * @param source the source text
   * @return the converted characters, or {@code null} if the text cannot be converted
   */
  RouteCharSequence convert(String source);

  /**
   * Returns a converter that takes the text as-is: character {@code i} occupies span {@code (i,
   * 1)}.
   */
  static RouteCharConverter plain() {
    return source -> {
      if (source == null) {
        return null;
      }
      List<RouteChar> chars = new ArrayList<>(source.length());
      for (int i = 0; i < source.length(); i++) {
        chars.add(new RouteChar(source.charAt(i), new TextSpan(i, 1)));
      }
      return RouteCharSequence.of(chars, source.length());
    };
  }
}
