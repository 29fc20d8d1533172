package io.routelint.parser.api;

import io.routelint.parser.impl.RoutePatternParserImpl;

/**
 * Parses route patterns.
 *
 * <p>Implementations keep no state between calls and may be used from several threads at once.
 */
public interface RoutePatternParser {

  /** Creates a parser for plain strings; character {@code i} is at source position {@code i}. */
  static RoutePatternParser create() {
    return create(RouteCharConverter.plain());
  }

  /**
   * Creates a parser that converts its string input with {@code converter}.
   *
   * @param converter maps raw input to positioned characters
   * @return the parser
   */
  static RoutePatternParser create(RouteCharConverter converter) {
    return new RoutePatternParserImpl(converter);
  }

  /**
   * Converts {@code input} and parses it.
   *
   * @param input the raw input
   * @return the tree, or {@code null} if the input could not be converted
   */
  RoutePatternTree parse(String input);

  /**
   * Parses an already converted character sequence.
   *
   * @param text the characters
   * @return the tree, or {@code null} if {@code text} is {@code null}
   */
  RoutePatternTree parse(RouteCharSequence text);
}
