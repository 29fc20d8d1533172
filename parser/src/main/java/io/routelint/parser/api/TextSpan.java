package io.routelint.parser.api;

/**
 * A half-open range {@code [start, start + length)} of positions in the original source.
 *
 * @param start first position covered by the span
 * @param length number of positions covered; zero for an empty span
 */
public record TextSpan(int start, int length) {

  public TextSpan {
    if (start < 0) {
      throw new IllegalArgumentException("start must not be negative: " + start);
    }
    if (length < 0) {
      throw new IllegalArgumentException("length must not be negative: " + length);
    }
  }

  /**
   * Creates a span from inclusive start and exclusive end positions.
   *
   * @param start the start position (inclusive)
   * @param end the end position (exclusive)
   * @return the span
   */
  public static TextSpan fromBounds(int start, int end) {
    if (end < start) {
      throw new IllegalArgumentException("end " + end + " is before start " + start);
    }
    return new TextSpan(start, end - start);
  }

  /** Creates an empty span located at {@code position}. */
  public static TextSpan empty(int position) {
    return new TextSpan(position, 0);
  }

  /** Returns the exclusive end position. */
  public int end() {
    return start + length;
  }

  public boolean isEmpty() {
    return length == 0;
  }

  /** Returns {@code true} if {@code other} lies entirely within this span. */
  public boolean contains(TextSpan other) {
    return other.start >= start && other.end() <= end();
  }

  /** Returns {@code true} if {@code position} is covered by this span. */
  public boolean contains(int position) {
    return position >= start && position < end();
  }

  @Override
  public String toString() {
    return "[" + start + ".." + end() + ")";
  }
}
