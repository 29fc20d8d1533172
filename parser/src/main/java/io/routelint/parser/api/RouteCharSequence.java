package io.routelint.parser.api;

import java.util.List;

/**
 * Read-only, indexed view over a sequence of {@link RouteChar}s.
 *
 * <p>Sub-sequences share the backing array with the sequence they were taken from. The
 * characters of a sequence are not required to be contiguous in the source; every character
 * carries its own span.
 */
public final class RouteCharSequence {
  private static final RouteChar[] NO_CHARS = new RouteChar[0];

  private final RouteChar[] chars;
  private final int offset;
  private final int length;
  // position reported for an empty sequence
  private final int emptyPosition;

  private RouteCharSequence(RouteChar[] chars, int offset, int length, int emptyPosition) {
    this.chars = chars;
    this.offset = offset;
    this.length = length;
    this.emptyPosition = emptyPosition;
  }

  /**
   * Creates a sequence from the given characters.
   *
   * @param chars the characters, in order
   * @param endPosition source position just past the sequence; used to locate the end of an empty
   *     sequence
   * @return the sequence
   */
  public static RouteCharSequence of(List<RouteChar> chars, int endPosition) {
    RouteChar[] array = chars.toArray(NO_CHARS);
    for (RouteChar ch : array) {
      if (ch == null) {
        throw new IllegalArgumentException("chars must not contain null");
      }
    }
    return new RouteCharSequence(array, 0, array.length, endPosition);
  }

  /** Creates an empty sequence located at {@code position}. */
  public static RouteCharSequence empty(int position) {
    return new RouteCharSequence(NO_CHARS, 0, 0, position);
  }

  /**
   * Creates the sequence spanning from the start of {@code first} to the end of {@code last}. Both
   * must be views over the same backing sequence, with {@code last} not starting before {@code
   * first}.
   */
  public static RouteCharSequence fromBounds(RouteCharSequence first, RouteCharSequence last) {
    if (first.chars != last.chars || last.offset < first.offset) {
      throw new IllegalArgumentException("sequences do not share a backing sequence");
    }
    return new RouteCharSequence(
        first.chars, first.offset, last.offset + last.length - first.offset, first.emptyPosition);
  }

  public int length() {
    return length;
  }

  public boolean isEmpty() {
    return length == 0;
  }

  public RouteChar get(int index) {
    if (index < 0 || index >= length) {
      throw new IndexOutOfBoundsException("index " + index + " out of bounds for " + length);
    }
    return chars[offset + index];
  }

  /**
   * Returns the view over {@code [start, end)} of this sequence.
   *
   * @param start start index (inclusive)
   * @param end end index (exclusive)
   * @return the sub-sequence
   */
  public RouteCharSequence subSequence(int start, int end) {
    if (start < 0 || end > length || start > end) {
      throw new IndexOutOfBoundsException(
          "range [" + start + ", " + end + ") out of bounds for " + length);
    }
    int position = start < length ? chars[offset + start].span().start() : endPosition();
    return new RouteCharSequence(chars, offset + start, end - start, position);
  }

  /**
   * Returns the source position just past the last character, or the position of this sequence if
   * it is empty.
   */
  public int endPosition() {
    return length == 0 ? emptyPosition : chars[offset + length - 1].span().end();
  }

  /** Returns the source position of the first character, or of this sequence if it is empty. */
  public int startPosition() {
    return length == 0 ? emptyPosition : chars[offset].span().start();
  }

  /**
   * Returns the source span from the first to the last character. An empty sequence has an empty
   * span at its position.
   */
  public TextSpan span() {
    return TextSpan.fromBounds(startPosition(), endPosition());
  }

  /** Concatenates the character values. */
  public String createString() {
    StringBuilder sb = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      sb.append(chars[offset + i].value());
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return createString();
  }
}
