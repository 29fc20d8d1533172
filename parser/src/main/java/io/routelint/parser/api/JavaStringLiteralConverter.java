package io.routelint.parser.api;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a quoted Java string literal, as it appears in source code, into route characters.
 *
 * <p>Escape sequences are decoded and every decoded character keeps the span of the escape that
 * produced it, so diagnostics can be reported against the literal in the source file. Spans are
 * shifted by the base offset, which is the position of the opening quote in the enclosing file.
 *
 * <p>Anything that is not a single, well-formed literal (missing quotes, a raw quote or line break
 * inside, an unknown or truncated escape) yields {@code null}.
 */
public final class JavaStringLiteralConverter implements RouteCharConverter {
  private final int baseOffset;

  public JavaStringLiteralConverter() {
    this(0);
  }

  public JavaStringLiteralConverter(int baseOffset) {
    if (baseOffset < 0) {
      throw new IllegalArgumentException("baseOffset must not be negative: " + baseOffset);
    }
    this.baseOffset = baseOffset;
  }

  @Override
  public RouteCharSequence convert(String source) {
    if (source == null || source.length() < 2) {
      return null;
    }
    int last = source.length() - 1;
    if (source.charAt(0) != '"' || source.charAt(last) != '"') {
      return null;
    }

    List<RouteChar> chars = new ArrayList<>(last);
    int pos = 1;
    while (pos < last) {
      char c = source.charAt(pos);
      if (c == '"' || c == '\n' || c == '\r') {
        return null;
      }
      if (c != '\\') {
        chars.add(charAt(c, pos, 1));
        pos++;
        continue;
      }
      if (pos + 1 >= last) {
        return null;
      }
      char e = source.charAt(pos + 1);
      switch (e) {
        case 'n' -> chars.add(charAt('\n', pos, 2));
        case 't' -> chars.add(charAt('\t', pos, 2));
        case 'b' -> chars.add(charAt('\b', pos, 2));
        case 'r' -> chars.add(charAt('\r', pos, 2));
        case 'f' -> chars.add(charAt('\f', pos, 2));
        case 's' -> chars.add(charAt(' ', pos, 2));
        case '"', '\'', '\\' -> chars.add(charAt(e, pos, 2));
        case 'u' -> {
          int hexStart = pos + 1;
          while (hexStart < last && source.charAt(hexStart) == 'u') {
            hexStart++;
          }
          if (hexStart + 4 > last) {
            return null;
          }
          int value = 0;
          for (int i = hexStart; i < hexStart + 4; i++) {
            int digit = Character.digit(source.charAt(i), 16);
            if (digit < 0) {
              return null;
            }
            value = value * 16 + digit;
          }
          chars.add(charAt((char) value, pos, hexStart + 4 - pos));
          pos = hexStart + 4;
          continue;
        }
        default -> {
          if (e < '0' || e > '7') {
            return null;
          }
          // up to three octal digits, capped at octal 377
          int maxDigits = e <= '3' ? 3 : 2;
          int end = pos + 1;
          int value = 0;
          while (end < last && end - pos - 1 < maxDigits) {
            char d = source.charAt(end);
            if (d < '0' || d > '7') {
              break;
            }
            value = value * 8 + (d - '0');
            end++;
          }
          chars.add(charAt((char) value, pos, end - pos));
          pos = end;
          continue;
        }
      }
      pos += 2;
    }
    return RouteCharSequence.of(chars, baseOffset + last);
  }

  private RouteChar charAt(char value, int position, int length) {
    return new RouteChar(value, new TextSpan(baseOffset + position, length));
  }
}
