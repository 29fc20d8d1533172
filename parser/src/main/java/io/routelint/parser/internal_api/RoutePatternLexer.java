package io.routelint.parser.internal_api;

import io.routelint.parser.api.Internal;
import io.routelint.parser.api.RouteCharSequence;
import io.routelint.parser.api.RouteDiagnostic;
import io.routelint.parser.api.RoutePatternMessages;
import io.routelint.parser.api.RoutePatternTokenKind;
import io.routelint.parser.api.syntax.RoutePatternToken;
import java.util.ArrayList;
import java.util.List;

/**
 * On-demand lexer for route patterns.
 *
 * <p>The lexer does not tokenize ahead. The parser asks for one token at a time and picks the scan
 * that fits its state: {@link #scanNextToken()} produces single-character tokens, the {@code
 * tryScan*} methods consume a variable-length run starting at the cursor. The parser owns the
 * cursor; after looking at a token with {@link #scanNextToken()} it may call {@link #moveBack()}
 * and rescan the same character with a longer-lived scan.
 *
 * <p>Doubled braces (<code>{{</code>, <code>}}</code>) and, inside policy arguments, doubled
 * closing parentheses are escapes and are always consumed as a pair.
 *
 * <p>Instances are not thread-safe and are used for a single parse.
 */
@Internal
public final class RoutePatternLexer {
  private final RouteCharSequence text;
  private int position;

  public RoutePatternLexer(RouteCharSequence text) {
    this.text = text;
  }

  public RouteCharSequence text() {
    return text;
  }

  /** Returns the cursor, an index into {@link #text()}. */
  public int position() {
    return position;
  }

  /** Un-consumes the single character scanned last. */
  public void moveBack() {
    if (position == 0) {
      throw new IllegalStateException("cursor is at the start of the text");
    }
    position--;
  }

  /** Returns the source position of the character at {@code index}, or the end of the text. */
  public int positionAt(int index) {
    return index < text.length() ? text.get(index).span().start() : text.endPosition();
  }

  public RouteCharSequence subSequence(int start, int end) {
    return text.subSequence(start, end);
  }

  /**
   * Consumes one character and classifies it. At the end of the text returns a zero-width {@link
   * RoutePatternTokenKind#END_OF_FILE} token and leaves the cursor in place.
   */
  public RoutePatternToken scanNextToken() {
    if (position == text.length()) {
      return RoutePatternToken.missing(RoutePatternTokenKind.END_OF_FILE, text.endPosition());
    }
    char ch = charAt(position);
    position++;
    return RoutePatternToken.of(kindOf(ch), text.subSequence(position - 1, position));
  }

  private static RoutePatternTokenKind kindOf(char ch) {
    return switch (ch) {
      case '/' -> RoutePatternTokenKind.SLASH;
      case '~' -> RoutePatternTokenKind.TILDE;
      case '{' -> RoutePatternTokenKind.OPEN_BRACE;
      case '}' -> RoutePatternTokenKind.CLOSE_BRACE;
      case '[' -> RoutePatternTokenKind.OPEN_BRACKET;
      case ']' -> RoutePatternTokenKind.CLOSE_BRACKET;
      case '.' -> RoutePatternTokenKind.DOT;
      case '=' -> RoutePatternTokenKind.EQUALS;
      case ':' -> RoutePatternTokenKind.COLON;
      case '*' -> RoutePatternTokenKind.ASTERISK;
      case '(' -> RoutePatternTokenKind.OPEN_PAREN;
      case ')' -> RoutePatternTokenKind.CLOSE_PAREN;
      case '?' -> RoutePatternTokenKind.QUESTION_MARK;
      case ',' -> RoutePatternTokenKind.COMMA;
      default -> RoutePatternTokenKind.TEXT;
    };
  }

  /**
   * Scans literal text up to a {@code /}, an unescaped <code>{</code> or the end. An unescaped
   * <code>}</code> is taken into the literal; the first one is reported as a mismatched parameter.
   *
   * @return the literal token, or {@code null} if nothing was consumed
   */
  public RoutePatternToken tryScanLiteral() {
    int start = position;
    int mismatched = -1;
    while (position < text.length()) {
      char ch = charAt(position);
      if (ch == '/') {
        break;
      }
      if (ch == '{') {
        if (!isAt("{{")) {
          break;
        }
        position += 2;
        continue;
      }
      if (ch == '}') {
        if (isAt("}}")) {
          position += 2;
          continue;
        }
        if (mismatched < 0) {
          mismatched = position;
        }
      }
      position++;
    }
    if (position == start) {
      return null;
    }
    RoutePatternToken token = createValueToken(RoutePatternTokenKind.LITERAL, start);
    if (mismatched >= 0) {
      token =
          token.addDiagnosticIfNone(
              new RouteDiagnostic(
                  RoutePatternMessages.MISMATCHED_PARAMETER, text.get(mismatched).span()));
    }
    return token;
  }

  /**
   * Scans a parameter name up to {@code :}, {@code =}, {@code ?}, <code>}</code> or the end.
   * Reserved characters in the name and unescaped opening braces are reported on the returned
   * token.
   *
   * @return the name token, or {@code null} if nothing was consumed
   */
  public RoutePatternToken tryScanParameterName() {
    int start = position;
    List<Integer> flagged = new ArrayList<>();
    while (position < text.length() && !isParameterNameBoundary(charAt(position))) {
      char ch = charAt(position);
      if (ch == '{') {
        if (isAt("{{")) {
          position += 2;
          continue;
        }
        flagged.add(position);
      } else if (isInvalidParameterNameChar(ch)) {
        flagged.add(position);
      }
      position++;
    }
    if (position == start) {
      return null;
    }
    RoutePatternToken token = createValueToken(RoutePatternTokenKind.PARAMETER_NAME, start);
    if (flagged.isEmpty()) {
      return token;
    }
    List<RouteDiagnostic> diagnostics = new ArrayList<>(flagged.size());
    for (int index : flagged) {
      String message =
          charAt(index) == '{'
              ? RoutePatternMessages.UNESCAPED_BRACE
              : RoutePatternMessages.invalidParameterName(token.value());
      diagnostics.add(new RouteDiagnostic(message, text.get(index).span()));
    }
    return token.withDiagnostics(diagnostics);
  }

  private static boolean isParameterNameBoundary(char ch) {
    return ch == ':' || ch == '=' || ch == '?' || ch == '}';
  }

  private static boolean isInvalidParameterNameChar(char ch) {
    return ch == '/' || ch == '}' || ch == '?' || ch == '*';
  }

  /** Scans a policy name; stops at any of <code>{:=?}(</code>. */
  public RoutePatternToken tryScanPolicyName() {
    return scanUntil(RoutePatternTokenKind.POLICY_NAME, "{:=?}(");
  }

  /** Scans a policy argument; stops at any of <code>{:=?})</code>. */
  public RoutePatternToken tryScanPolicyArgument() {
    return scanUntil(RoutePatternTokenKind.POLICY_ARGUMENT, "{:=?})");
  }

  /** Scans a default value up to <code>}</code> or {@code ?}. */
  public RoutePatternToken tryScanDefaultValue() {
    return scanUntil(RoutePatternTokenKind.DEFAULT_VALUE, "}?");
  }

  private RoutePatternToken scanUntil(RoutePatternTokenKind kind, String boundaries) {
    int start = position;
    while (position < text.length() && boundaries.indexOf(charAt(position)) < 0) {
      position++;
    }
    return position == start ? null : createValueToken(kind, start);
  }

  /**
   * Scans the argument of a policy, the text after its opening parenthesis. Stops at an unescaped
   * {@code )}, an unescaped <code>}</code> or the end; {@code ))} stands for a closing parenthesis.
   *
   * @return the fragment token, or {@code null} if nothing was consumed
   */
  public RoutePatternToken tryScanEscapedPolicyFragment() {
    int start = position;
    List<Integer> unescaped = new ArrayList<>();
    while (position < text.length()) {
      char ch = charAt(position);
      if (ch == ')' || ch == '}') {
        if (!isPair(ch)) {
          break;
        }
        position += 2;
        continue;
      }
      if (ch == '{') {
        if (isPair(ch)) {
          position += 2;
          continue;
        }
        unescaped.add(position);
      }
      position++;
    }
    return createFragment(start, unescaped);
  }

  /**
   * Scans policy text outside parentheses. Stops at {@code :}, {@code =}, {@code ?}, {@code (}, an
   * unescaped <code>}</code> or the end.
   *
   * @return the fragment token, or {@code null} if nothing was consumed
   */
  public RoutePatternToken tryScanUnescapedPolicyFragment() {
    int start = position;
    List<Integer> unescaped = new ArrayList<>();
    while (position < text.length()) {
      char ch = charAt(position);
      if (ch == ':' || ch == '=' || ch == '?' || ch == '(') {
        break;
      }
      if (ch == '}') {
        if (!isPair(ch)) {
          break;
        }
        position += 2;
        continue;
      }
      if (ch == '{') {
        if (isPair(ch)) {
          position += 2;
          continue;
        }
        unescaped.add(position);
      }
      position++;
    }
    return createFragment(start, unescaped);
  }

  private RoutePatternToken createFragment(int start, List<Integer> unescapedBraces) {
    if (position == start) {
      return null;
    }
    RoutePatternToken token = createValueToken(RoutePatternTokenKind.POLICY_FRAGMENT, start);
    if (unescapedBraces.isEmpty()) {
      return token;
    }
    List<RouteDiagnostic> diagnostics = new ArrayList<>(unescapedBraces.size());
    for (int index : unescapedBraces) {
      diagnostics.add(
          new RouteDiagnostic(RoutePatternMessages.UNESCAPED_BRACE, text.get(index).span()));
    }
    return token.withDiagnostics(diagnostics);
  }

  private RoutePatternToken createValueToken(RoutePatternTokenKind kind, int start) {
    RouteCharSequence chars = text.subSequence(start, position);
    return new RoutePatternToken(kind, chars, chars.createString(), List.of());
  }

  private char charAt(int index) {
    return text.get(index).value();
  }

  private boolean isPair(char ch) {
    return position + 1 < text.length() && charAt(position) == ch && charAt(position + 1) == ch;
  }

  private boolean isAt(String value) {
    for (int i = 0; i < value.length(); i++) {
      if (position + i >= text.length() || charAt(position + i) != value.charAt(i)) {
        return false;
      }
    }
    return true;
  }
}
