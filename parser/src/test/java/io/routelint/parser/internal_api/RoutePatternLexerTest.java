package io.routelint.parser.internal_api;

import static org.junit.jupiter.api.Assertions.*;

import io.routelint.parser.api.RouteCharConverter;
import io.routelint.parser.api.RouteDiagnostic;
import io.routelint.parser.api.RoutePatternMessages;
import io.routelint.parser.api.RoutePatternTokenKind;
import io.routelint.parser.api.TextSpan;
import io.routelint.parser.api.syntax.RoutePatternToken;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RoutePatternLexerTest {

  private static RoutePatternLexer lexer(String text) {
    return new RoutePatternLexer(RouteCharConverter.plain().convert(text));
  }

  // Single-character tokens

  @Test
  void scansEndOfFileOnEmptyText() {
    RoutePatternLexer lexer = lexer("");
    RoutePatternToken token = lexer.scanNextToken();

    assertEquals(RoutePatternTokenKind.END_OF_FILE, token.kind());
    assertEquals(TextSpan.empty(0), token.span());
    assertEquals(0, lexer.position());
  }

  @Test
  void endOfFileDoesNotAdvance() {
    RoutePatternLexer lexer = lexer("a");
    lexer.scanNextToken();

    assertEquals(RoutePatternTokenKind.END_OF_FILE, lexer.scanNextToken().kind());
    assertEquals(RoutePatternTokenKind.END_OF_FILE, lexer.scanNextToken().kind());
    assertEquals(1, lexer.position());
  }

  @ParameterizedTest
  @CsvSource({
    "/, SLASH",
    "~, TILDE",
    "{, OPEN_BRACE",
    "}, CLOSE_BRACE",
    "[, OPEN_BRACKET",
    "], CLOSE_BRACKET",
    "., DOT",
    "=, EQUALS",
    ":, COLON",
    "*, ASTERISK",
    "(, OPEN_PAREN",
    "), CLOSE_PAREN",
    "?, QUESTION_MARK",
    "a, TEXT",
    "-, TEXT",
  })
  void classifiesSingleCharacters(String ch, RoutePatternTokenKind expected) {
    RoutePatternLexer lexer = lexer(ch);
    RoutePatternToken token = lexer.scanNextToken();

    assertEquals(expected, token.kind());
    assertEquals(new TextSpan(0, 1), token.span());
    assertNull(token.value());
    assertEquals(1, lexer.position());
  }

  @Test
  void classifiesComma() {
    assertEquals(RoutePatternTokenKind.COMMA, lexer(",").scanNextToken().kind());
  }

  @Test
  void moveBackRescansSameCharacter() {
    RoutePatternLexer lexer = lexer("{a");
    lexer.scanNextToken();
    lexer.moveBack();

    assertEquals(0, lexer.position());
    assertEquals(RoutePatternTokenKind.OPEN_BRACE, lexer.scanNextToken().kind());
  }

  @Test
  void moveBackAtStartFails() {
    assertThrows(IllegalStateException.class, () -> lexer("a").moveBack());
  }

  // Literals

  @Test
  void literalStopsAtSlash() {
    RoutePatternLexer lexer = lexer("hello/world");
    RoutePatternToken token = lexer.tryScanLiteral();

    assertEquals(RoutePatternTokenKind.LITERAL, token.kind());
    assertEquals("hello", token.value());
    assertEquals(new TextSpan(0, 5), token.span());
    assertEquals(5, lexer.position());
    assertTrue(token.diagnostics().isEmpty());
  }

  @Test
  void literalStopsAtUnescapedOpenBrace() {
    RoutePatternLexer lexer = lexer("ab{c}");
    assertEquals("ab", lexer.tryScanLiteral().value());
    assertEquals(2, lexer.position());
  }

  @Test
  void literalKeepsEscapedBracesUndecoded() {
    RoutePatternToken token = lexer("a{{b}}c").tryScanLiteral();

    assertEquals("a{{b}}c", token.value());
    assertTrue(token.diagnostics().isEmpty());
  }

  @Test
  void literalReportsFirstUnescapedCloseBraceOnly() {
    RoutePatternLexer lexer = lexer("a}b}c");
    RoutePatternToken token = lexer.tryScanLiteral();

    assertEquals("a}b}c", token.value());
    assertEquals(
        List.of(new RouteDiagnostic(RoutePatternMessages.MISMATCHED_PARAMETER, new TextSpan(1, 1))),
        token.diagnostics());
  }

  @Test
  void literalReturnsNullWhenNothingConsumed() {
    assertNull(lexer("").tryScanLiteral());
    assertNull(lexer("/a").tryScanLiteral());
    assertNull(lexer("{a}").tryScanLiteral());
  }

  // Parameter names

  @Test
  void parameterNameStopsAtBoundaries() {
    for (String text : List.of("id:int", "id=1", "id?", "id}")) {
      RoutePatternLexer lexer = lexer(text);
      RoutePatternToken token = lexer.tryScanParameterName();
      assertEquals("id", token.value(), text);
      assertEquals(2, lexer.position(), text);
    }
  }

  @Test
  void parameterNameReportsInvalidCharacters() {
    RoutePatternToken token = lexer("a/b*c}").tryScanParameterName();

    assertEquals("a/b*c", token.value());
    String message = RoutePatternMessages.invalidParameterName("a/b*c");
    assertEquals(
        List.of(
            new RouteDiagnostic(message, new TextSpan(1, 1)),
            new RouteDiagnostic(message, new TextSpan(3, 1))),
        token.diagnostics());
  }

  @Test
  void parameterNameReportsUnescapedOpenBrace() {
    RoutePatternToken token = lexer("foob{bar}").tryScanParameterName();

    assertEquals("foob{bar", token.value());
    assertEquals(
        List.of(new RouteDiagnostic(RoutePatternMessages.UNESCAPED_BRACE, new TextSpan(4, 1))),
        token.diagnostics());
  }

  @Test
  void parameterNameSkipsEscapedOpenBrace() {
    RoutePatternToken token = lexer("a{{b}").tryScanParameterName();

    assertEquals("a{{b", token.value());
    assertTrue(token.diagnostics().isEmpty());
  }

  @Test
  void parameterNameReturnsNullAtBoundary() {
    RoutePatternLexer lexer = lexer("}");
    assertNull(lexer.tryScanParameterName());
    assertEquals(0, lexer.position());
  }

  // Policies and defaults

  @Test
  void policyNameStopsAtOpenParen() {
    RoutePatternToken token = lexer("range(1,10)").tryScanPolicyName();

    assertEquals(RoutePatternTokenKind.POLICY_NAME, token.kind());
    assertEquals("range", token.value());
  }

  @Test
  void policyArgumentStopsAtCloseParen() {
    RoutePatternToken token = lexer("1,10)").tryScanPolicyArgument();

    assertEquals(RoutePatternTokenKind.POLICY_ARGUMENT, token.kind());
    assertEquals("1,10", token.value());
  }

  @Test
  void defaultValueRunsUpToCloseBraceOrQuestionMark() {
    assertEquals("Home=x:int()", lexer("Home=x:int()}").tryScanDefaultValue().value());
    assertEquals("a", lexer("a?}").tryScanDefaultValue().value());
    assertNull(lexer("}").tryScanDefaultValue());
  }

  @Test
  void escapedFragmentConsumesDoubledParenthesesAndBraces() {
    RoutePatternLexer lexer = lexer("^\\d{{3}}-a))b)}");
    RoutePatternToken token = lexer.tryScanEscapedPolicyFragment();

    assertEquals(RoutePatternTokenKind.POLICY_FRAGMENT, token.kind());
    assertEquals("^\\d{{3}}-a))b", token.value());
    assertTrue(token.diagnostics().isEmpty());
    assertEquals(13, lexer.position());
  }

  @Test
  void escapedFragmentStopsAtUnescapedCloseBrace() {
    assertEquals("ab", lexer("ab}").tryScanEscapedPolicyFragment().value());
  }

  @Test
  void escapedFragmentReportsLoneOpenBrace() {
    RoutePatternToken token = lexer("a{b)").tryScanEscapedPolicyFragment();

    assertEquals("a{b", token.value());
    assertEquals(
        List.of(new RouteDiagnostic(RoutePatternMessages.UNESCAPED_BRACE, new TextSpan(1, 1))),
        token.diagnostics());
  }

  @Test
  void escapedFragmentReturnsNullForEmptyArgument() {
    assertNull(lexer(")").tryScanEscapedPolicyFragment());
  }

  @Test
  void unescapedFragmentStopsAtPolicyDelimiters() {
    for (String text : List.of("int:x", "int=x", "int?", "int(x)", "int}")) {
      assertEquals("int", lexer(text).tryScanUnescapedPolicyFragment().value(), text);
    }
  }

  @Test
  void unescapedFragmentConsumesEscapedBraces() {
    RoutePatternToken token = lexer("a}}b{{c}").tryScanUnescapedPolicyFragment();

    assertEquals("a}}b{{c", token.value());
    assertTrue(token.diagnostics().isEmpty());
  }

  @Test
  void spansFollowSourcePositionsOfCharacters() {
    RoutePatternLexer lexer =
        new RoutePatternLexer(
            new io.routelint.parser.api.JavaStringLiteralConverter(10).convert("\"a\\tb/\""));
    RoutePatternToken token = lexer.tryScanLiteral();

    assertEquals("a\tb", token.value());
    assertEquals(TextSpan.fromBounds(11, 15), token.span());
    assertEquals(15, lexer.positionAt(lexer.position()));
  }
}
