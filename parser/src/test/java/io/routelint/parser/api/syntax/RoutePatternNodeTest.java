package io.routelint.parser.api.syntax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import io.routelint.parser.api.RouteCharConverter;
import io.routelint.parser.api.RouteCharSequence;
import io.routelint.parser.api.RoutePatternKind;
import io.routelint.parser.api.RoutePatternTokenKind;
import io.routelint.parser.api.TextSpan;
import io.routelint.parser.api.syntax.RoutePatternNode.CompilationUnit;
import io.routelint.parser.api.syntax.RoutePatternNode.Literal;
import io.routelint.parser.api.syntax.RoutePatternNode.NameParameterPart;
import io.routelint.parser.api.syntax.RoutePatternNode.OptionalSeparator;
import io.routelint.parser.api.syntax.RoutePatternNode.Parameter;
import io.routelint.parser.api.syntax.RoutePatternNode.Replacement;
import io.routelint.parser.api.syntax.RoutePatternNode.Segment;
import java.util.List;
import org.junit.jupiter.api.Test;

class RoutePatternNodeTest {
  private final RouteCharSequence text = RouteCharConverter.plain().convert("{id}[c].");

  private RoutePatternToken token(RoutePatternTokenKind kind, int start, int end) {
    return RoutePatternToken.of(kind, text.subSequence(start, end));
  }

  private Parameter parameter() {
    return new Parameter(
        token(RoutePatternTokenKind.OPEN_BRACE, 0, 1),
        List.of(new NameParameterPart(token(RoutePatternTokenKind.PARAMETER_NAME, 1, 3))),
        token(RoutePatternTokenKind.CLOSE_BRACE, 3, 4));
  }

  @Test
  void childrenAreIndexedInOrder() {
    Parameter parameter = parameter();

    assertEquals(RoutePatternKind.PARAMETER, parameter.kind());
    assertEquals(3, parameter.childCount());
    assertSame(parameter.openBraceToken(), parameter.childAt(0));
    assertTrue(parameter.childAt(1).isNode());
    assertSame(parameter.closeBraceToken(), parameter.childAt(2));
    assertThat(parameter.children()).hasSize(3);
  }

  @Test
  void childIndexOutOfRange() {
    Parameter parameter = parameter();

    assertThrows(IndexOutOfBoundsException.class, () -> parameter.childAt(3));
    assertThrows(IndexOutOfBoundsException.class, () -> parameter.childAt(-1));
  }

  @Test
  void constructorsCheckTokenKinds() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new Literal(token(RoutePatternTokenKind.TEXT, 0, 1)));
    assertThrows(
        IllegalArgumentException.class,
        () -> new CompilationUnit(List.of(), token(RoutePatternTokenKind.SLASH, 0, 1)));
  }

  @Test
  void spanSkipsMissingTokens() {
    Parameter parameter =
        new Parameter(
            token(RoutePatternTokenKind.OPEN_BRACE, 0, 1),
            List.of(new NameParameterPart(token(RoutePatternTokenKind.PARAMETER_NAME, 1, 3))),
            RoutePatternToken.missing(RoutePatternTokenKind.CLOSE_BRACE, 3));

    assertEquals(TextSpan.fromBounds(0, 3), parameter.span());
  }

  @Test
  void spanOfNodeWithOnlyMissingTokens() {
    CompilationUnit root =
        new CompilationUnit(
            List.of(), RoutePatternToken.missing(RoutePatternTokenKind.END_OF_FILE, 5));

    assertEquals(TextSpan.empty(5), root.span());
  }

  @Test
  void replacementAndOptionalSeparatorCanBeBuilt() {
    Replacement replacement =
        new Replacement(
            token(RoutePatternTokenKind.OPEN_BRACKET, 4, 5),
            token(RoutePatternTokenKind.TEXT, 5, 6),
            token(RoutePatternTokenKind.CLOSE_BRACKET, 6, 7));
    OptionalSeparator dot = new OptionalSeparator(token(RoutePatternTokenKind.DOT, 7, 8));
    Segment segment = new Segment(List.of(parameter(), replacement, dot));

    assertEquals(TextSpan.fromBounds(0, 8), segment.span());
    assertEquals("c", replacement.textToken().text());
    StringBuilder tokens = new StringBuilder();
    segment.forEachToken(t -> tokens.append(t.text()));
    assertEquals("{id}[c].", tokens.toString());
  }
}
