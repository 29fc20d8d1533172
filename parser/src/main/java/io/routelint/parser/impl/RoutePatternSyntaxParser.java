package io.routelint.parser.impl;

import io.routelint.parser.api.RouteCharSequence;
import io.routelint.parser.api.RouteDiagnostic;
import io.routelint.parser.api.RoutePatternMessages;
import io.routelint.parser.api.RoutePatternTokenKind;
import io.routelint.parser.api.TextSpan;
import io.routelint.parser.api.syntax.RoutePatternNode.CatchAllParameterPart;
import io.routelint.parser.api.syntax.RoutePatternNode.CompilationUnit;
import io.routelint.parser.api.syntax.RoutePatternNode.DefaultValueParameterPart;
import io.routelint.parser.api.syntax.RoutePatternNode.Literal;
import io.routelint.parser.api.syntax.RoutePatternNode.NameParameterPart;
import io.routelint.parser.api.syntax.RoutePatternNode.OptionalParameterPart;
import io.routelint.parser.api.syntax.RoutePatternNode.Parameter;
import io.routelint.parser.api.syntax.RoutePatternNode.ParameterPart;
import io.routelint.parser.api.syntax.RoutePatternNode.PolicyFragment;
import io.routelint.parser.api.syntax.RoutePatternNode.PolicyFragmentEscaped;
import io.routelint.parser.api.syntax.RoutePatternNode.PolicyFragmentPart;
import io.routelint.parser.api.syntax.RoutePatternNode.PolicyParameterPart;
import io.routelint.parser.api.syntax.RoutePatternNode.RootPart;
import io.routelint.parser.api.syntax.RoutePatternNode.Segment;
import io.routelint.parser.api.syntax.RoutePatternNode.SegmentPart;
import io.routelint.parser.api.syntax.RoutePatternNode.SegmentSeparator;
import io.routelint.parser.api.syntax.RoutePatternToken;
import io.routelint.parser.internal_api.RoutePatternLexer;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser producing the raw syntax tree of a route pattern.
 *
 * <pre>
 * CompilationUnit := RootPart* EndOfFile
 * RootPart        := Segment | SegmentSeparator
 * Segment         := (Parameter | Literal)*
 * Parameter       := '{' CatchAll? ParameterName? (Policy | Optional | DefaultValue)* '}'
 * CatchAll        := '*' | '**'
 * Policy          := ':' ('(' EscapedText ')' | UnescapedText)*
 * Optional        := '?'
 * DefaultValue    := '=' DefaultValueText
 * </pre>
 *
 * <p>The parser keeps one token of lookahead. When a longer-lived scan has to start at the
 * lookahead token, the lexer is moved back over it and the run is rescanned. Tokens the grammar
 * requires but the input lacks are synthesized as zero-width tokens, so the tree always has the
 * shape of the grammar.
 */
final class RoutePatternSyntaxParser {
  private final RoutePatternLexer lexer;
  private RoutePatternToken currentToken;

  private RoutePatternSyntaxParser(RouteCharSequence text) {
    this.lexer = new RoutePatternLexer(text);
    consumeCurrentToken();
  }

  static CompilationUnit parse(RouteCharSequence text) {
    return new RoutePatternSyntaxParser(text).parseCompilationUnit();
  }

  /** Returns the current token and scans the next one. */
  private RoutePatternToken consumeCurrentToken() {
    RoutePatternToken previous = currentToken;
    currentToken = lexer.scanNextToken();
    return previous;
  }

  private boolean at(RoutePatternTokenKind kind) {
    return currentToken.kind() == kind;
  }

  /** Un-scans the current token so that the next scan starts at its character. */
  private void moveBackBeforePreviousScan() {
    if (!at(RoutePatternTokenKind.END_OF_FILE)) {
      lexer.moveBack();
    }
  }

  private CompilationUnit parseCompilationUnit() {
    List<RootPart> parts = new ArrayList<>();
    while (!at(RoutePatternTokenKind.END_OF_FILE)) {
      if (at(RoutePatternTokenKind.SLASH)) {
        parts.add(new SegmentSeparator(consumeCurrentToken()));
      } else {
        parts.add(parseSegment());
      }
    }
    return new CompilationUnit(parts, currentToken);
  }

  private Segment parseSegment() {
    List<SegmentPart> parts = new ArrayList<>();
    while (!at(RoutePatternTokenKind.END_OF_FILE) && !at(RoutePatternTokenKind.SLASH)) {
      parts.add(parseSegmentPart());
    }
    return new Segment(parts);
  }

  private SegmentPart parseSegmentPart() {
    if (at(RoutePatternTokenKind.OPEN_BRACE)) {
      RoutePatternToken openBraceToken = consumeCurrentToken();
      if (!at(RoutePatternTokenKind.OPEN_BRACE)) {
        return parseParameter(openBraceToken);
      }
      // escaped brace: rescan both characters as literal text
      moveBackBeforePreviousScan();
    }
    return parseLiteral();
  }

  private Literal parseLiteral() {
    moveBackBeforePreviousScan();
    RoutePatternToken literal = lexer.tryScanLiteral();
    consumeCurrentToken();
    // the segment loop only gets here at a character the literal scan accepts
    return new Literal(literal);
  }

  private Parameter parseParameter(RoutePatternToken openBraceToken) {
    List<ParameterPart> parts = parseParameterParts();
    RoutePatternToken closeBraceToken;
    if (at(RoutePatternTokenKind.CLOSE_BRACE)) {
      closeBraceToken = consumeCurrentToken();
    } else {
      int position = tokenStart(currentToken);
      closeBraceToken =
          RoutePatternToken.missing(RoutePatternTokenKind.CLOSE_BRACE, position)
              .addDiagnosticIfNone(
                  new RouteDiagnostic(
                      RoutePatternMessages.MISMATCHED_PARAMETER, TextSpan.empty(position)));
    }
    return new Parameter(openBraceToken, parts, closeBraceToken);
  }

  private List<ParameterPart> parseParameterParts() {
    List<ParameterPart> parts = new ArrayList<>();

    if (at(RoutePatternTokenKind.ASTERISK)) {
      RoutePatternToken firstAsterisk = consumeCurrentToken();
      if (at(RoutePatternTokenKind.ASTERISK)) {
        // {**name}
        RouteCharSequence both =
            RouteCharSequence.fromBounds(firstAsterisk.chars(), currentToken.chars());
        parts.add(
            new CatchAllParameterPart(RoutePatternToken.of(RoutePatternTokenKind.ASTERISK, both)));
        consumeCurrentToken();
      } else {
        parts.add(new CatchAllParameterPart(firstAsterisk));
      }
    }

    moveBackBeforePreviousScan();
    RoutePatternToken name = lexer.tryScanParameterName();
    if (name != null) {
      parts.add(new NameParameterPart(name));
    } else if (!at(RoutePatternTokenKind.END_OF_FILE)) {
      parts.add(
          new NameParameterPart(
              RoutePatternToken.missing(
                      RoutePatternTokenKind.PARAMETER_NAME, tokenStart(currentToken))
                  .addDiagnosticIfNone(
                      new RouteDiagnostic(
                          RoutePatternMessages.invalidParameterName(""), currentToken.span()))));
    }
    consumeCurrentToken();

    while (true) {
      switch (currentToken.kind()) {
        case COLON -> parts.add(parsePolicy());
        case QUESTION_MARK -> parts.add(new OptionalParameterPart(consumeCurrentToken()));
        case EQUALS -> parts.add(parseDefaultValue());
        default -> {
          return parts;
        }
      }
    }
  }

  private DefaultValueParameterPart parseDefaultValue() {
    RoutePatternToken equalsToken = currentToken;
    RoutePatternToken value = lexer.tryScanDefaultValue();
    if (value == null) {
      value =
          RoutePatternToken.missing(
              RoutePatternTokenKind.DEFAULT_VALUE, lexer.positionAt(lexer.position()));
    }
    consumeCurrentToken();
    return new DefaultValueParameterPart(equalsToken, value);
  }

  private PolicyParameterPart parsePolicy() {
    RoutePatternToken colonToken = consumeCurrentToken();
    List<PolicyFragmentPart> fragments = new ArrayList<>();
    while (!at(RoutePatternTokenKind.END_OF_FILE)
        && !at(RoutePatternTokenKind.CLOSE_BRACE)
        && !at(RoutePatternTokenKind.COLON)
        && !at(RoutePatternTokenKind.QUESTION_MARK)
        && !at(RoutePatternTokenKind.EQUALS)) {
      if (at(RoutePatternTokenKind.OPEN_PAREN)) {
        fragments.add(parseEscapedPolicyFragment());
        continue;
      }
      moveBackBeforePreviousScan();
      // the loop guard leaves only characters the fragment scan accepts, so it is never empty
      RoutePatternToken fragment = lexer.tryScanUnescapedPolicyFragment();
      fragments.add(new PolicyFragment(fragment));
      consumeCurrentToken();
    }
    return new PolicyParameterPart(colonToken, fragments);
  }

  private PolicyFragmentEscaped parseEscapedPolicyFragment() {
    // the lexer already stands behind the '('
    RoutePatternToken openParenToken = currentToken;
    RoutePatternToken argument = lexer.tryScanEscapedPolicyFragment();
    if (argument == null) {
      argument =
          RoutePatternToken.missing(
              RoutePatternTokenKind.POLICY_FRAGMENT, lexer.positionAt(lexer.position()));
    }
    consumeCurrentToken();
    RoutePatternToken closeParenToken =
        at(RoutePatternTokenKind.CLOSE_PAREN)
            ? consumeCurrentToken()
            : RoutePatternToken.missing(
                RoutePatternTokenKind.CLOSE_PAREN, tokenStart(currentToken));
    return new PolicyFragmentEscaped(openParenToken, argument, closeParenToken);
  }

  private int tokenStart(RoutePatternToken token) {
    return token.kind() == RoutePatternTokenKind.END_OF_FILE
        ? lexer.text().endPosition()
        : token.span().start();
  }
}
