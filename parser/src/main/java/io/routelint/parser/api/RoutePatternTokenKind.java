package io.routelint.parser.api;

/**
 * Kinds of tokens in a route pattern tree.
 *
 * <p>Single-character tokens are produced by classifying one character; the remaining kinds are
 * produced by the variable-length scans the parser asks for.
 */
public enum RoutePatternTokenKind {
  // Single-character tokens
  /** Zero-width token at the end of the input. */
  END_OF_FILE("EndOfFile"),
  /** Forward slash: / */
  SLASH("SlashToken"),
  /** Tilde: ~ */
  TILDE("TildeToken"),
  /** Opening brace: { */
  OPEN_BRACE("OpenBraceToken"),
  /** Closing brace: } */
  CLOSE_BRACE("CloseBraceToken"),
  /** Opening square bracket: [ */
  OPEN_BRACKET("OpenBracketToken"),
  /** Closing square bracket: ] */
  CLOSE_BRACKET("CloseBracketToken"),
  /** Period: . */
  DOT("DotToken"),
  /** Equals sign: = */
  EQUALS("EqualsToken"),
  /** Colon: : */
  COLON("ColonToken"),
  /** Asterisk: * (or ** for an unescaped catch-all) */
  ASTERISK("AsteriskToken"),
  /** Opening parenthesis: ( */
  OPEN_PAREN("OpenParenToken"),
  /** Closing parenthesis: ) */
  CLOSE_PAREN("CloseParenToken"),
  /** Question mark: ? */
  QUESTION_MARK("QuestionMarkToken"),
  /** Comma: , */
  COMMA("CommaToken"),
  /** Any other single character */
  TEXT("TextToken"),

  // Scanned tokens
  /** Literal text of a segment */
  LITERAL("LiteralToken"),
  /** Parameter name */
  PARAMETER_NAME("ParameterNameToken"),
  /** Policy name, up to an opening parenthesis */
  POLICY_NAME("PolicyNameToken"),
  /** Policy argument, up to a closing parenthesis */
  POLICY_ARGUMENT("PolicyArgumentToken"),
  /** Text of a policy fragment */
  POLICY_FRAGMENT("PolicyFragmentToken"),
  /** Default value of a parameter */
  DEFAULT_VALUE("DefaultValueToken");

  private final String displayName;

  RoutePatternTokenKind(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }
}
