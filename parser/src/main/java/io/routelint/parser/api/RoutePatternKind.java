package io.routelint.parser.api;

/**
 * Kinds of syntax nodes in a route pattern tree.
 *
 * <p>The display name is the name used when a tree is rendered to text.
 */
public enum RoutePatternKind {
  /** The whole pattern: root parts followed by the end-of-file token. */
  COMPILATION_UNIT("CompilationUnit"),

  /** Everything between two {@code /} separators. */
  SEGMENT("Segment"),

  /** Token replacement, e.g. {@code [controller]}. */
  REPLACEMENT("Replacement"),

  /** A parameter, e.g. {@code {id:int?}}. */
  PARAMETER("Parameter"),

  /** Literal text inside a segment. */
  LITERAL("Literal"),

  /** The {@code /} between segments. */
  SEGMENT_SEPARATOR("SegmentSeparator"),

  /** A {@code .} that may be dropped together with a following optional parameter. */
  OPTIONAL_SEPARATOR("OptionalSeparator"),

  /** The {@code *} or {@code **} catch-all marker of a parameter. */
  CATCH_ALL("CatchAll"),

  /** The name of a parameter. */
  PARAMETER_NAME("ParameterName"),

  /** A {@code :policy} attached to a parameter. */
  PARAMETER_POLICY("ParameterPolicy"),

  /** Plain text of a policy. */
  POLICY_FRAGMENT("PolicyFragment"),

  /** A parenthesized policy argument, e.g. {@code (1,10)}. */
  POLICY_FRAGMENT_ESCAPED("PolicyFragmentEscaped"),

  /** The {@code ?} marking a parameter optional. */
  OPTIONAL("Optional"),

  /** The {@code =value} default of a parameter. */
  DEFAULT_VALUE("DefaultValue");

  private final String displayName;

  RoutePatternKind(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }
}
