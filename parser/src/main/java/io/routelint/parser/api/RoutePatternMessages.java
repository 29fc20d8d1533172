package io.routelint.parser.api;

/**
 * Diagnostic messages. The wording follows the ASP.NET Core route template parser so that the
 * messages match what the runtime reports for the same pattern.
 */
public final class RoutePatternMessages {
  private RoutePatternMessages() {}

  public static final String CANNOT_HAVE_CONSECUTIVE_PARAMETERS =
      "A path segment cannot contain two consecutive parameters. They must be separated by a '/'"
          + " or by a literal string.";

  public static final String CATCH_ALL_MUST_BE_LAST =
      "A catch-all parameter can only appear as the last segment of the route template.";

  public static final String CANNOT_HAVE_CATCH_ALL_IN_MULTI_SEGMENT =
      "A path segment that contains more than one section, such as a literal section or a"
          + " parameter, cannot contain a catch-all parameter.";

  public static final String OPTIONAL_CANNOT_HAVE_DEFAULT_VALUE =
      "An optional parameter cannot have default value.";

  public static final String CATCH_ALL_CANNOT_BE_OPTIONAL =
      "A catch-all parameter cannot be marked optional.";

  public static final String MISMATCHED_PARAMETER =
      "There is an incomplete parameter in the route template. Check that each '{' character has"
          + " a matching '}' character.";

  public static final String UNESCAPED_BRACE =
      "In a route parameter, '{' and '}' must be escaped with '{{' and '}}'.";

  /** The route parameter name appears more than once. */
  public static String repeatedParameter(String name) {
    return "The route parameter name '" + name + "' appears more than one time in the route"
        + " template.";
  }

  /** The route parameter name is empty or contains a reserved character. */
  public static String invalidParameterName(String name) {
    return "The route parameter name '"
        + name
        + "' is invalid. Route parameter names must be non-empty and cannot contain these"
        + " characters: '{', '}', '/'. The '?' character marks a parameter as optional, and can"
        + " occur only at the end of the parameter. The '*' character marks a parameter as"
        + " catch-all, and can occur only at the start of the parameter.";
  }
}
