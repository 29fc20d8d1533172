package io.routelint.parser.api;

import java.util.List;

/**
 * A route parameter declared in a pattern.
 *
 * @param name the parameter name as written
 * @param encodeSlashes whether slashes in a captured value are encoded; {@code false} only for
 *     <code>{**name}</code>
 * @param defaultValue the default value, or {@code null} if none is declared
 * @param optional whether the parameter is marked with {@code ?}
 * @param catchAll whether the parameter is a catch-all
 * @param policies the policy texts in declaration order, escapes undecoded
 * @param span the span of the parameter, braces included
 */
public record RouteParameter(
    String name,
    boolean encodeSlashes,
    String defaultValue,
    boolean optional,
    boolean catchAll,
    List<String> policies,
    TextSpan span) {

  public RouteParameter {
    policies = List.copyOf(policies);
  }
}
