package io.routelint.parser.api.syntax;

import io.routelint.parser.api.TextSpan;

/** A child of a {@link RoutePatternNode}: either a nested node or a token. */
public sealed interface NodeOrToken permits RoutePatternNode, RoutePatternToken {

  /** Returns the source span covered by this child. */
  TextSpan span();

  default boolean isNode() {
    return this instanceof RoutePatternNode;
  }

  default RoutePatternNode asNode() {
    if (this instanceof RoutePatternNode node) {
      return node;
    }
    throw new IllegalStateException("Not a node: " + this);
  }

  default RoutePatternToken asToken() {
    if (this instanceof RoutePatternToken token) {
      return token;
    }
    throw new IllegalStateException("Not a token: " + this);
  }
}
