package io.routelint.parser.api.syntax;

import io.routelint.parser.api.RoutePatternKind;
import io.routelint.parser.api.RoutePatternTokenKind;
import io.routelint.parser.api.TextSpan;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Syntax tree model for route patterns.
 *
 * <p>Nodes are immutable and built bottom-up. Every node exposes its children uniformly through
 * {@link #childCount()} and {@link #childAt(int)}; the children of a node, in order, cover exactly
 * the characters the node was parsed from. The set of node classes is closed; code that needs to
 * handle every kind switches over {@link #kind()}.
 */
public abstract sealed class RoutePatternNode implements NodeOrToken {
  private final RoutePatternKind kind;

  private RoutePatternNode(RoutePatternKind kind) {
    this.kind = kind;
  }

  public final RoutePatternKind kind() {
    return kind;
  }

  public abstract int childCount();

  /**
   * Returns the child at {@code index}.
   *
   * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, childCount())}
   */
  public abstract NodeOrToken childAt(int index);

  /** Returns the children in order. */
  public final List<NodeOrToken> children() {
    List<NodeOrToken> result = new ArrayList<>(childCount());
    for (int i = 0; i < childCount(); i++) {
      result.add(childAt(i));
    }
    return Collections.unmodifiableList(result);
  }

  /** Visits every token below this node, depth-first, in document order. */
  public final void forEachToken(Consumer<RoutePatternToken> action) {
    for (int i = 0; i < childCount(); i++) {
      NodeOrToken child = childAt(i);
      if (child instanceof RoutePatternNode node) {
        node.forEachToken(action);
      } else {
        action.accept((RoutePatternToken) child);
      }
    }
  }

  /**
   * Returns the span from the first to the last character of the node. Missing tokens do not
   * contribute unless the node consists of missing tokens only.
   */
  @Override
  public final TextSpan span() {
    int[] bounds = {-1, -1};
    TextSpan[] fallback = new TextSpan[1];
    forEachToken(
        token -> {
          if (fallback[0] == null) {
            fallback[0] = token.span();
          }
          if (!token.isMissing()) {
            if (bounds[0] < 0) {
              bounds[0] = token.span().start();
            }
            bounds[1] = token.span().end();
          }
        });
    if (bounds[0] < 0) {
      return fallback[0];
    }
    return TextSpan.fromBounds(bounds[0], bounds[1]);
  }

  @Override
  public String toString() {
    return kind.displayName() + span();
  }

  private static IndexOutOfBoundsException badIndex(int index, int count) {
    return new IndexOutOfBoundsException("child index " + index + " out of bounds for " + count);
  }

  private static RoutePatternToken require(RoutePatternToken token, RoutePatternTokenKind kind) {
    if (token == null || token.kind() != kind) {
      throw new IllegalArgumentException(
          "expected " + kind.displayName() + " but got " + (token == null ? null : token.kind()));
    }
    return token;
  }

  // Part categories

  /** A direct child of the compilation unit. */
  public sealed interface RootPart permits Segment, SegmentSeparator {}

  /** A part of a segment. */
  public sealed interface SegmentPart permits Parameter, Literal, Replacement, OptionalSeparator {}

  /** A part of a parameter. */
  public sealed interface ParameterPart
      permits CatchAllParameterPart,
          NameParameterPart,
          PolicyParameterPart,
          OptionalParameterPart,
          DefaultValueParameterPart {}

  /** A piece of a policy. */
  public sealed interface PolicyFragmentPart permits PolicyFragment, PolicyFragmentEscaped {}

  // Nodes

  /** The root of every tree. */
  public static final class CompilationUnit extends RoutePatternNode {
    private final List<RootPart> parts;
    private final RoutePatternToken endOfFileToken;

    public CompilationUnit(List<RootPart> parts, RoutePatternToken endOfFileToken) {
      super(RoutePatternKind.COMPILATION_UNIT);
      this.parts = List.copyOf(parts);
      this.endOfFileToken = require(endOfFileToken, RoutePatternTokenKind.END_OF_FILE);
    }

    public List<RootPart> parts() {
      return parts;
    }

    public RoutePatternToken endOfFileToken() {
      return endOfFileToken;
    }

    @Override
    public int childCount() {
      return parts.size() + 1;
    }

    @Override
    public NodeOrToken childAt(int index) {
      if (index == parts.size()) {
        return endOfFileToken;
      }
      if (index < 0 || index > parts.size()) {
        throw badIndex(index, childCount());
      }
      return (NodeOrToken) parts.get(index);
    }
  }

  /** The parts between two separators. */
  public static final class Segment extends RoutePatternNode implements RootPart {
    private final List<SegmentPart> parts;

    public Segment(List<SegmentPart> parts) {
      super(RoutePatternKind.SEGMENT);
      this.parts = List.copyOf(parts);
    }

    public List<SegmentPart> parts() {
      return parts;
    }

    @Override
    public int childCount() {
      return parts.size();
    }

    @Override
    public NodeOrToken childAt(int index) {
      if (index < 0 || index >= parts.size()) {
        throw badIndex(index, childCount());
      }
      return (NodeOrToken) parts.get(index);
    }
  }

  /** {@code [controller]} */
  public static final class Replacement extends RoutePatternNode implements SegmentPart {
    private final RoutePatternToken openBracketToken;
    private final RoutePatternToken textToken;
    private final RoutePatternToken closeBracketToken;

    public Replacement(
        RoutePatternToken openBracketToken,
        RoutePatternToken textToken,
        RoutePatternToken closeBracketToken) {
      super(RoutePatternKind.REPLACEMENT);
      this.openBracketToken = require(openBracketToken, RoutePatternTokenKind.OPEN_BRACKET);
      this.textToken = require(textToken, RoutePatternTokenKind.TEXT);
      this.closeBracketToken = require(closeBracketToken, RoutePatternTokenKind.CLOSE_BRACKET);
    }

    public RoutePatternToken textToken() {
      return textToken;
    }

    @Override
    public int childCount() {
      return 3;
    }

    @Override
    public NodeOrToken childAt(int index) {
      return switch (index) {
        case 0 -> openBracketToken;
        case 1 -> textToken;
        case 2 -> closeBracketToken;
        default -> throw badIndex(index, 3);
      };
    }
  }

  /** {@code {name...}} */
  public static final class Parameter extends RoutePatternNode implements SegmentPart {
    private final RoutePatternToken openBraceToken;
    private final List<ParameterPart> parts;
    private final RoutePatternToken closeBraceToken;

    public Parameter(
        RoutePatternToken openBraceToken,
        List<ParameterPart> parts,
        RoutePatternToken closeBraceToken) {
      super(RoutePatternKind.PARAMETER);
      this.openBraceToken = require(openBraceToken, RoutePatternTokenKind.OPEN_BRACE);
      this.parts = List.copyOf(parts);
      this.closeBraceToken = require(closeBraceToken, RoutePatternTokenKind.CLOSE_BRACE);
    }

    public RoutePatternToken openBraceToken() {
      return openBraceToken;
    }

    public List<ParameterPart> parts() {
      return parts;
    }

    public RoutePatternToken closeBraceToken() {
      return closeBraceToken;
    }

    @Override
    public int childCount() {
      return parts.size() + 2;
    }

    @Override
    public NodeOrToken childAt(int index) {
      if (index == 0) {
        return openBraceToken;
      }
      if (index == parts.size() + 1) {
        return closeBraceToken;
      }
      if (index < 0 || index > parts.size()) {
        throw badIndex(index, childCount());
      }
      return (NodeOrToken) parts.get(index - 1);
    }
  }

  /** Literal text; <code>{{</code> and <code>}}</code> escapes are kept as written. */
  public static final class Literal extends RoutePatternNode implements SegmentPart {
    private final RoutePatternToken literalToken;

    public Literal(RoutePatternToken literalToken) {
      super(RoutePatternKind.LITERAL);
      this.literalToken = require(literalToken, RoutePatternTokenKind.LITERAL);
    }

    public RoutePatternToken literalToken() {
      return literalToken;
    }

    @Override
    public int childCount() {
      return 1;
    }

    @Override
    public NodeOrToken childAt(int index) {
      if (index != 0) {
        throw badIndex(index, 1);
      }
      return literalToken;
    }
  }

  /** {@code /} */
  public static final class SegmentSeparator extends RoutePatternNode implements RootPart {
    private final RoutePatternToken separatorToken;

    public SegmentSeparator(RoutePatternToken separatorToken) {
      super(RoutePatternKind.SEGMENT_SEPARATOR);
      this.separatorToken = require(separatorToken, RoutePatternTokenKind.SLASH);
    }

    public RoutePatternToken separatorToken() {
      return separatorToken;
    }

    @Override
    public int childCount() {
      return 1;
    }

    @Override
    public NodeOrToken childAt(int index) {
      if (index != 0) {
        throw badIndex(index, 1);
      }
      return separatorToken;
    }
  }

  /** {@code .} */
  public static final class OptionalSeparator extends RoutePatternNode implements SegmentPart {
    private final RoutePatternToken separatorToken;

    public OptionalSeparator(RoutePatternToken separatorToken) {
      super(RoutePatternKind.OPTIONAL_SEPARATOR);
      this.separatorToken = require(separatorToken, RoutePatternTokenKind.DOT);
    }

    @Override
    public int childCount() {
      return 1;
    }

    @Override
    public NodeOrToken childAt(int index) {
      if (index != 0) {
        throw badIndex(index, 1);
      }
      return separatorToken;
    }
  }

  /** {@code *} or {@code **} */
  public static final class CatchAllParameterPart extends RoutePatternNode
      implements ParameterPart {
    private final RoutePatternToken asteriskToken;

    public CatchAllParameterPart(RoutePatternToken asteriskToken) {
      super(RoutePatternKind.CATCH_ALL);
      this.asteriskToken = require(asteriskToken, RoutePatternTokenKind.ASTERISK);
    }

    public RoutePatternToken asteriskToken() {
      return asteriskToken;
    }

    /** {@code **}: slashes in the captured value are not encoded. */
    public boolean isUnescaped() {
      return asteriskToken.chars().length() == 2;
    }

    @Override
    public int childCount() {
      return 1;
    }

    @Override
    public NodeOrToken childAt(int index) {
      if (index != 0) {
        throw badIndex(index, 1);
      }
      return asteriskToken;
    }
  }

  public static final class NameParameterPart extends RoutePatternNode implements ParameterPart {
    private final RoutePatternToken parameterNameToken;

    public NameParameterPart(RoutePatternToken parameterNameToken) {
      super(RoutePatternKind.PARAMETER_NAME);
      this.parameterNameToken = require(parameterNameToken, RoutePatternTokenKind.PARAMETER_NAME);
    }

    public RoutePatternToken parameterNameToken() {
      return parameterNameToken;
    }

    @Override
    public int childCount() {
      return 1;
    }

    @Override
    public NodeOrToken childAt(int index) {
      if (index != 0) {
        throw badIndex(index, 1);
      }
      return parameterNameToken;
    }
  }

  /** {@code :int}, {@code :range(1,10)} */
  public static final class PolicyParameterPart extends RoutePatternNode
      implements ParameterPart {
    private final RoutePatternToken colonToken;
    private final List<PolicyFragmentPart> fragments;

    public PolicyParameterPart(RoutePatternToken colonToken, List<PolicyFragmentPart> fragments) {
      super(RoutePatternKind.PARAMETER_POLICY);
      this.colonToken = require(colonToken, RoutePatternTokenKind.COLON);
      this.fragments = List.copyOf(fragments);
    }

    public RoutePatternToken colonToken() {
      return colonToken;
    }

    public List<PolicyFragmentPart> fragments() {
      return fragments;
    }

    /** Returns the policy text after the colon, as written. */
    public String policyText() {
      StringBuilder sb = new StringBuilder();
      for (PolicyFragmentPart fragment : fragments) {
        ((RoutePatternNode) fragment).forEachToken(token -> sb.append(token.text()));
      }
      return sb.toString();
    }

    @Override
    public int childCount() {
      return fragments.size() + 1;
    }

    @Override
    public NodeOrToken childAt(int index) {
      if (index == 0) {
        return colonToken;
      }
      if (index < 0 || index > fragments.size()) {
        throw badIndex(index, childCount());
      }
      return (NodeOrToken) fragments.get(index - 1);
    }
  }

  public static final class PolicyFragment extends RoutePatternNode implements PolicyFragmentPart {
    private final RoutePatternToken fragmentToken;

    public PolicyFragment(RoutePatternToken fragmentToken) {
      super(RoutePatternKind.POLICY_FRAGMENT);
      this.fragmentToken = require(fragmentToken, RoutePatternTokenKind.POLICY_FRAGMENT);
    }

    public RoutePatternToken fragmentToken() {
      return fragmentToken;
    }

    @Override
    public int childCount() {
      return 1;
    }

    @Override
    public NodeOrToken childAt(int index) {
      if (index != 0) {
        throw badIndex(index, 1);
      }
      return fragmentToken;
    }
  }

  /**
   * A policy argument in parentheses. Inside the parentheses {@code ))} stands for a literal
   * closing parenthesis.
   */
  public static final class PolicyFragmentEscaped extends RoutePatternNode
      implements PolicyFragmentPart {
    private final RoutePatternToken openParenToken;
    private final RoutePatternToken argumentToken;
    private final RoutePatternToken closeParenToken;

    public PolicyFragmentEscaped(
        RoutePatternToken openParenToken,
        RoutePatternToken argumentToken,
        RoutePatternToken closeParenToken) {
      super(RoutePatternKind.POLICY_FRAGMENT_ESCAPED);
      this.openParenToken = require(openParenToken, RoutePatternTokenKind.OPEN_PAREN);
      this.argumentToken = require(argumentToken, RoutePatternTokenKind.POLICY_FRAGMENT);
      this.closeParenToken = require(closeParenToken, RoutePatternTokenKind.CLOSE_PAREN);
    }

    public RoutePatternToken argumentToken() {
      return argumentToken;
    }

    public RoutePatternToken closeParenToken() {
      return closeParenToken;
    }

    @Override
    public int childCount() {
      return 3;
    }

    @Override
    public NodeOrToken childAt(int index) {
      return switch (index) {
        case 0 -> openParenToken;
        case 1 -> argumentToken;
        case 2 -> closeParenToken;
        default -> throw badIndex(index, 3);
      };
    }
  }

  /** {@code ?} */
  public static final class OptionalParameterPart extends RoutePatternNode
      implements ParameterPart {
    private final RoutePatternToken questionMarkToken;

    public OptionalParameterPart(RoutePatternToken questionMarkToken) {
      super(RoutePatternKind.OPTIONAL);
      this.questionMarkToken = require(questionMarkToken, RoutePatternTokenKind.QUESTION_MARK);
    }

    @Override
    public int childCount() {
      return 1;
    }

    @Override
    public NodeOrToken childAt(int index) {
      if (index != 0) {
        throw badIndex(index, 1);
      }
      return questionMarkToken;
    }
  }

  /** {@code =value} */
  public static final class DefaultValueParameterPart extends RoutePatternNode
      implements ParameterPart {
    private final RoutePatternToken equalsToken;
    private final RoutePatternToken defaultValueToken;

    public DefaultValueParameterPart(
        RoutePatternToken equalsToken, RoutePatternToken defaultValueToken) {
      super(RoutePatternKind.DEFAULT_VALUE);
      this.equalsToken = require(equalsToken, RoutePatternTokenKind.EQUALS);
      this.defaultValueToken = require(defaultValueToken, RoutePatternTokenKind.DEFAULT_VALUE);
    }

    public RoutePatternToken defaultValueToken() {
      return defaultValueToken;
    }

    @Override
    public int childCount() {
      return 2;
    }

    @Override
    public NodeOrToken childAt(int index) {
      return switch (index) {
        case 0 -> equalsToken;
        case 1 -> defaultValueToken;
        default -> throw badIndex(index, 2);
      };
    }
  }
}
