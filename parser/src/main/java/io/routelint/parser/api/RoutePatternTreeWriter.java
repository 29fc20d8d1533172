package io.routelint.parser.api;

import io.routelint.parser.api.syntax.NodeOrToken;
import io.routelint.parser.api.syntax.RoutePatternNode;
import io.routelint.parser.api.syntax.RoutePatternToken;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link RoutePatternTree} as indented text.
 *
 * <p>Nodes print their kind, tokens print their kind and raw text; a missing token prints its
 * kind only. Children follow their parent, indented by two spaces. The tree is followed by a
 * {@code Diagnostics:} and a {@code Parameters:} section when the tree has any. Lines end with
 * {@code \n}.
 *
 * <pre>
 * CompilationUnit
 *   Segment
 *     Parameter
 *       OpenBraceToken "{"
 *       ParameterName
 *         ParameterNameToken "id"
 *       CloseBraceToken "}"
 *   EndOfFile
 * Parameters:
 *   id [0..4) optional=false catchAll=false encodeSlashes=true default=null policies=[]
 * </pre>
 */
public final class RoutePatternTreeWriter {
  private static final String INDENT = "  ";

  private RoutePatternTreeWriter() {}

  public static String toText(RoutePatternTree tree) {
    StringBuilder out = new StringBuilder();
    writeNode(tree.root(), 0, out);
    if (!tree.diagnostics().isEmpty()) {
      out.append("Diagnostics:\n");
      for (RouteDiagnostic diagnostic : tree.diagnostics()) {
        out.append(INDENT)
            .append(diagnostic.span())
            .append(' ')
            .append(quote(coveredText(tree.text(), diagnostic.span())))
            .append(' ')
            .append(diagnostic.message())
            .append('\n');
      }
    }
    if (!tree.parameters().isEmpty()) {
      out.append("Parameters:\n");
      for (RouteParameter p : tree.parameters().values()) {
        out.append(INDENT).append(p.name()).append(' ').append(p.span());
        out.append(" optional=").append(p.optional());
        out.append(" catchAll=").append(p.catchAll());
        out.append(" encodeSlashes=").append(p.encodeSlashes());
        out.append(" default=").append(p.defaultValue() == null ? "null" : quote(p.defaultValue()));
        List<String> policies = new ArrayList<>(p.policies().size());
        for (String policy : p.policies()) {
          policies.add(quote(policy));
        }
        out.append(" policies=").append(policies).append('\n');
      }
    }
    return out.toString();
  }

  private static void writeNode(RoutePatternNode node, int depth, StringBuilder out) {
    out.append(INDENT.repeat(depth)).append(node.kind().displayName()).append('\n');
    for (int i = 0; i < node.childCount(); i++) {
      NodeOrToken child = node.childAt(i);
      if (child.isNode()) {
        writeNode(child.asNode(), depth + 1, out);
      } else {
        writeToken(child.asToken(), depth + 1, out);
      }
    }
  }

  private static void writeToken(RoutePatternToken token, int depth, StringBuilder out) {
    out.append(INDENT.repeat(depth)).append(token.kind().displayName());
    if (!token.isMissing()) {
      out.append(' ').append(quote(token.text()));
    }
    out.append('\n');
  }

  /** Returns the characters of {@code text} whose spans lie inside {@code span}. */
  static String coveredText(RouteCharSequence text, TextSpan span) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < text.length(); i++) {
      RouteChar ch = text.get(i);
      if (span.contains(ch.span())) {
        sb.append(ch.value());
      }
    }
    return sb.toString();
  }

  private static String quote(String s) {
    return '"' + s + '"';
  }
}
