package io.routelint.shell;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.routelint.parser.api.RouteDiagnostic;
import io.routelint.parser.api.RouteParameter;
import io.routelint.parser.api.RoutePatternKind;
import io.routelint.parser.api.RoutePatternTree;
import io.routelint.parser.api.TextSpan;
import io.routelint.parser.api.syntax.NodeOrToken;
import io.routelint.parser.api.syntax.RoutePatternNode;
import io.routelint.parser.api.syntax.RoutePatternToken;

/** JSON projections of parse results. */
final class JsonReport {
  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().serializeNulls().create();

  private JsonReport() {}

  static String toJson(JsonElement element) {
    return GSON.toJson(element);
  }

  /** Diagnostics and parameters of one pattern. */
  static JsonObject check(String pattern, RoutePatternTree tree) {
    JsonObject result = new JsonObject();
    result.addProperty("pattern", pattern);
    if (tree == null) {
      result.addProperty("error", "pattern could not be converted");
      return result;
    }
    JsonArray diagnostics = new JsonArray();
    for (RouteDiagnostic diagnostic : tree.diagnostics()) {
      JsonObject d = span(diagnostic.span());
      d.addProperty("message", diagnostic.message());
      diagnostics.add(d);
    }
    result.add("diagnostics", diagnostics);
    JsonArray parameters = new JsonArray();
    for (RouteParameter parameter : tree.parameters().values()) {
      JsonObject p = span(parameter.span());
      p.addProperty("name", parameter.name());
      p.addProperty("optional", parameter.optional());
      p.addProperty("catchAll", parameter.catchAll());
      p.addProperty("encodeSlashes", parameter.encodeSlashes());
      p.addProperty("defaultValue", parameter.defaultValue());
      JsonArray policies = new JsonArray();
      parameter.policies().forEach(policies::add);
      p.add("policies", policies);
      parameters.add(p);
    }
    result.add("parameters", parameters);
    return result;
  }

  /** The syntax tree of one pattern. */
  static JsonObject tree(String pattern, RoutePatternTree tree) {
    JsonObject result = check(pattern, tree);
    if (tree != null) {
      result.add("root", node(tree.root()));
    }
    return result;
  }

  private static JsonObject node(RoutePatternNode node) {
    JsonObject json = span(node.span());
    json.addProperty("kind", node.kind().displayName());
    json.addProperty("category", category(node.kind()));
    JsonArray children = new JsonArray();
    for (NodeOrToken child : node.children()) {
      children.add(child.isNode() ? node(child.asNode()) : token(child.asToken()));
    }
    json.add("children", children);
    return json;
  }

  private static JsonObject token(RoutePatternToken token) {
    JsonObject json = span(token.span());
    json.addProperty("kind", token.kind().displayName());
    if (token.isMissing()) {
      json.addProperty("missing", true);
    } else {
      json.addProperty("text", token.text());
    }
    return json;
  }

  private static String category(RoutePatternKind kind) {
    return switch (kind) {
      case COMPILATION_UNIT -> "root";
      case SEGMENT, SEGMENT_SEPARATOR -> "root-part";
      case REPLACEMENT, PARAMETER, LITERAL, OPTIONAL_SEPARATOR -> "segment-part";
      case CATCH_ALL, PARAMETER_NAME, PARAMETER_POLICY, OPTIONAL, DEFAULT_VALUE -> "parameter-part";
      case POLICY_FRAGMENT, POLICY_FRAGMENT_ESCAPED -> "policy-fragment";
    };
  }

  private static JsonObject span(TextSpan span) {
    JsonObject json = new JsonObject();
    json.addProperty("start", span.start());
    json.addProperty("length", span.length());
    return json;
  }
}
