package io.routelint.parser.impl;

import io.routelint.parser.api.RouteDiagnostic;
import io.routelint.parser.api.RouteParameter;
import io.routelint.parser.api.RoutePatternMessages;
import io.routelint.parser.api.syntax.RoutePatternNode;
import io.routelint.parser.api.syntax.RoutePatternNode.CatchAllParameterPart;
import io.routelint.parser.api.syntax.RoutePatternNode.CompilationUnit;
import io.routelint.parser.api.syntax.RoutePatternNode.DefaultValueParameterPart;
import io.routelint.parser.api.syntax.RoutePatternNode.NameParameterPart;
import io.routelint.parser.api.syntax.RoutePatternNode.Parameter;
import io.routelint.parser.api.syntax.RoutePatternNode.ParameterPart;
import io.routelint.parser.api.syntax.RoutePatternNode.PolicyParameterPart;
import io.routelint.parser.api.syntax.RoutePatternNode.RootPart;
import io.routelint.parser.api.syntax.RoutePatternNode.Segment;
import io.routelint.parser.api.syntax.RoutePatternNode.SegmentPart;
import io.routelint.parser.api.syntax.RoutePatternToken;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Checks a raw syntax tree and collects its diagnostics and parameters.
 *
 * <p>The passes run in a fixed order: token diagnostics in document order, consecutive parameters,
 * catch-all placement, then parameter semantics. Every diagnostic goes through the same
 * de-duplication, so an identical message at an identical span is reported once.
 */
final class RoutePatternValidator {
  private final Set<RouteDiagnostic> diagnostics = new LinkedHashSet<>();
  private final Map<String, RouteParameter> parameters =
      new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

  private RoutePatternValidator() {}

  static Result validate(CompilationUnit root) {
    RoutePatternValidator validator = new RoutePatternValidator();
    validator.collectTokenDiagnostics(root);
    validator.checkConsecutiveParameters(root);
    validator.checkCatchAllPlacement(root);
    validator.checkParameters(root);
    return new Result(new ArrayList<>(validator.diagnostics), validator.parameters);
  }

  record Result(List<RouteDiagnostic> diagnostics, Map<String, RouteParameter> parameters) {}

  private void collectTokenDiagnostics(CompilationUnit root) {
    root.forEachToken(token -> diagnostics.addAll(token.diagnostics()));
  }

  private void checkConsecutiveParameters(CompilationUnit root) {
    for (Segment segment : segments(root)) {
      SegmentPart previous = null;
      for (SegmentPart part : segment.parts()) {
        if (previous instanceof Parameter && part instanceof Parameter parameter) {
          report(RoutePatternMessages.CANNOT_HAVE_CONSECUTIVE_PARAMETERS, parameter);
        }
        previous = part;
      }
    }
  }

  private void checkCatchAllPlacement(CompilationUnit root) {
    Parameter catchAll = null;
    for (Segment segment : segments(root)) {
      if (catchAll != null) {
        report(RoutePatternMessages.CATCH_ALL_MUST_BE_LAST, catchAll);
        return;
      }
      for (SegmentPart part : segment.parts()) {
        if (part instanceof Parameter parameter && isCatchAll(parameter)) {
          catchAll = parameter;
          if (segment.parts().size() > 1) {
            report(RoutePatternMessages.CANNOT_HAVE_CATCH_ALL_IN_MULTI_SEGMENT, parameter);
          }
        }
      }
    }
  }

  private void checkParameters(CompilationUnit root) {
    for (Segment segment : segments(root)) {
      for (SegmentPart part : segment.parts()) {
        if (part instanceof Parameter parameter) {
          checkParameter(parameter);
        }
      }
    }
  }

  private void checkParameter(Parameter parameter) {
    String name = null;
    String defaultValue = null;
    boolean hasDefault = false;
    boolean optional = false;
    CatchAllParameterPart catchAll = null;
    List<String> policies = new ArrayList<>();
    for (ParameterPart part : parameter.parts()) {
      RoutePatternNode node = (RoutePatternNode) part;
      // exhaustive over every node kind
      boolean handled =
          switch (node.kind()) {
            case CATCH_ALL -> {
              catchAll = (CatchAllParameterPart) node;
              yield true;
            }
            case PARAMETER_NAME -> {
              RoutePatternToken token = ((NameParameterPart) node).parameterNameToken();
              name = token.isMissing() ? null : token.value();
              yield true;
            }
            case PARAMETER_POLICY -> {
              policies.add(((PolicyParameterPart) node).policyText());
              yield true;
            }
            case OPTIONAL -> {
              optional = true;
              yield true;
            }
            case DEFAULT_VALUE -> {
              hasDefault = true;
              RoutePatternToken token = ((DefaultValueParameterPart) node).defaultValueToken();
              defaultValue = token.isMissing() ? "" : token.value();
              yield true;
            }
            case COMPILATION_UNIT,
                SEGMENT,
                SEGMENT_SEPARATOR,
                REPLACEMENT,
                PARAMETER,
                LITERAL,
                OPTIONAL_SEPARATOR,
                POLICY_FRAGMENT,
                POLICY_FRAGMENT_ESCAPED -> false;
          };
      if (!handled) {
        throw new IllegalStateException("Not a parameter part: " + node.kind());
      }
    }

    if (hasDefault && optional) {
      report(RoutePatternMessages.OPTIONAL_CANNOT_HAVE_DEFAULT_VALUE, parameter);
    }
    if (catchAll != null && optional) {
      report(RoutePatternMessages.CATCH_ALL_CANNOT_BE_OPTIONAL, parameter);
    }
    if (name == null || name.isEmpty()) {
      return;
    }
    if (parameters.containsKey(name)) {
      report(RoutePatternMessages.repeatedParameter(name), parameter);
      return;
    }
    boolean encodeSlashes = catchAll == null || !catchAll.isUnescaped();
    parameters.put(
        name,
        new RouteParameter(
            name,
            encodeSlashes,
            defaultValue,
            optional,
            catchAll != null,
            policies,
            parameter.span()));
  }

  private static boolean isCatchAll(Parameter parameter) {
    for (ParameterPart part : parameter.parts()) {
      if (part instanceof CatchAllParameterPart) {
        return true;
      }
    }
    return false;
  }

  private static List<Segment> segments(CompilationUnit root) {
    List<Segment> segments = new ArrayList<>();
    for (RootPart part : root.parts()) {
      if (part instanceof Segment segment) {
        segments.add(segment);
      }
    }
    return segments;
  }

  private void report(String message, Parameter parameter) {
    diagnostics.add(new RouteDiagnostic(message, parameter.span()));
  }
}
