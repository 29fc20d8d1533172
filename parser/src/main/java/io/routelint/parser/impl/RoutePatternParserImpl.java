package io.routelint.parser.impl;

import io.routelint.parser.api.RouteCharConverter;
import io.routelint.parser.api.RouteCharSequence;
import io.routelint.parser.api.RoutePatternParser;
import io.routelint.parser.api.RoutePatternTree;
import io.routelint.parser.api.syntax.RoutePatternNode.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default {@link RoutePatternParser}. Every call builds its own lexer, parser and validator. */
public final class RoutePatternParserImpl implements RoutePatternParser {
  private static final Logger log = LoggerFactory.getLogger(RoutePatternParserImpl.class);

  // re-checks that every parsed tree covers its input exactly; off by default
  private static final boolean VERIFY = Boolean.getBoolean("routelint.parser.verify");

  private final RouteCharConverter converter;
  private final boolean verify;

  public RoutePatternParserImpl(RouteCharConverter converter) {
    this(converter, VERIFY);
  }

  RoutePatternParserImpl(RouteCharConverter converter, boolean verify) {
    if (converter == null) {
      throw new IllegalArgumentException("converter must not be null");
    }
    this.converter = converter;
    this.verify = verify;
  }

  @Override
  public RoutePatternTree parse(String input) {
    RouteCharSequence text = converter.convert(input);
    if (text == null) {
      log.debug("Input could not be converted, no tree produced");
      return null;
    }
    return parse(text);
  }

  @Override
  public RoutePatternTree parse(RouteCharSequence text) {
    if (text == null) {
      return null;
    }
    CompilationUnit root = RoutePatternSyntaxParser.parse(text);
    RoutePatternValidator.Result result = RoutePatternValidator.validate(root);
    RoutePatternTree tree =
        new RoutePatternTree(text, root, result.diagnostics(), result.parameters());
    log.debug(
        "Parsed route pattern '{}': {} root parts, {} diagnostics, {} parameters",
        text,
        root.parts().size(),
        tree.diagnostics().size(),
        tree.parameters().size());
    if (verify && !tree.coversText()) {
      log.warn("Syntax tree of route pattern '{}' does not cover the input text", text);
    }
    return tree;
  }
}
