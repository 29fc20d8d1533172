package io.routelint.parser.api;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class RoutePatternTreeWriterTest {

  @Test
  void writesOptionalDefaultAndPolicies() {
    RoutePatternTree tree = RoutePatternParser.create().parse("{id:int:min(1)?}/{**rest=a}");

    String text = RoutePatternTreeWriter.toText(tree);

    assertTrue(
        text.endsWith(
            "Parameters:\n"
                + "  id [0..16) optional=true catchAll=false encodeSlashes=true default=null"
                + " policies=[\"int\", \"min(1)\"]\n"
                + "  rest [17..27) optional=false catchAll=true encodeSlashes=false"
                + " default=\"a\" policies=[]\n"),
        text);
  }

  @Test
  void coveredTextUsesDecodedCharacters() {
    RoutePatternTree tree =
        RoutePatternParser.create(new JavaStringLiteralConverter()).parse("\"a\\u007Db\"");

    String text = RoutePatternTreeWriter.toText(tree);

    assertTrue(text.contains("Diagnostics:\n  [2..8) \"}\" There is an incomplete"), text);
  }

  @Test
  void omitsEmptySections() {
    String text = RoutePatternTreeWriter.toText(RoutePatternParser.create().parse("a"));

    assertFalse(text.contains("Diagnostics:"));
    assertFalse(text.contains("Parameters:"));
  }
}
