/**
 * Public API of the route pattern parser.
 *
 * <p>{@link io.routelint.parser.api.RoutePatternParser} turns a route pattern such as {@code
 * "{id:int?}/{*slug}"} into a {@link io.routelint.parser.api.RoutePatternTree}: a lossless syntax
 * tree, the diagnostics found in the pattern and the table of declared route parameters. Parsing
 * never fails; malformed input yields a tree of the usual shape with diagnostics attached.
 *
 * <p><b>Positions</b>
 *
 * <p>The parser works on a {@link io.routelint.parser.api.RouteCharSequence} whose characters each
 * carry their own source span. A {@link io.routelint.parser.api.RouteCharConverter} builds the
 * sequence from raw input, so spans can refer to the enclosing source file rather than to the
 * decoded string.
 *
 * <p><b>Example</b>
 *
 * <pre>{@code
 * RoutePatternTree tree = RoutePatternParser.create().parse("{id:int}/{*rest}");
 * for (RouteDiagnostic d : tree.diagnostics()) {
 *   System.err.println(d.span() + ": " + d.message());
 * }
 * tree.parameter("ID").ifPresent(p -> System.out.println(p.policies()));
 * }</pre>
 */
package io.routelint.parser.api;
