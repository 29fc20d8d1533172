/**
 * Syntax tree of a route pattern: immutable tokens and a closed hierarchy of nodes.
 *
 * <p>The tree is lossless. Reading every token of {@link
 * io.routelint.parser.api.syntax.RoutePatternNode.CompilationUnit} in order gives back the parsed
 * text.
 */
package io.routelint.parser.api.syntax;
