/**
 * Lexer of the route pattern parser.
 *
 * <p><b>WARNING: This package is internal and subject to change without notice.</b>
 */
@io.routelint.parser.api.Internal("Use io.routelint.parser.api.RoutePatternParser instead.")
package io.routelint.parser.internal_api;
