/** Parser, validator and the default {@link io.routelint.parser.api.RoutePatternParser}. */
package io.routelint.parser.impl;
