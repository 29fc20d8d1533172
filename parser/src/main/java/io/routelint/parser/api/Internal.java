package io.routelint.parser.api;

import static java.lang.annotation.ElementType.*;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks types that belong to the implementation of the route pattern parser and are public only so
 * that other packages of the library can reach them.
 *
 * <p>Annotated types may change or disappear in any release. Use {@link RoutePatternParser} and
 * the types it returns instead.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({TYPE, METHOD, FIELD, PACKAGE})
public @interface Internal {
  /**
   * Optional pointer to the public API that should be used instead.
   *
   * @return the alternative, if any
   */
  String value() default "";
}
