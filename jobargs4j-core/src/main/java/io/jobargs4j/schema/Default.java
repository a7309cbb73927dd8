package io.jobargs4j.schema;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Literal default for an {@code Args} component, written as JSON text.
 *
 * <p>Examples: {@code @Default("false")}, {@code @Default("\"draft\"")}, {@code @Default("[]")}.
 * The literal is parsed again every time it is used.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface Default {

    String value();
}
