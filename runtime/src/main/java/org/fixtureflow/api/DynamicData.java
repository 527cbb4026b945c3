package org.fixtureflow.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Runs the test once per row. The rows come from a static, parameterless method of the
 * same class returning {@code Iterable<Object[]>}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface DynamicData {

    /** Name of the row source method. */
    String value();
}
