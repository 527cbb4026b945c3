package org.fixtureflow.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Limits the execution time of a test or a fixture method.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD})
public @interface Timeout {

    /** Timeout in milliseconds. */
    long value();

    TimeoutMode mode() default TimeoutMode.DEFAULT;
}
