package org.fixtureflow.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares that the test passes only when its body throws the given exception.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface ExpectedException {

    Class<? extends Throwable> value();

    /** Also accept subclasses of {@link #value()}. */
    boolean allowDerivedTypes() default false;

    /** Message reported when no exception or a wrong one was thrown. */
    String message() default "";
}
