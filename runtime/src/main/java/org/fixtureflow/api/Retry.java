package org.fixtureflow.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Reruns a failing test up to {@link #maxAttempts()} times in total.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Retry {

    int maxAttempts();

    /** Delay before the second attempt, in milliseconds. */
    long delay() default 0;

    BackoffType backoff() default BackoffType.CONSTANT;
}
