package org.fixtureflow.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Runs once per class, either after its last test or at the end of the source,
 * depending on {@link #behavior()}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface ClassCleanup {
    InheritanceBehavior inheritance() default InheritanceBehavior.NONE;

    ClassCleanupBehavior behavior() default ClassCleanupBehavior.DEFAULT;
}
