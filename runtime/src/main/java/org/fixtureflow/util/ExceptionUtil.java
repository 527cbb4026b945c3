package org.fixtureflow.util;

import com.google.common.base.Throwables;
import com.google.common.collect.Sets;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.fixtureflow.api.AssertInconclusiveException;
import org.fixtureflow.runtime.model.UnitTestOutcome;

/**
 * Formatting and unwrapping of exceptions thrown by user code.
 */
public final class ExceptionUtil {

    private ExceptionUtil() {
        //prevent creating instances
    }

    /**
     * Strips the wrappers added by reflection and executors.
     */
    @Nonnull
    public static Throwable unwrap(@Nonnull Throwable throwable) {
        Set<Throwable> seen = Sets.newIdentityHashSet();
        Throwable current = throwable;
        while (seen.add(current) && current.getCause() != null
                && (current instanceof InvocationTargetException
                || current instanceof ExecutionException
                || current instanceof CompletionException
                || current instanceof UndeclaredThrowableException)) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * {@code Type: message}, followed by the same for every cause. A cause seen before ends
     * the chain.
     */
    @Nonnull
    public static String formattedMessage(@Nonnull Throwable throwable) {
        StringBuilder builder = new StringBuilder();
        Set<Throwable> seen = Sets.newIdentityHashSet();
        Throwable current = throwable;
        while (current != null && seen.add(current)) {
            if (builder.length() > 0) {
                builder.append(" ---> ");
            }
            builder.append(current.getClass().getName());
            if (current.getMessage() != null) {
                builder.append(": ").append(current.getMessage());
            }
            current = current.getCause();
        }
        return builder.toString();
    }

    @Nullable
    public static String stackTrace(@Nullable Throwable throwable) {
        return throwable == null ? null : Throwables.getStackTraceAsString(throwable);
    }

    public static boolean isInconclusive(@Nonnull Throwable throwable) {
        return throwable instanceof AssertInconclusiveException;
    }

    /**
     * Outcome user code ends with when it throws the given exception.
     */
    @Nonnull
    public static UnitTestOutcome outcomeOf(@Nonnull Throwable throwable) {
        return isInconclusive(throwable) ? UnitTestOutcome.INCONCLUSIVE : UnitTestOutcome.FAILED;
    }
}
