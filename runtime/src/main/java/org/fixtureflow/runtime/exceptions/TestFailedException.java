package org.fixtureflow.runtime.exceptions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.Getter;
import org.fixtureflow.runtime.model.UnitTestOutcome;

/**
 * A failure of user code converted into an outcome: failing fixtures, failing or timed out
 * tests. Carries the outcome it maps to and the stack trace of the user code, if any.
 */
public class TestFailedException extends RuntimeException {

    @Getter
    private final UnitTestOutcome outcome;

    @Getter
    @Nullable
    private final String stackTraceInformation;

    public TestFailedException(@Nonnull UnitTestOutcome outcome, @Nonnull String message) {
        this(outcome, message, null, null);
    }

    public TestFailedException(@Nonnull UnitTestOutcome outcome, @Nonnull String message,
                               @Nullable Throwable cause) {
        this(outcome, message, null, cause);
    }

    public TestFailedException(@Nonnull UnitTestOutcome outcome, @Nonnull String message,
                               @Nullable String stackTraceInformation, @Nullable Throwable cause) {
        super(message, cause);
        this.outcome = outcome;
        this.stackTraceInformation = stackTraceInformation;
    }
}
