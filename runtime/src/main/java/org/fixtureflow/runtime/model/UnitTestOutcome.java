package org.fixtureflow.runtime.model;

import javax.annotation.Nonnull;

/**
 * Outcome of a test invocation.
 *
 * <p>Constants are declared from the most to the least important one. When several
 * outcomes compete for a single result (data rows, a failing cleanup after a failing body)
 * the most important one wins.
 */
public enum UnitTestOutcome {
    /** Failure inside the engine rather than in test code. */
    ERROR,
    FAILED,
    TIMEOUT,
    INCONCLUSIVE,
    IGNORED,
    NOT_RUNNABLE,
    PASSED,
    NOT_FOUND,
    IN_PROGRESS;

    @Nonnull
    public UnitTestOutcome moreImportant(@Nonnull UnitTestOutcome other) {
        return moreImportant(this, other);
    }

    @Nonnull
    public static UnitTestOutcome moreImportant(@Nonnull UnitTestOutcome first,
                                                @Nonnull UnitTestOutcome second) {
        return first.ordinal() <= second.ordinal() ? first : second;
    }
}
