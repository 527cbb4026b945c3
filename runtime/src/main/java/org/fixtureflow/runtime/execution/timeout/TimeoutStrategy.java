package org.fixtureflow.runtime.execution.timeout;

import java.time.Duration;
import javax.annotation.Nonnull;
import org.fixtureflow.runtime.context.CancellationSource;
import org.fixtureflow.util.ThrowingRunnable;

/**
 * Runs user code under a time limit.
 */
public interface TimeoutStrategy {

    /**
     * Runs {@code action}, which observes {@code cancellation}, for at most {@code timeout}.
     * Never throws what the action throws: the throwable is part of the returned execution.
     */
    @Nonnull
    TimedExecution execute(@Nonnull ThrowingRunnable action, @Nonnull Duration timeout,
                           @Nonnull CancellationSource cancellation);
}
