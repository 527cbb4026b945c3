package org.fixtureflow.runtime.fixture;

import java.util.concurrent.CancellationException;
import java.util.function.Function;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.RequiredArgsConstructor;
import org.fixtureflow.runtime.context.DefaultTestContext;
import org.fixtureflow.runtime.context.OutputCapture;
import org.fixtureflow.runtime.exceptions.TestFailedException;
import org.fixtureflow.runtime.execution.timeout.TimedExecution;
import org.fixtureflow.runtime.execution.timeout.TimeoutStrategies;
import org.fixtureflow.runtime.metadata.FixtureMethod;
import org.fixtureflow.runtime.model.FixtureKind;
import org.fixtureflow.runtime.model.UnitTestOutcome;
import org.fixtureflow.util.ExceptionUtil;
import org.fixtureflow.util.ThrowingRunnable;

/**
 * Invokes one fixture method under its timeout, with its output going to the context.
 */
@RequiredArgsConstructor
public class FixtureMethodRunner {

    private final TimeoutStrategies timeouts;

    /**
     * @param wrap turns what the fixture threw into the failure reported for it
     * @return {@code null} when the fixture returned normally
     */
    @Nullable
    public TestFailedException invoke(@Nonnull FixtureMethod fixture, @Nonnull FixtureKind kind,
                                      @Nonnull DefaultTestContext context,
                                      @Nonnull Function<Throwable, TestFailedException> wrap) {
        if (context.getCancellationSource().isCancellationRequested()) {
            return canceled(fixture, kind);
        }

        ThrowingRunnable action = () -> {
            try (OutputCapture.Scope ignored = OutputCapture.bind(context.getLogBuffer())) {
                fixture.getMethod().invoke(null, fixture.arguments(context));
            }
        };

        if (fixture.getTimeout() == null) {
            try {
                action.run();
                return null;
            } catch (Throwable t) {
                return wrap.apply(ExceptionUtil.unwrap(t));
            }
        }

        TimedExecution execution = timeouts.select(fixture.getTimeout())
                .execute(action, fixture.getTimeout().getTimeout(), context.getCancellationSource());
        if (execution.isTimedOut()) {
            return new TestFailedException(UnitTestOutcome.TIMEOUT, kind.getDisplayName()
                    + " method " + fixture + " timed out after "
                    + fixture.getTimeout().getTimeout().toMillis() + "ms");
        }
        Throwable thrown = execution.getThrown();
        if (thrown == null) {
            return null;
        }
        if (thrown instanceof CancellationException
                && context.getCancellationSource().isCancellationRequested()) {
            return canceled(fixture, kind);
        }
        return wrap.apply(thrown);
    }

    private static TestFailedException canceled(FixtureMethod fixture, FixtureKind kind) {
        return new TestFailedException(UnitTestOutcome.TIMEOUT,
                kind.getDisplayName() + " method " + fixture + " was canceled");
    }
}
