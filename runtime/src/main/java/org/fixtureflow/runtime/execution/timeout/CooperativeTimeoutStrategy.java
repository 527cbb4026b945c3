package org.fixtureflow.runtime.execution.timeout;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;
import lombok.RequiredArgsConstructor;
import org.fixtureflow.runtime.context.CancellationSource;
import org.fixtureflow.util.ExceptionUtil;
import org.fixtureflow.util.ThrowingRunnable;

/**
 * Runs the action on the calling thread and cancels its token once the timeout elapses.
 * The action is expected to notice and stop by itself.
 */
@RequiredArgsConstructor
public class CooperativeTimeoutStrategy implements TimeoutStrategy {

    private final ScheduledExecutorService timer;

    @Nonnull
    @Override
    public TimedExecution execute(@Nonnull ThrowingRunnable action, @Nonnull Duration timeout,
                                  @Nonnull CancellationSource cancellation) {
        CancellationSource timeoutSource = new CancellationSource();
        timeoutSource.register(cancellation::cancel);
        ScheduledFuture<?> timerTask = timer.schedule(timeoutSource::cancel,
                timeout.toNanos(), TimeUnit.NANOSECONDS);

        Throwable thrown = null;
        try {
            action.run();
        } catch (Throwable t) {
            thrown = ExceptionUtil.unwrap(t);
        } finally {
            timerTask.cancel(false);
        }
        return TimedExecution.finished(timeoutSource.isCancellationRequested(), thrown);
    }
}
