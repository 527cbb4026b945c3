package org.fixtureflow.runtime.execution.timeout;

import java.lang.reflect.UndeclaredThrowableException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.annotation.Nonnull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fixtureflow.runtime.context.CancellationSource;
import org.fixtureflow.runtime.context.LogBuffer;
import org.fixtureflow.runtime.context.OutputCapture;
import org.fixtureflow.runtime.exceptions.UnrecoverableInterruptedError;
import org.fixtureflow.util.ExceptionUtil;
import org.fixtureflow.util.ThrowingRunnable;

/**
 * Runs the action on a thread of its own and stops waiting for it at the deadline.
 *
 * <p>A late action is interrupted and abandoned: the JVM offers no safe way to stop a
 * thread, so code ignoring interrupts keeps running on a daemon thread until it returns.
 */
@Slf4j
@RequiredArgsConstructor
public class HardTimeoutStrategy implements TimeoutStrategy {

    private final ExecutorService executor;

    @Nonnull
    @Override
    public TimedExecution execute(@Nonnull ThrowingRunnable action, @Nonnull Duration timeout,
                                  @Nonnull CancellationSource cancellation) {
        LogBuffer buffer = OutputCapture.current();
        Future<Void> future = executor.submit(() -> {
            try (OutputCapture.Scope ignored = OutputCapture.bind(buffer)) {
                action.run();
            } catch (Exception | Error e) {
                throw e;
            } catch (Throwable t) {
                throw new UndeclaredThrowableException(t);
            }
            return null;
        });

        try {
            future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return TimedExecution.finished(false, null);
        } catch (ExecutionException e) {
            return TimedExecution.finished(false, ExceptionUtil.unwrap(e));
        } catch (TimeoutException e) {
            log.warn("execute: action did not finish within {}, abandoning it", timeout);
            cancellation.cancel();
            future.cancel(true);
            return TimedExecution.abandoned();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new UnrecoverableInterruptedError(e);
        }
    }
}
