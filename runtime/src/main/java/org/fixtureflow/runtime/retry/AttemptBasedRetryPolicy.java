package org.fixtureflow.runtime.retry;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.List;
import javax.annotation.Nonnull;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.fixtureflow.api.BackoffType;
import org.fixtureflow.api.Retry;
import org.fixtureflow.runtime.exceptions.UnrecoverableInterruptedError;
import org.fixtureflow.runtime.model.TestResult;

/**
 * Retries up to a fixed number of attempts, waiting between attempts with a constant or an
 * exponentially growing delay.
 */
@Slf4j
@Getter
public class AttemptBasedRetryPolicy implements RetryPolicy {

    private final int maxAttempts;

    private final Duration delay;

    private final BackoffType backoff;

    public AttemptBasedRetryPolicy(int maxAttempts, @Nonnull Duration delay,
                                   @Nonnull BackoffType backoff) {
        Preconditions.checkArgument(maxAttempts >= 1, "maxAttempts must be at least 1");
        Preconditions.checkArgument(!delay.isNegative(), "delay must not be negative");
        this.maxAttempts = maxAttempts;
        this.delay = delay;
        this.backoff = backoff;
    }

    public static AttemptBasedRetryPolicy of(Retry annotation) {
        return new AttemptBasedRetryPolicy(annotation.maxAttempts(),
                Duration.ofMillis(annotation.delay()), annotation.backoff());
    }

    @Nonnull
    @Override
    public RetryResult execute(@Nonnull RetryContext context) {
        RetryResult result = new RetryResult();
        result.addAttempt(context.getFirstRunResults());

        int attempt = 1;
        while (attempt < maxAttempts && !RetryPolicy.isAcceptable(result.last())) {
            sleep(delayBefore(attempt));
            attempt++;
            log.debug("execute: attempt {} of {}", attempt, maxAttempts);
            List<TestResult> results = context.getExecuteTask().get();
            for (TestResult r : results) {
                r.setAttemptCount(attempt);
            }
            result.addAttempt(results);
        }
        return result;
    }

    /**
     * Delay before the attempt following attempt number {@code attempt}.
     */
    Duration delayBefore(int attempt) {
        if (backoff == BackoffType.CONSTANT) {
            return delay;
        }
        return delay.multipliedBy(1L << Math.min(attempt - 1, 30));
    }

    private static void sleep(Duration duration) {
        if (duration.isZero()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UnrecoverableInterruptedError("Interrupted while waiting to retry", e);
        }
    }
}
