package org.fixtureflow.runtime.execution.timeout;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;
import org.fixtureflow.runtime.metadata.TimeoutInfo;

/**
 * The timeout strategies of a run and the threads backing them.
 */
@Slf4j
public class TimeoutStrategies implements AutoCloseable {

    private final ScheduledExecutorService timer;

    private final ExecutorService hardTimeoutExecutor;

    private final CooperativeTimeoutStrategy cooperative;

    private final HardTimeoutStrategy hard;

    public TimeoutStrategies() {
        timer = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("fixtureflow-timeout-%d")
                .setDaemon(true)
                .build());
        hardTimeoutExecutor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("fixtureflow-hard-timeout-%d")
                .setDaemon(true)
                .build());
        cooperative = new CooperativeTimeoutStrategy(timer);
        hard = new HardTimeoutStrategy(hardTimeoutExecutor);
    }

    @Nonnull
    public TimeoutStrategy select(@Nonnull TimeoutInfo timeout) {
        return timeout.isCooperative() ? cooperative : hard;
    }

    /**
     * Stops the timer. Abandoned actions still running are interrupted once more and left to
     * die with their daemon threads.
     */
    @Override
    public void close() {
        log.debug("close: shutting down timeout threads");
        timer.shutdownNow();
        hardTimeoutExecutor.shutdownNow();
    }
}
