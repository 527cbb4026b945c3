package org.fixtureflow.runtime.execution.timeout;

import javax.annotation.Nullable;
import lombok.Value;

/**
 * How a run under a {@link TimeoutStrategy} ended.
 */
@Value
public class TimedExecution {

    /** The action returned or threw before the strategy stopped waiting for it. */
    boolean completed;

    /** The timeout elapsed, whether or not the action noticed. */
    boolean timedOut;

    /** What the action threw, already unwrapped. */
    @Nullable
    Throwable thrown;

    public static TimedExecution finished(boolean timedOut, @Nullable Throwable thrown) {
        return new TimedExecution(true, timedOut, thrown);
    }

    public static TimedExecution abandoned() {
        return new TimedExecution(false, true, null);
    }
}
