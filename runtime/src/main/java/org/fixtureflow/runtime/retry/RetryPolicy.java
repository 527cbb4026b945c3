package org.fixtureflow.runtime.retry;

import java.util.List;
import javax.annotation.Nonnull;
import org.fixtureflow.runtime.model.TestResult;
import org.fixtureflow.runtime.model.UnitTestOutcome;

/**
 * Reruns a test whose results are not acceptable.
 *
 * <p>Policies are attached to a test when it is resolved and are shared by every run of that
 * test, so implementations must not keep per-run state.
 */
public interface RetryPolicy {

    /**
     * Results that need no retry: every result passed or is inconclusive.
     */
    static boolean isAcceptable(@Nonnull List<TestResult> results) {
        return results.stream().allMatch(r -> r.getOutcome() == UnitTestOutcome.PASSED
                || r.getOutcome() == UnitTestOutcome.INCONCLUSIVE);
    }

    /**
     * Reruns the test until its results are acceptable or the policy gives up.
     *
     * @return every attempt, the first run included
     */
    @Nonnull
    RetryResult execute(@Nonnull RetryContext context);
}
