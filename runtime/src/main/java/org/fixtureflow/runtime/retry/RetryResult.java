package org.fixtureflow.runtime.retry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nonnull;
import org.fixtureflow.runtime.model.TestResult;

/**
 * Results of every attempt made for a test, oldest first.
 */
public class RetryResult {

    private final List<List<TestResult>> attempts = new ArrayList<>();

    public void addAttempt(@Nonnull List<TestResult> results) {
        attempts.add(results);
    }

    public int getAttemptCount() {
        return attempts.size();
    }

    public List<List<TestResult>> getAttempts() {
        return Collections.unmodifiableList(attempts);
    }

    /**
     * Results of the last attempt, the ones reported for the test.
     */
    @Nonnull
    public List<TestResult> last() {
        if (attempts.isEmpty()) {
            throw new IllegalStateException("No attempt was recorded");
        }
        return attempts.get(attempts.size() - 1);
    }
}
