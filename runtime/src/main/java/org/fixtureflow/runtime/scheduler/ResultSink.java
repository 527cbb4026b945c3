package org.fixtureflow.runtime.scheduler;

import java.util.List;
import org.fixtureflow.runtime.model.TestElement;
import org.fixtureflow.runtime.model.TestResult;

/**
 * Receives results as tests finish. Called concurrently from the scheduler's workers.
 */
public interface ResultSink {

    /**
     * @param results one result, or one per data row
     */
    void onResult(TestElement element, List<TestResult> results);

    /**
     * A cleanup failure that no test result could carry.
     */
    default void onWarning(String warning) {
    }
}
