package org.fixtureflow.api;

import java.util.Map;

/**
 * Per-invocation view of the running test, handed to fixtures and, through
 * {@code setTestContext}, to test instances.
 */
public interface TestContext {

    String getTestName();

    String getFullyQualifiedClassName();

    /** Outcome of the test so far; cleanups see the final outcome of the body. */
    String getCurrentTestOutcome();

    CancellationToken getCancellationToken();

    Map<String, Object> getProperties();

    /** Adds a line to the messages reported with the result. */
    void writeLine(String message);

    void writeLine(String format, Object... args);
}
