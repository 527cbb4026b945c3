package org.fixtureflow.api;

public enum TimeoutMode {
    /** Use the run-wide setting. */
    DEFAULT,
    /** Cancel the test's {@link CancellationToken} and let the body stop by itself. */
    COOPERATIVE,
    /** Run the body on its own thread and stop waiting for it at the deadline. */
    HARD
}
