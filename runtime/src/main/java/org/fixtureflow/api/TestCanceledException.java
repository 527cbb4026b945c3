package org.fixtureflow.api;

import java.util.concurrent.CancellationException;

/**
 * Thrown by {@link CancellationToken#throwIfCancellationRequested()}.
 */
public class TestCanceledException extends CancellationException {

    public TestCanceledException() {
        super("The operation was canceled.");
    }

    public TestCanceledException(String message) {
        super(message);
    }
}
