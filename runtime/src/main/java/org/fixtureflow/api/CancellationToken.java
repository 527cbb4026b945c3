package org.fixtureflow.api;

/**
 * Read side of a cancellation signal handed to test code through {@link TestContext}.
 *
 * <p>Long running tests are expected to poll {@link #isCancellationRequested()} or call
 * {@link #throwIfCancellationRequested()} so that cooperative timeouts can stop them.
 */
public interface CancellationToken {

    boolean isCancellationRequested();

    /**
     * @throws TestCanceledException if cancellation was requested
     */
    void throwIfCancellationRequested();

    /**
     * Registers a callback run once cancellation is requested. Runs immediately if it
     * already was.
     *
     * @return handle removing the callback again, once it is no longer needed
     */
    Registration register(Runnable callback);

    /**
     * A registered callback. Closing it after cancellation, or twice, does nothing.
     */
    interface Registration extends AutoCloseable {

        @Override
        void close();
    }
}
