package org.fixtureflow.util;

/**
 * A piece of user code run by the engine. User code may throw anything, checked exceptions
 * included.
 */
@FunctionalInterface
public interface ThrowingRunnable {
    void run() throws Throwable;
}
