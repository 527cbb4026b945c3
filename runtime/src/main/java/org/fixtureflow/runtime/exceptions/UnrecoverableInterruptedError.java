package org.fixtureflow.runtime.exceptions;

/**
 * Thrown when an engine thread is interrupted at a point where it cannot continue. The
 * interrupt flag is restored before this is thrown.
 */
public class UnrecoverableInterruptedError extends Error {

    public UnrecoverableInterruptedError(InterruptedException cause) {
        super("Interrupted while executing tests", cause);
    }

    public UnrecoverableInterruptedError(String message, InterruptedException cause) {
        super(message, cause);
    }
}
