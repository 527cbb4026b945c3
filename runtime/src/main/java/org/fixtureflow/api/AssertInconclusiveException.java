package org.fixtureflow.api;

/**
 * Thrown by test code to report that the result cannot be verified. Tests and fixtures
 * ending with this exception are reported as inconclusive rather than failed.
 */
public class AssertInconclusiveException extends RuntimeException {

    public AssertInconclusiveException(String message) {
        super(message);
    }

    public AssertInconclusiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
