package org.fixtureflow.runtime.metadata;

/**
 * Decides whether an exception thrown by a test body is the one the test expects.
 *
 * <p>A verifier rejects an exception by throwing: an {@link AssertionError} makes the test
 * fail, an {@link org.fixtureflow.api.AssertInconclusiveException} makes it inconclusive.
 */
public interface ExpectedExceptionVerifier {

    void verify(Throwable thrown);

    /** Message reported when the body returned normally. */
    String noExceptionMessage(String className, String methodName);
}
