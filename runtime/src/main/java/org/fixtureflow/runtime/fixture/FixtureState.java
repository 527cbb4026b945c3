package org.fixtureflow.runtime.fixture;

import java.util.List;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.fixtureflow.runtime.context.DefaultTestContext;
import org.fixtureflow.runtime.exceptions.TestFailedException;
import org.fixtureflow.runtime.metadata.FixtureMethod;
import org.fixtureflow.runtime.model.FixtureKind;
import org.fixtureflow.runtime.model.TestResult;
import org.fixtureflow.runtime.model.UnitTestOutcome;
import org.fixtureflow.util.ExceptionUtil;

/**
 * Once-only execution of the shared initialize and cleanup code of one scope.
 *
 * <p>Initialize runs the first time any test of the scope asks for it. Every later caller,
 * whatever its thread, gets the outcome of that single execution. Cleanup runs at most once,
 * when the caller decides the scope is finished.
 *
 * <p>Both gates check the state without locking first and again under the scope's own lock
 * before doing anything. Different scopes never contend.
 */
@Slf4j
public abstract class FixtureState {

    public enum State {
        NOT_STARTED,
        RUNNING,
        DONE
    }

    private final Object lock = new Object();

    protected final FixtureMethodRunner runner;

    @Getter
    private volatile State initializeState = State.NOT_STARTED;

    @Getter
    private volatile State cleanupState = State.NOT_STARTED;

    private volatile TestResult initializeResult;

    @Getter
    @Nullable
    private volatile TestFailedException cleanupFailure;

    protected FixtureState(@Nonnull FixtureMethodRunner runner) {
        this.runner = runner;
    }

    /** Name of the scope, used in logs. */
    public abstract String getScopeName();

    protected abstract List<FixtureMethod> initializeChain();

    protected abstract List<FixtureMethod> cleanupChain();

    protected abstract FixtureKind initializeKind();

    protected abstract FixtureKind cleanupKind();

    protected abstract TestFailedException initializeFailure(FixtureMethod method, Throwable thrown);

    /**
     * Whether cleanup may run at all. Checked under the lock.
     */
    protected boolean isCleanupAllowed() {
        return true;
    }

    /**
     * Runs initialize unless it already ran.
     *
     * @return the initialize result. The caller that ran it receives the captured output,
     *     every other caller a copy without it.
     */
    @Nonnull
    public TestResult getResultOrInitialize(@Nonnull DefaultTestContext context) {
        if (initializeState == State.DONE) {
            return initializeResult.withoutLogs();
        }
        synchronized (lock) {
            if (initializeState == State.DONE) {
                return initializeResult.withoutLogs();
            }
            initializeState = State.RUNNING;
            TestResult result = null;
            try {
                TestFailedException failure = runChain(initializeChain(), initializeKind(),
                        context);
                result = failure == null
                        ? TestResult.of(UnitTestOutcome.PASSED)
                        : TestResult.failed(failure);
                context.getLogBuffer().drainInto(result);
            } finally {
                if (result == null) {
                    result = TestResult.failed(new TestFailedException(UnitTestOutcome.ERROR,
                            initializeKind().getDisplayName() + " of " + getScopeName()
                                    + " did not complete."));
                }
                initializeResult = result;
                initializeState = State.DONE;
            }
            // callers decorate what they get, the cached result stays as it ran
            return result.withoutLogs().appendLogs(result);
        }
    }

    /**
     * Runs initialize unless it already ran.
     *
     * @return the failure of initialize, cached for every caller, or {@code null}
     */
    @Nullable
    public TestFailedException ensureInitialized(@Nonnull DefaultTestContext context) {
        return getResultOrInitialize(context).getFailure();
    }

    /**
     * Runs cleanup unless it already ran or is not allowed. Output goes to the context.
     *
     * @return the cleanup failure, or {@code null} when cleanup succeeded or did not run
     */
    @Nullable
    public TestFailedException runCleanup(@Nonnull DefaultTestContext context) {
        if (cleanupState == State.DONE || cleanupChain().isEmpty()) {
            return null;
        }
        synchronized (lock) {
            if (cleanupState == State.DONE || !isCleanupAllowed()) {
                return null;
            }
            cleanupState = State.RUNNING;
            try {
                cleanupFailure = runChain(cleanupChain(), cleanupKind(), context);
                return cleanupFailure;
            } finally {
                cleanupState = State.DONE;
            }
        }
    }

    public boolean isInitializeExecuted() {
        return initializeState == State.DONE;
    }

    public boolean isCleanupExecuted() {
        return cleanupState == State.DONE;
    }

    /**
     * Result of initialize without its output, {@code null} when it never ran.
     */
    @Nullable
    public TestResult peekInitializeResult() {
        return initializeState == State.DONE ? initializeResult.withoutLogs() : null;
    }

    private TestFailedException runChain(List<FixtureMethod> chain, FixtureKind kind,
                                         DefaultTestContext context) {
        for (FixtureMethod method : chain) {
            log.debug("runChain: {} {} for {}", kind, method, getScopeName());
            TestFailedException failure = runner.invoke(method, kind, context,
                    thrown -> kind == initializeKind()
                            ? initializeFailure(method, thrown)
                            : cleanupFailureOf(kind, method, thrown));
            if (failure != null) {
                log.warn("runChain: {} {} failed: {}", kind, method, failure.getMessage());
                return failure;
            }
        }
        return null;
    }

    private static TestFailedException cleanupFailureOf(FixtureKind kind, FixtureMethod method,
                                                        Throwable thrown) {
        return new TestFailedException(UnitTestOutcome.FAILED, kind.getDisplayName()
                + " method " + method + " failed. Error Message: "
                + ExceptionUtil.formattedMessage(thrown) + ". Stack Trace: "
                + ExceptionUtil.stackTrace(thrown), ExceptionUtil.stackTrace(thrown), thrown);
    }
}
