package org.fixtureflow.runtime.execution;

import com.google.common.base.Stopwatch;
import com.google.common.base.Throwables;
import java.lang.reflect.Method;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.fixtureflow.api.CancellationToken;
import org.fixtureflow.runtime.context.DefaultTestContext;
import org.fixtureflow.runtime.context.OutputCapture;
import org.fixtureflow.runtime.exceptions.TestFailedException;
import org.fixtureflow.runtime.execution.timeout.TimedExecution;
import org.fixtureflow.runtime.execution.timeout.TimeoutStrategies;
import org.fixtureflow.runtime.metadata.ClassDescriptor;
import org.fixtureflow.runtime.metadata.ExpectedExceptionVerifier;
import org.fixtureflow.runtime.metadata.TestMethodDescriptor;
import org.fixtureflow.runtime.metadata.TimeoutInfo;
import org.fixtureflow.runtime.model.TestResult;
import org.fixtureflow.runtime.model.UnitTestOutcome;
import org.fixtureflow.util.ExceptionUtil;

/**
 * Runs a test method once through its whole per-test lifecycle: construction, context,
 * initialize, body, cleanup.
 *
 * <p>Every throwable coming from user code ends up in the returned result. Only failures
 * of the engine itself escape.
 */
@Slf4j
public class TestInvoker {

    enum InvocationState {
        NOT_STARTED,
        INSTANCE_CONSTRUCTED,
        CONTEXT_SET,
        INITIALIZE_RAN,
        BODY_RAN,
        CLEANUP_RAN
    }

    private final TimeoutStrategies timeouts;

    private final CancellationToken runToken;

    public TestInvoker(@Nonnull TimeoutStrategies timeouts, @Nonnull CancellationToken runToken) {
        this.timeouts = timeouts;
        this.runToken = runToken;
    }

    /**
     * @param arguments the data row, {@code null} for tests without rows
     */
    @Nonnull
    public TestResult invoke(@Nonnull TestMethodDescriptor test, @Nullable Object[] arguments) {
        DefaultTestContext context = DefaultTestContext.create(test.getName(),
                test.getClassName(), runToken);
        Invocation invocation = new Invocation(test, arguments, context);

        Stopwatch stopwatch = Stopwatch.createStarted();
        TestResult result;
        try (OutputCapture.Scope ignored = OutputCapture.bind(context.getLogBuffer())) {
            result = test.getTimeout() == null
                    ? invocation.execute()
                    : executeWithTimeout(invocation, test.getTimeout());
        } finally {
            context.close();
        }
        result.setDuration(stopwatch.elapsed());
        return context.getLogBuffer().drainInto(result);
    }

    private TestResult executeWithTimeout(Invocation invocation, TimeoutInfo timeout) {
        AtomicReference<TestResult> holder = new AtomicReference<>();
        TimedExecution execution = timeouts.select(timeout).execute(
                () -> holder.set(invocation.execute()), timeout.getTimeout(),
                invocation.context.getCancellationSource());

        if (!execution.isCompleted()) {
            // The body is still running somewhere. Cleanup runs from here, once, and the
            // abandoned thread starts no further lifecycle step.
            TestResult result = TestResult.failed(exceededTimeout(invocation.test));
            invocation.abandon();
            invocation.context.setOutcome(UnitTestOutcome.TIMEOUT);
            invocation.runCleanup(result);
            return result;
        }
        if (execution.getThrown() != null) {
            Throwables.throwIfUnchecked(execution.getThrown());
            throw new IllegalStateException(execution.getThrown());
        }

        TestResult result = holder.get();
        if (execution.isTimedOut()) {
            log.warn("invoke: {}.{} exceeded its timeout of {}", invocation.test.getClassName(),
                    invocation.test.getName(), timeout.getTimeout());
            TestFailedException timedOut = exceededTimeout(invocation.test);
            if (result.getFailure() != null) {
                timedOut.addSuppressed(result.getFailure());
            }
            result.setOutcome(UnitTestOutcome.TIMEOUT).setFailure(timedOut);
        }
        return result;
    }

    private static TestFailedException exceededTimeout(TestMethodDescriptor test) {
        return new TestFailedException(UnitTestOutcome.TIMEOUT,
                "Test '" + test.getName() + "' exceeded execution timeout period.");
    }

    /**
     * State of one invocation. Cleanup may be started by the thread running the body or, after
     * a hard timeout, by the thread that stopped waiting for it; the flag lets only one of
     * them run it.
     *
     * <p>Once abandoned, the state no longer advances, so the thread running the lifecycle
     * stops before its next step.
     */
    private static class Invocation {

        private final TestMethodDescriptor test;

        private final ClassDescriptor parent;

        @Nullable
        private final Object[] arguments;

        private final DefaultTestContext context;

        private final AtomicBoolean cleanupInvoked = new AtomicBoolean(false);

        private final Object stateLock = new Object();

        private volatile InvocationState state = InvocationState.NOT_STARTED;

        private boolean abandoned;

        private volatile Object instance;

        Invocation(TestMethodDescriptor test, @Nullable Object[] arguments,
                   DefaultTestContext context) {
            this.test = test;
            this.parent = test.getParent();
            this.arguments = arguments;
            this.context = context;
        }

        void abandon() {
            synchronized (stateLock) {
                abandoned = true;
            }
        }

        /**
         * @return false when the invocation was abandoned and the next step must not run
         */
        private boolean advance(InvocationState next) {
            synchronized (stateLock) {
                if (abandoned) {
                    return false;
                }
                state = next;
                return true;
            }
        }

        private boolean isAbandoned() {
            synchronized (stateLock) {
                return abandoned;
            }
        }

        TestResult execute() {
            TestResult result = new TestResult();
            if (!createInstance(result) || !setContext(result)) {
                return result;
            }
            if (runInitialize(result)) {
                runBody(result);
            }
            if (!isAbandoned()) {
                runCleanup(result);
            }
            return result;
        }

        private boolean createInstance(TestResult result) {
            try {
                instance = parent.constructorTakesContext()
                        ? parent.getConstructor().newInstance(context)
                        : parent.getConstructor().newInstance();
                return advance(InvocationState.INSTANCE_CONSTRUCTED);
            } catch (Throwable t) {
                Throwable real = ExceptionUtil.unwrap(t);
                fail(result, UnitTestOutcome.FAILED, "Unable to create instance of class "
                        + parent.getClassName() + ". Error: "
                        + ExceptionUtil.formattedMessage(real) + ".", real);
                return false;
            }
        }

        private boolean setContext(TestResult result) {
            Method setter = parent.getContextSetter();
            try {
                if (setter != null) {
                    setter.invoke(instance, context);
                }
                return advance(InvocationState.CONTEXT_SET);
            } catch (Throwable t) {
                Throwable real = ExceptionUtil.unwrap(t);
                fail(result, UnitTestOutcome.FAILED, "Unable to set TestContext property for "
                        + "the class " + parent.getClassName() + ". Error: "
                        + ExceptionUtil.formattedMessage(real) + ".", real);
                return false;
            }
        }

        private boolean runInitialize(TestResult result) {
            Method current = null;
            if (isAbandoned()) {
                return false;
            }
            try {
                for (Method hook : parent.getParent().getGlobalTestInitialize()) {
                    current = hook;
                    hook.invoke(null, context);
                }
                for (Method initialize : parent.getTestInitialize()) {
                    current = initialize;
                    initialize.invoke(instance);
                }
                return advance(InvocationState.INITIALIZE_RAN);
            } catch (Throwable t) {
                Throwable real = ExceptionUtil.unwrap(t);
                fail(result, ExceptionUtil.outcomeOf(real), "Initialization method "
                        + current.getDeclaringClass().getName() + "." + current.getName()
                        + " threw exception. " + ExceptionUtil.formattedMessage(real) + ".", real);
                return false;
            }
        }

        private void runBody(TestResult result) {
            ExpectedExceptionVerifier verifier = test.getExpectedException();
            try {
                test.getMethod().invoke(instance, arguments == null ? new Object[0] : arguments);
                if (verifier != null) {
                    fail(result, UnitTestOutcome.FAILED,
                            verifier.noExceptionMessage(test.getClassName(), test.getName()),
                            null);
                } else {
                    result.setOutcome(UnitTestOutcome.PASSED);
                }
            } catch (Throwable t) {
                handleBodyException(result, ExceptionUtil.unwrap(t), verifier);
            } finally {
                advance(InvocationState.BODY_RAN);
            }
        }

        private void handleBodyException(TestResult result, Throwable real,
                                         @Nullable ExpectedExceptionVerifier verifier) {
            if (real instanceof CancellationException
                    && context.getCancellationSource().isCancellationRequested()) {
                fail(result, UnitTestOutcome.TIMEOUT,
                        "Test '" + test.getName() + "' was canceled.", real);
                return;
            }
            if (verifier == null) {
                fail(result, ExceptionUtil.outcomeOf(real), "Test method "
                        + test.getClassName() + "." + test.getName() + " threw exception: "
                        + ExceptionUtil.formattedMessage(real), real);
                return;
            }
            try {
                verifier.verify(real);
                result.setOutcome(UnitTestOutcome.PASSED);
            } catch (Throwable rejection) {
                fail(result, ExceptionUtil.outcomeOf(rejection), rejection.getMessage(), real);
            }
        }

        /**
         * Runs per-test cleanup, closes the instance and runs the global cleanup hooks.
         * Does nothing when the context was never set or cleanup already started.
         */
        void runCleanup(TestResult result) {
            if (state.compareTo(InvocationState.CONTEXT_SET) < 0
                    || !cleanupInvoked.compareAndSet(false, true)) {
                return;
            }
            context.setOutcome(result.getOutcome());

            Throwable failure = null;
            String failedMethod = null;
            try {
                for (Method cleanup : parent.getTestCleanup()) {
                    failedMethod = cleanup.getDeclaringClass().getName() + "." + cleanup.getName();
                    cleanup.invoke(instance);
                }
                failedMethod = null;
            } catch (Throwable t) {
                failure = ExceptionUtil.unwrap(t);
            }

            if (instance instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) instance).close();
                } catch (Throwable t) {
                    if (failure == null) {
                        failure = t;
                        failedMethod = parent.getClassName() + ".close";
                    }
                }
            }

            for (Method hook : parent.getParent().getGlobalTestCleanup()) {
                try {
                    hook.invoke(null, context);
                } catch (Throwable t) {
                    if (failure == null) {
                        failure = ExceptionUtil.unwrap(t);
                        failedMethod = hook.getDeclaringClass().getName() + "." + hook.getName();
                    }
                }
            }
            state = InvocationState.CLEANUP_RAN;

            if (failure != null) {
                UnitTestOutcome outcome = ExceptionUtil.outcomeOf(failure);
                TestFailedException previous = result.getFailure();
                TestFailedException cleanupFailure = new TestFailedException(outcome,
                        "Test Cleanup method " + failedMethod + " threw exception. "
                                + ExceptionUtil.formattedMessage(failure) + ".",
                        ExceptionUtil.stackTrace(failure), failure);
                if (previous != null) {
                    cleanupFailure.addSuppressed(previous);
                }
                result.setOutcome(result.getOutcome().moreImportant(outcome))
                        .setFailure(cleanupFailure);
            }
        }

        private static void fail(TestResult result, UnitTestOutcome outcome, String message,
                                 @Nullable Throwable cause) {
            result.setOutcome(outcome).setFailure(new TestFailedException(outcome, message,
                    ExceptionUtil.stackTrace(cause), cause));
        }
    }
}
