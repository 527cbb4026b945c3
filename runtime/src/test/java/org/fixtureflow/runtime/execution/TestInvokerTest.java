package org.fixtureflow.runtime.execution;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.fixtureflow.api.AssertInconclusiveException;
import org.fixtureflow.api.ExpectedException;
import org.fixtureflow.api.GlobalTestCleanup;
import org.fixtureflow.api.GlobalTestInitialize;
import org.fixtureflow.api.TestCleanup;
import org.fixtureflow.api.TestContext;
import org.fixtureflow.api.TestInitialize;
import org.fixtureflow.api.TestMethod;
import org.fixtureflow.api.Timeout;
import org.fixtureflow.api.TimeoutMode;
import org.fixtureflow.runtime.ExecutionSettings;
import org.fixtureflow.runtime.context.CancellationSource;
import org.fixtureflow.runtime.context.OutputCapture;
import org.fixtureflow.runtime.execution.timeout.TimeoutStrategies;
import org.fixtureflow.runtime.metadata.MetadataCache;
import org.fixtureflow.runtime.metadata.TestMethodDescriptor;
import org.fixtureflow.runtime.model.TestElement;
import org.fixtureflow.runtime.model.TestResult;
import org.fixtureflow.runtime.model.TestSource;
import org.fixtureflow.runtime.model.UnitTestOutcome;
import org.junit.After;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

public class TestInvokerTest {

    static final List<String> EVENTS = Collections.synchronizedList(new ArrayList<>());

    public static class Lifecycle implements AutoCloseable {

        public Lifecycle() {
            EVENTS.add("construct");
        }

        public void setTestContext(TestContext context) {
            EVENTS.add("context");
        }

        @TestInitialize
        public void setUp() {
            EVENTS.add("init");
        }

        @TestMethod
        public void body() {
            EVENTS.add("body");
        }

        @TestCleanup
        public void tearDown() {
            EVENTS.add("cleanup");
        }

        @Override
        public void close() {
            EVENTS.add("close");
        }
    }

    public static class GlobalHooks {

        @GlobalTestInitialize
        public static void before(TestContext context) {
            EVENTS.add("global-init");
        }

        @GlobalTestCleanup
        public static void after(TestContext context) {
            EVENTS.add("global-cleanup:" + context.getCurrentTestOutcome());
        }
    }

    public static class Outcomes {

        private TestContext context;

        public void setTestContext(TestContext context) {
            this.context = context;
        }

        @TestMethod
        public void fails() {
            throw new AssertionError("nope");
        }

        @TestMethod
        public void inconclusive() {
            throw new AssertInconclusiveException("later");
        }

        @TestMethod
        @ExpectedException(IllegalArgumentException.class)
        public void throwsExpected() {
            throw new IllegalArgumentException("expected");
        }

        @TestMethod
        @ExpectedException(IllegalArgumentException.class)
        public void throwsNothing() {
        }

        @TestMethod
        @ExpectedException(RuntimeException.class)
        public void throwsDerived() {
            throw new IllegalStateException("derived");
        }

        @TestMethod
        @ExpectedException(value = RuntimeException.class, allowDerivedTypes = true)
        public void throwsDerivedAllowed() {
            throw new IllegalStateException("derived");
        }

        @TestMethod
        public void writes() {
            System.out.println("hello from the body");
            context.writeLine("message %d", 42);
        }

        @TestMethod
        public void honorsCancellation() {
            context.getCancellationToken().throwIfCancellationRequested();
        }
    }

    public static class BrokenConstructor {

        public BrokenConstructor() {
            throw new IllegalStateException("ctor");
        }

        @TestCleanup
        public void tearDown() {
            EVENTS.add("cleanup");
        }

        @TestMethod
        public void test() {
        }
    }

    public static class BrokenInitialize {

        @TestInitialize
        public void setUp() {
            throw new IllegalStateException("setup");
        }

        @TestMethod
        public void test() {
            EVENTS.add("body");
        }

        @TestCleanup
        public void tearDown() {
            EVENTS.add("cleanup");
        }
    }

    public static class BrokenCleanup {

        @TestMethod
        public void test() {
            throw new AssertionError("body");
        }

        @TestCleanup
        public void tearDown() {
            throw new IllegalStateException("teardown");
        }
    }

    public static class WithContextConstructor {

        private final TestContext context;

        public WithContextConstructor(TestContext context) {
            this.context = context;
        }

        @TestMethod
        public void usesContext() {
            if (!"usesContext".equals(context.getTestName())) {
                throw new AssertionError(context.getTestName());
            }
        }
    }

    public static class Slow {

        static final AtomicInteger CLEANUP = new AtomicInteger();

        static volatile CountDownLatch release = new CountDownLatch(1);

        static volatile CountDownLatch finished = new CountDownLatch(1);

        private TestContext context;

        public void setTestContext(TestContext context) {
            this.context = context;
        }

        @TestMethod
        @Timeout(value = 100, mode = TimeoutMode.HARD)
        public void ignoresInterrupts() {
            try {
                while (true) {
                    try {
                        if (release.await(10, TimeUnit.SECONDS)) {
                            return;
                        }
                    } catch (InterruptedException e) {
                        // keep running past the interrupt
                    }
                }
            } finally {
                finished.countDown();
            }
        }

        @TestMethod
        @Timeout(value = 100, mode = TimeoutMode.COOPERATIVE)
        public void pollsCancellation() throws InterruptedException {
            while (!context.getCancellationToken().isCancellationRequested()) {
                Thread.sleep(5);
            }
        }

        @TestMethod
        @Timeout(value = 5_000, mode = TimeoutMode.HARD)
        public void fast() {
        }

        @TestCleanup
        public void tearDown() {
            CLEANUP.incrementAndGet();
        }
    }

    private final MetadataCache metadata = new MetadataCache(ExecutionSettings.DEFAULT);

    private final CancellationSource run = new CancellationSource();

    private TimeoutStrategies timeouts;

    private TestInvoker invoker;

    @BeforeClass
    public static void captureOutput() {
        OutputCapture.install();
    }

    @Before
    public void setUp() {
        EVENTS.clear();
        Slow.CLEANUP.set(0);
        Slow.release = new CountDownLatch(1);
        Slow.finished = new CountDownLatch(1);
        timeouts = new TimeoutStrategies();
        invoker = new TestInvoker(timeouts, run);
    }

    @After
    public void tearDown() {
        Slow.release.countDown();
        timeouts.close();
    }

    private TestResult invoke(Class<?> type, String method, Class<?>... others) {
        Class<?>[] classes = new Class<?>[others.length + 1];
        classes[0] = type;
        System.arraycopy(others, 0, classes, 1, others.length);
        TestSource source = TestSource.of(type.getSimpleName(), classes);
        TestMethodDescriptor descriptor =
                metadata.resolveMethod(source, TestElement.of(source.getId(), type, method));
        return invoker.invoke(descriptor, null);
    }

    @Test
    public void lifecycleRunsInOrder() {
        TestResult result = invoke(Lifecycle.class, "body", GlobalHooks.class);

        assertThat(result.getOutcome()).isEqualTo(UnitTestOutcome.PASSED);
        assertThat(EVENTS).containsExactly("construct", "context", "global-init", "init",
                "body", "cleanup", "close", "global-cleanup:PASSED");
    }

    @Test
    public void finishedInvocationsLeaveNoCallbackOnTheRunToken() {
        for (int i = 0; i < 5; i++) {
            invoke(Lifecycle.class, "body", GlobalHooks.class);
            invoke(Slow.class, "fast");
        }

        assertThat(run.registeredCallbacks()).isZero();
    }

    @Test
    public void failingBodyIsReported() {
        TestResult result = invoke(Outcomes.class, "fails");

        assertThat(result.getOutcome()).isEqualTo(UnitTestOutcome.FAILED);
        assertThat(result.getErrorMessage()).isEqualTo("Test method "
                + Outcomes.class.getName() + ".fails threw exception: "
                + "java.lang.AssertionError: nope");
        assertThat(result.getFailure().getStackTraceInformation()).contains("fails");
    }

    @Test
    public void inconclusiveBody() {
        assertThat(invoke(Outcomes.class, "inconclusive").getOutcome())
                .isEqualTo(UnitTestOutcome.INCONCLUSIVE);
    }

    @Test
    public void expectedExceptions() {
        assertThat(invoke(Outcomes.class, "throwsExpected").getOutcome())
                .isEqualTo(UnitTestOutcome.PASSED);
        assertThat(invoke(Outcomes.class, "throwsDerived").getOutcome())
                .isEqualTo(UnitTestOutcome.FAILED);
        assertThat(invoke(Outcomes.class, "throwsDerivedAllowed").getOutcome())
                .isEqualTo(UnitTestOutcome.PASSED);

        TestResult nothing = invoke(Outcomes.class, "throwsNothing");
        assertThat(nothing.getOutcome()).isEqualTo(UnitTestOutcome.FAILED);
        assertThat(nothing.getErrorMessage()).isEqualTo("Test method "
                + Outcomes.class.getName() + ".throwsNothing did not throw expected exception "
                + "java.lang.IllegalArgumentException.");
    }

    @Test
    public void outputIsCapturedPerTest() {
        TestResult result = invoke(Outcomes.class, "writes");

        assertThat(result.getOutcome()).isEqualTo(UnitTestOutcome.PASSED);
        assertThat(result.getStandardOut()).contains("hello from the body");
        assertThat(result.getTestContextMessages()).contains("message 42");
    }

    @Test
    public void constructorFailureSkipsEverythingElse() {
        TestResult result = invoke(BrokenConstructor.class, "test");

        assertThat(result.getOutcome()).isEqualTo(UnitTestOutcome.FAILED);
        assertThat(result.getErrorMessage()).isEqualTo("Unable to create instance of class "
                + BrokenConstructor.class.getName()
                + ". Error: java.lang.IllegalStateException: ctor.");
        assertThat(EVENTS).isEmpty();
    }

    @Test
    public void initializeFailureSkipsTheBodyButNotCleanup() {
        TestResult result = invoke(BrokenInitialize.class, "test");

        assertThat(result.getOutcome()).isEqualTo(UnitTestOutcome.FAILED);
        assertThat(result.getErrorMessage()).startsWith("Initialization method "
                + BrokenInitialize.class.getName() + ".setUp threw exception.");
        assertThat(EVENTS).containsExactly("cleanup");
    }

    @Test
    public void cleanupFailureReplacesTheBodyFailure() {
        TestResult result = invoke(BrokenCleanup.class, "test");

        assertThat(result.getOutcome()).isEqualTo(UnitTestOutcome.FAILED);
        assertThat(result.getErrorMessage()).isEqualTo("Test Cleanup method "
                + BrokenCleanup.class.getName() + ".tearDown threw exception. "
                + "java.lang.IllegalStateException: teardown.");
        assertThat(result.getFailure().getSuppressed()).hasSize(1);
        assertThat(result.getFailure().getSuppressed()[0].getMessage()).contains("body");
    }

    @Test
    public void contextConstructorReceivesTheContext() {
        assertThat(invoke(WithContextConstructor.class, "usesContext").getOutcome())
                .isEqualTo(UnitTestOutcome.PASSED);
    }

    @Test
    public void canceledRunCancelsTheTest() {
        run.cancel();

        TestResult result = invoke(Outcomes.class, "honorsCancellation");

        assertThat(result.getOutcome()).isEqualTo(UnitTestOutcome.TIMEOUT);
        assertThat(result.getErrorMessage()).isEqualTo("Test 'honorsCancellation' was canceled.");
    }

    @Test
    public void hardTimeoutAbandonsTheBodyAndCleansUpOnce() throws InterruptedException {
        TestResult result = invoke(Slow.class, "ignoresInterrupts");

        assertThat(result.getOutcome()).isEqualTo(UnitTestOutcome.TIMEOUT);
        assertThat(result.getErrorMessage())
                .isEqualTo("Test 'ignoresInterrupts' exceeded execution timeout period.");
        assertThat(Slow.CLEANUP.get()).isEqualTo(1);

        Slow.release.countDown();
        assertThat(Slow.finished.await(10, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(50);
        assertThat(Slow.CLEANUP.get()).isEqualTo(1);
    }

    @Test
    public void cooperativeTimeoutIsReportedEvenWhenTheBodyReturns() {
        TestResult result = invoke(Slow.class, "pollsCancellation");

        assertThat(result.getOutcome()).isEqualTo(UnitTestOutcome.TIMEOUT);
        assertThat(result.getErrorMessage())
                .isEqualTo("Test 'pollsCancellation' exceeded execution timeout period.");
        assertThat(Slow.CLEANUP.get()).isEqualTo(1);
    }

    @Test
    public void bodyWithinItsTimeoutPasses() {
        TestResult result = invoke(Slow.class, "fast");

        assertThat(result.getOutcome()).isEqualTo(UnitTestOutcome.PASSED);
        assertThat(Slow.CLEANUP.get()).isEqualTo(1);
    }
}
