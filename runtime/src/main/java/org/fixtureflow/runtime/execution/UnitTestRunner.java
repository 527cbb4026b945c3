package org.fixtureflow.runtime.execution;

import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import java.util.List;
import java.util.function.Consumer;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.fixtureflow.api.CancellationToken;
import org.fixtureflow.runtime.completion.CompletionDecision;
import org.fixtureflow.runtime.completion.CompletionTracker;
import org.fixtureflow.runtime.context.CancellationSource;
import org.fixtureflow.runtime.context.DefaultTestContext;
import org.fixtureflow.runtime.context.LogBuffer;
import org.fixtureflow.runtime.exceptions.TestFailedException;
import org.fixtureflow.runtime.exceptions.TypeInspectionException;
import org.fixtureflow.runtime.fixture.AssemblyFixtureState;
import org.fixtureflow.runtime.fixture.ClassFixtureState;
import org.fixtureflow.runtime.fixture.FixtureState;
import org.fixtureflow.runtime.fixture.FixtureStore;
import org.fixtureflow.runtime.metadata.ClassDescriptor;
import org.fixtureflow.runtime.metadata.MetadataCache;
import org.fixtureflow.runtime.metadata.TestMethodDescriptor;
import org.fixtureflow.runtime.model.TestElement;
import org.fixtureflow.runtime.model.TestResult;
import org.fixtureflow.runtime.model.TestSource;
import org.fixtureflow.runtime.model.UnitTestOutcome;

/**
 * Runs the tests of one source, one at a time per caller, and interleaves them with the
 * shared fixtures of the source: initialize on first need, cleanup as soon as the completion
 * tracker says a scope is done.
 *
 * <p>Safe for concurrent use by the scheduler's workers.
 */
@Slf4j
public class UnitTestRunner {

    private final TestSource source;

    private final MetadataCache metadata;

    private final FixtureStore fixtures;

    private final TestMethodRunner methodRunner;

    private final CompletionTracker tracker;

    private final CancellationToken runToken;

    /** Receives cleanup failures no test result can carry. */
    private final Consumer<String> warnings;

    @Builder
    public UnitTestRunner(@NonNull TestSource source, @NonNull MetadataCache metadata,
                          @NonNull FixtureStore fixtures, @NonNull TestMethodRunner methodRunner,
                          @NonNull CompletionTracker tracker, @NonNull CancellationToken runToken,
                          @NonNull Consumer<String> warnings) {
        this.source = source;
        this.metadata = metadata;
        this.fixtures = fixtures;
        this.methodRunner = methodRunner;
        this.tracker = tracker;
        this.runToken = runToken;
        this.warnings = warnings;
    }

    /**
     * Runs one test, with the fixtures it needs and the cleanups its completion makes due.
     */
    @Nonnull
    public List<TestResult> runSingleTest(@Nonnull TestElement element) {
        ClassDescriptor classDescriptor = null;
        List<TestResult> results = null;
        try {
            TestMethodDescriptor test = metadata.resolveMethod(source, element);
            if (test == null) {
                results = single(TestResult.failed(new TestFailedException(
                        UnitTestOutcome.NOT_FOUND, "Test method " + element.getClassName()
                        + "." + element.getMethodName() + " was not found.")));
                return results;
            }
            classDescriptor = test.getParent();
            if (!test.isRunnable()) {
                results = single(TestResult.failed(new TestFailedException(
                        UnitTestOutcome.NOT_RUNNABLE, test.getNotRunnableReason())));
                return results;
            }
            if (test.isIgnored()) {
                results = single(ignored(test));
                return results;
            }

            AssemblyFixtureState assembly = fixtures.forAssembly(classDescriptor.getParent());
            TestResult assemblyInitialize = initialize(assembly, element, "AssemblyInitialize");
            if (assemblyInitialize.getOutcome() != UnitTestOutcome.PASSED) {
                results = single(assemblyInitialize);
                return results;
            }

            ClassFixtureState classState = fixtures.forClass(classDescriptor);
            TestResult classInitialize = initialize(classState, element, "ClassInitialize");
            if (classInitialize.getOutcome() != UnitTestOutcome.PASSED) {
                results = single(classInitialize.prependLogs(assemblyInitialize));
                return results;
            }

            results = methodRunner.execute(test, classInitialize.prependLogs(assemblyInitialize));
            return results;
        } catch (TypeInspectionException e) {
            log.warn("runSingleTest: cannot inspect {}: {}", element.getUniqueName(),
                    e.getMessage());
            results = single(TestResult.failed(
                    new TestFailedException(UnitTestOutcome.FAILED, e.getMessage(), e)));
            return results;
        } finally {
            complete(element, classDescriptor, results);
        }
    }

    /**
     * Runs every cleanup still pending for the source. Used once the source is over, when
     * some tests never completed, for instance after cancellation. Failures become warnings.
     */
    public void forceCleanup() {
        for (ClassFixtureState state : fixtures.pendingClassCleanups(metadata.classesWithCleanup(source))) {
            runClassCleanup(state, null, false);
        }
        AssemblyFixtureState assembly = fixtures.findAssembly(source.getId());
        if (assembly != null && assembly.isInitializeExecuted()) {
            DefaultTestContext context = cleanupContext("AssemblyCleanup", source.getId());
            attach(assembly.runCleanup(context), context, null, false);
        }
    }

    /**
     * Result reported for an element standing for a fixture rather than a test.
     */
    @Nonnull
    public List<TestResult> fixtureResult(@Nonnull TestElement element) {
        FixtureState state = element.getFixtureKind() == null ? null
                : isAssemblyLevel(element)
                ? fixtures.findAssembly(source.getId())
                : fixtures.findClass(source.getId(), element.getClassName());
        if (state == null) {
            return single(notExecuted(element));
        }
        switch (element.getFixtureKind()) {
            case ASSEMBLY_INITIALIZE:
            case CLASS_INITIALIZE:
                TestResult initialize = state.peekInitializeResult();
                return single(initialize != null ? initialize : notExecuted(element));
            default:
                if (!state.isCleanupExecuted()) {
                    return single(notExecuted(element));
                }
                return single(state.getCleanupFailure() != null
                        ? TestResult.failed(state.getCleanupFailure())
                        : TestResult.of(UnitTestOutcome.PASSED));
        }
    }

    private void complete(TestElement element, @Nullable ClassDescriptor classDescriptor,
                          @Nullable List<TestResult> results) {
        CompletionDecision decision = tracker.markTestComplete(element, classDescriptor);
        TestResult last = results == null || results.isEmpty()
                ? null : results.get(results.size() - 1);

        if (decision.isRunClassCleanupNow()) {
            ClassFixtureState state = fixtures.findClass(source.getId(), element.getClassName());
            if (state != null) {
                runClassCleanup(state, last, true);
            }
        }
        if (decision.isRunAssemblyCleanupNow()) {
            // classes deferring their cleanup to the end of the source go first
            for (ClassFixtureState state : fixtures.pendingClassCleanups(metadata.classesWithCleanup(source))) {
                runClassCleanup(state, last, false);
            }
            AssemblyFixtureState assembly = fixtures.findAssembly(source.getId());
            if (assembly != null && assembly.isInitializeExecuted()) {
                DefaultTestContext context = cleanupContext("AssemblyCleanup",
                        element.getClassName());
                attach(assembly.runCleanup(context), context, last, false);
            }
        }
    }

    private void runClassCleanup(ClassFixtureState state, @Nullable TestResult last,
                                 boolean endOfClass) {
        DefaultTestContext context = cleanupContext("ClassCleanup", state.getScopeName());
        attach(state.runCleanup(context), context, last, endOfClass);
    }

    /**
     * Reports a cleanup's output and failure with the last result of the completing test,
     * or as a warning when there is no such result.
     */
    private void attach(@Nullable TestFailedException failure, DefaultTestContext context,
                        @Nullable TestResult last, boolean escalate) {
        if (last == null) {
            if (failure != null) {
                log.warn("attach: {}", failure.getMessage());
                warnings.accept(failure.getMessage());
            }
            return;
        }
        context.getLogBuffer().drainInto(last);
        if (failure == null) {
            return;
        }
        log.warn("attach: {}", failure.getMessage());
        if (escalate) {
            last.setOutcome(last.getOutcome().moreImportant(UnitTestOutcome.FAILED))
                    .setFailure(failure);
        } else {
            last.addWarning(failure.getMessage());
        }
    }

    private TestResult initialize(FixtureState state, TestElement element, String name) {
        try (DefaultTestContext context = DefaultTestContext.create(name,
                element.getClassName(), runToken)) {
            return state.getResultOrInitialize(context);
        }
    }

    /**
     * Cleanup still runs after the run was canceled, so its token is not linked to the run's.
     */
    private static DefaultTestContext cleanupContext(String name, String className) {
        return new DefaultTestContext(name, className, new CancellationSource(), new LogBuffer());
    }

    private static boolean isAssemblyLevel(TestElement element) {
        switch (element.getFixtureKind()) {
            case ASSEMBLY_INITIALIZE:
            case ASSEMBLY_CLEANUP:
                return true;
            default:
                return false;
        }
    }

    private static TestResult ignored(TestMethodDescriptor test) {
        String message = test.getIgnoreMessage();
        TestResult result = TestResult.of(UnitTestOutcome.IGNORED);
        if (!Strings.isNullOrEmpty(message)) {
            result.setFailure(new TestFailedException(UnitTestOutcome.IGNORED, message));
        }
        return result;
    }

    private static TestResult notExecuted(TestElement element) {
        return TestResult.failed(new TestFailedException(UnitTestOutcome.INCONCLUSIVE,
                element.getFixtureKind().getDisplayName() + " method "
                        + element.getClassName() + "." + element.getMethodName()
                        + " was not executed."));
    }

    private static List<TestResult> single(TestResult result) {
        return Lists.newArrayList(result);
    }
}
