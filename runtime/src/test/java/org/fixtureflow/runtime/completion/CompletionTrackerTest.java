package org.fixtureflow.runtime.completion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.fixtureflow.api.ClassCleanupBehavior;
import org.fixtureflow.runtime.metadata.ClassDescriptor;
import org.fixtureflow.runtime.model.FixtureKind;
import org.fixtureflow.runtime.model.TestElement;
import org.junit.Test;

public class CompletionTrackerTest {

    private static TestElement test(String className, String method) {
        return TestElement.builder()
                .sourceId("source")
                .className(className)
                .methodName(method)
                .build();
    }

    private static ClassDescriptor descriptor(ClassCleanupBehavior declared, boolean cleanup) {
        ClassDescriptor descriptor = mock(ClassDescriptor.class);
        when(descriptor.getDeclaredCleanupBehavior()).thenReturn(declared);
        when(descriptor.hasExecutableCleanup()).thenReturn(cleanup);
        return descriptor;
    }

    @Test
    public void classCleanupIsDueAfterTheLastTestOfTheClass() {
        TestElement a = test("C", "a");
        TestElement b = test("C", "b");
        CompletionTracker tracker = new CompletionTracker(ImmutableList.of(a, b), null, null);
        ClassDescriptor descriptor = descriptor(ClassCleanupBehavior.END_OF_CLASS, true);

        CompletionDecision first = tracker.markTestComplete(a, descriptor);
        CompletionDecision second = tracker.markTestComplete(b, descriptor);

        assertThat(first).isEqualTo(CompletionDecision.NONE);
        assertThat(second.isRunClassCleanupNow()).isTrue();
        assertThat(second.isRunAssemblyCleanupNow()).isTrue();
        assertThat(tracker.hasPendingTests()).isFalse();
    }

    @Test
    public void endOfAssemblyCleanupIsNotRunAtEndOfClass() {
        TestElement a = test("C", "a");
        TestElement other = test("D", "a");
        CompletionTracker tracker = new CompletionTracker(ImmutableList.of(a, other), null, null);

        CompletionDecision decision =
                tracker.markTestComplete(a, descriptor(ClassCleanupBehavior.DEFAULT, true));

        assertThat(decision.isRunClassCleanupNow()).isFalse();
        assertThat(decision.isRunAssemblyCleanupNow()).isFalse();
        assertThat(tracker.remainingClassCount()).isEqualTo(1);
    }

    @Test
    public void classWithoutCleanupNeverAsksForIt() {
        TestElement a = test("C", "a");
        CompletionTracker tracker = new CompletionTracker(ImmutableList.of(a),
                ClassCleanupBehavior.END_OF_CLASS, null);

        CompletionDecision decision =
                tracker.markTestComplete(a, descriptor(ClassCleanupBehavior.DEFAULT, false));

        assertThat(decision.isRunClassCleanupNow()).isFalse();
        assertThat(decision.isRunAssemblyCleanupNow()).isTrue();
    }

    @Test
    public void repeatedOrUnknownCompletionsAreIgnored() {
        TestElement a = test("C", "a");
        TestElement b = test("C", "b");
        CompletionTracker tracker = new CompletionTracker(ImmutableList.of(a, b), null, null);

        assertThat(tracker.markTestComplete(a, null)).isEqualTo(CompletionDecision.NONE);
        assertThat(tracker.markTestComplete(a, null)).isEqualTo(CompletionDecision.NONE);
        assertThat(tracker.markTestComplete(test("X", "y"), null))
                .isEqualTo(CompletionDecision.NONE);
        assertThat(tracker.markTestComplete(b, null).isRunAssemblyCleanupNow()).isTrue();
        assertThat(tracker.markTestComplete(b, null)).isEqualTo(CompletionDecision.NONE);
    }

    @Test
    public void fixtureElementsAreNotTracked() {
        TestElement a = test("C", "a");
        TestElement fixture = test("C", "init").toBuilder()
                .fixtureKind(FixtureKind.CLASS_INITIALIZE)
                .build();
        CompletionTracker tracker =
                new CompletionTracker(ImmutableList.of(a, fixture), null, null);

        assertThat(tracker.markTestComplete(a, null).isRunAssemblyCleanupNow()).isTrue();
    }

    @Test
    public void declarationWinsOverRunAndSourceSettings() {
        CompletionTracker tracker = new CompletionTracker(ImmutableList.of(),
                ClassCleanupBehavior.END_OF_CLASS, ClassCleanupBehavior.END_OF_CLASS);

        assertThat(tracker.effectiveBehavior(
                descriptor(ClassCleanupBehavior.END_OF_ASSEMBLY, true)))
                .isEqualTo(ClassCleanupBehavior.END_OF_ASSEMBLY);
    }

    @Test
    public void runSettingWinsOverSourceSetting() {
        CompletionTracker tracker = new CompletionTracker(ImmutableList.of(),
                ClassCleanupBehavior.END_OF_ASSEMBLY, ClassCleanupBehavior.END_OF_CLASS);

        assertThat(tracker.effectiveBehavior(descriptor(ClassCleanupBehavior.DEFAULT, true)))
                .isEqualTo(ClassCleanupBehavior.END_OF_ASSEMBLY);
    }

    @Test
    public void sourceSettingAppliesWhenNothingElseIsSet() {
        CompletionTracker tracker = new CompletionTracker(ImmutableList.of(),
                null, ClassCleanupBehavior.END_OF_CLASS);
        CompletionTracker bare = new CompletionTracker(ImmutableList.of(), null, null);
        ClassDescriptor descriptor = descriptor(ClassCleanupBehavior.DEFAULT, true);

        assertThat(tracker.effectiveBehavior(descriptor))
                .isEqualTo(ClassCleanupBehavior.END_OF_CLASS);
        assertThat(bare.effectiveBehavior(descriptor))
                .isEqualTo(ClassCleanupBehavior.END_OF_ASSEMBLY);
    }

    @Test
    public void concurrentCompletionsReportEachCleanupOnce() throws Exception {
        final int classes = 8;
        final int testsPerClass = 25;
        List<TestElement> tests = new ArrayList<>();
        for (int c = 0; c < classes; c++) {
            for (int t = 0; t < testsPerClass; t++) {
                tests.add(test("C" + c, "t" + t));
            }
        }
        Collections.shuffle(tests);
        CompletionTracker tracker = new CompletionTracker(tests, null, null);
        ClassDescriptor descriptor = descriptor(ClassCleanupBehavior.END_OF_CLASS, true);

        ExecutorService pool = Executors.newFixedThreadPool(classes);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<CompletionDecision>> decisions = new ArrayList<>();
        try {
            for (TestElement test : tests) {
                decisions.add(pool.submit(() -> {
                    start.await();
                    return tracker.markTestComplete(test, descriptor);
                }));
            }
            start.countDown();

            int classCleanups = 0;
            int assemblyCleanups = 0;
            for (Future<CompletionDecision> future : decisions) {
                CompletionDecision decision = future.get(10, TimeUnit.SECONDS);
                classCleanups += decision.isRunClassCleanupNow() ? 1 : 0;
                assemblyCleanups += decision.isRunAssemblyCleanupNow() ? 1 : 0;
            }

            assertThat(classCleanups).isEqualTo(classes);
            assertThat(assemblyCleanups).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
