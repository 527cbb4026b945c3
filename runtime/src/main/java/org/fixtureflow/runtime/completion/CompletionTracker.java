package org.fixtureflow.runtime.completion;

import com.google.common.annotations.VisibleForTesting;
import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.fixtureflow.api.ClassCleanupBehavior;
import org.fixtureflow.runtime.metadata.ClassDescriptor;
import org.fixtureflow.runtime.model.TestElement;

/**
 * Tracks the tests of a source that have not completed yet and tells, for each completing
 * test, whether class cleanup or assembly cleanup became due.
 *
 * <p>Each class has its own set of remaining tests, guarded by the set itself. The class that
 * empties last is detected through the count of remaining classes, so exactly one completion
 * reports assembly cleanup even when the last tests of two classes finish together.
 */
@Slf4j
public class CompletionTracker {

    private final Map<String, Set<String>> testsByClass = new ConcurrentHashMap<>();

    private final AtomicInteger remainingClasses;

    @Nullable
    private final ClassCleanupBehavior runBehavior;

    @Nullable
    private final ClassCleanupBehavior sourceBehavior;

    /**
     * @param tests          the tests of the source that are going to run. Elements reporting
     *                       fixture outcomes are ignored.
     * @param runBehavior    cleanup timing set for the whole run, if any
     * @param sourceBehavior cleanup timing declared by the source, if any
     */
    public CompletionTracker(@Nonnull Collection<TestElement> tests,
                             @Nullable ClassCleanupBehavior runBehavior,
                             @Nullable ClassCleanupBehavior sourceBehavior) {
        for (TestElement test : tests) {
            if (test.isFixtureElement()) {
                continue;
            }
            testsByClass.computeIfAbsent(test.getClassName(), c -> new HashSet<>())
                    .add(test.getUniqueName());
        }
        this.remainingClasses = new AtomicInteger(testsByClass.size());
        this.runBehavior = runBehavior;
        this.sourceBehavior = sourceBehavior;
    }

    /**
     * Records that {@code test} completed.
     *
     * @param descriptor the test's class, {@code null} when it could not be resolved
     */
    @Nonnull
    public CompletionDecision markTestComplete(@Nonnull TestElement test,
                                               @Nullable ClassDescriptor descriptor) {
        Set<String> remaining = testsByClass.get(test.getClassName());
        if (remaining == null) {
            return CompletionDecision.NONE;
        }

        synchronized (remaining) {
            if (!remaining.remove(test.getUniqueName()) || !remaining.isEmpty()) {
                return CompletionDecision.NONE;
            }
            // Only the thread emptying the set gets here, and only once.
            testsByClass.remove(test.getClassName());
        }

        boolean runClassCleanup = descriptor != null && descriptor.hasExecutableCleanup()
                && effectiveBehavior(descriptor) == ClassCleanupBehavior.END_OF_CLASS;
        boolean runAssemblyCleanup = remainingClasses.decrementAndGet() == 0;
        log.debug("markTestComplete: {} done, class cleanup {}, assembly cleanup {}",
                test.getClassName(), runClassCleanup, runAssemblyCleanup);
        return new CompletionDecision(runClassCleanup, runAssemblyCleanup);
    }

    /**
     * Cleanup timing of a class: its own declaration, then the run setting, then the source
     * setting, then end of assembly.
     */
    @Nonnull
    public ClassCleanupBehavior effectiveBehavior(@Nonnull ClassDescriptor descriptor) {
        if (descriptor.getDeclaredCleanupBehavior() != ClassCleanupBehavior.DEFAULT) {
            return descriptor.getDeclaredCleanupBehavior();
        }
        if (runBehavior != null && runBehavior != ClassCleanupBehavior.DEFAULT) {
            return runBehavior;
        }
        if (sourceBehavior != null && sourceBehavior != ClassCleanupBehavior.DEFAULT) {
            return sourceBehavior;
        }
        return ClassCleanupBehavior.END_OF_ASSEMBLY;
    }

    /**
     * Whether some tracked test never reported completion.
     */
    public boolean hasPendingTests() {
        return remainingClasses.get() > 0;
    }

    @VisibleForTesting
    int remainingClassCount() {
        return remainingClasses.get();
    }
}
