package org.fixtureflow.runtime.scheduler;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.fixtureflow.api.ExecutionScope;
import org.fixtureflow.runtime.ExecutionSettings;
import org.fixtureflow.runtime.completion.CompletionTracker;
import org.fixtureflow.runtime.context.CancellationSource;
import org.fixtureflow.runtime.exceptions.SchedulerException;
import org.fixtureflow.runtime.exceptions.TestFailedException;
import org.fixtureflow.runtime.exceptions.TypeInspectionException;
import org.fixtureflow.runtime.exceptions.UnrecoverableInterruptedError;
import org.fixtureflow.runtime.execution.TestMethodRunner;
import org.fixtureflow.runtime.execution.UnitTestRunner;
import org.fixtureflow.runtime.fixture.FixtureStore;
import org.fixtureflow.runtime.metadata.MetadataCache;
import org.fixtureflow.runtime.metadata.TestMethodDescriptor;
import org.fixtureflow.runtime.model.SourceSettings;
import org.fixtureflow.runtime.model.TestElement;
import org.fixtureflow.runtime.model.TestResult;
import org.fixtureflow.runtime.model.TestSource;
import org.fixtureflow.runtime.model.UnitTestOutcome;
import org.fixtureflow.util.ExceptionUtil;

/**
 * Runs a fixed set of tests, source after source.
 *
 * <p>Within a source the tests allowed to run in parallel are queued as work units and
 * drained by a fixed pool of workers. The remaining tests run afterwards on the calling
 * thread. Every worker checks the run's cancellation before taking a unit: units already
 * taken run to their end, no other unit starts.
 */
@Slf4j
public class Scheduler {

    private final ExecutionSettings settings;

    private final MetadataCache metadata;

    private final FixtureStore fixtures;

    private final TestMethodRunner methodRunner;

    private final CancellationSource cancellation;

    @Builder
    public Scheduler(@NonNull ExecutionSettings settings, @NonNull MetadataCache metadata,
                     @NonNull FixtureStore fixtures, @NonNull TestMethodRunner methodRunner,
                     @NonNull CancellationSource cancellation) {
        this.settings = settings;
        this.metadata = metadata;
        this.fixtures = fixtures;
        this.methodRunner = methodRunner;
        this.cancellation = cancellation;
    }

    /**
     * Runs {@code elements}, reporting to {@code sink} as results come.
     *
     * @param sources the sources the elements belong to, by id
     */
    public void run(@Nonnull List<TestElement> elements, @Nonnull Map<String, TestSource> sources,
                    @Nonnull ResultSink sink) {
        Map<String, List<TestElement>> bySource = elements.stream()
                .collect(Collectors.groupingBy(TestElement::getSourceId, LinkedHashMap::new,
                        Collectors.toList()));

        for (Map.Entry<String, List<TestElement>> entry : bySource.entrySet()) {
            if (cancellation.isCancellationRequested()) {
                log.info("run: canceled, skipping source {}", entry.getKey());
                break;
            }
            TestSource source = sources.get(entry.getKey());
            if (source == null) {
                for (TestElement element : entry.getValue()) {
                    sink.onResult(element, ImmutableList.of(TestResult.failed(
                            new TestFailedException(UnitTestOutcome.NOT_FOUND, "Test source "
                                    + entry.getKey() + " was not found."))));
                }
                continue;
            }
            runSource(source, entry.getValue(), sink);
        }
    }

    private void runSource(TestSource source, List<TestElement> elements, ResultSink sink) {
        List<TestElement> fixtureElements = new ArrayList<>();
        List<TestElement> tests = new ArrayList<>();
        for (TestElement element : elements) {
            (element.isFixtureElement() ? fixtureElements : tests).add(element);
        }

        SourceSettings declared = source.getSettings();
        CompletionTracker tracker = new CompletionTracker(tests,
                settings.getClassCleanupBehavior(), declared.getClassCleanupBehavior());
        UnitTestRunner runner = UnitTestRunner.builder()
                .source(source)
                .metadata(metadata)
                .fixtures(fixtures)
                .methodRunner(methodRunner)
                .tracker(tracker)
                .runToken(cancellation)
                .warnings(sink::onWarning)
                .build();

        try {
            int workers = effectiveWorkers(declared);
            if (workers > 0) {
                List<TestElement> parallel = new ArrayList<>();
                List<TestElement> sequential = new ArrayList<>();
                for (TestElement test : tests) {
                    (isDoNotParallelize(source, test) ? sequential : parallel).add(test);
                }
                ExecutionScope scope = settings.getParallelScope() != null
                        ? settings.getParallelScope()
                        : declared.getParallelScope() != null
                        ? declared.getParallelScope()
                        : ExecutionScope.CLASS_LEVEL;
                log.info("runSource: {} running {} tests on {} workers at {}, {} sequentially",
                        source.getId(), parallel.size(), workers, scope, sequential.size());
                runParallel(runner, buildQueue(parallel, scope), workers, sink);
                runSequential(runner, sequential, sink);
            } else {
                log.info("runSource: {} running {} tests sequentially", source.getId(),
                        tests.size());
                runSequential(runner, tests, sink);
            }
        } finally {
            runner.forceCleanup();
            for (TestElement element : fixtureElements) {
                sink.onResult(element, runner.fixtureResult(element));
            }
        }
    }

    /**
     * Workers for a source, 0 when it runs sequentially. A declared count of 0 means one
     * worker per available processor.
     */
    @VisibleForTesting
    int effectiveWorkers(SourceSettings declared) {
        if (settings.isDisableParallelization() || declared.isDoNotParallelize()) {
            return 0;
        }
        Integer workers = settings.getParallelWorkers() != null
                ? settings.getParallelWorkers()
                : declared.getParallelWorkers();
        if (workers == null || workers < 0) {
            return 0;
        }
        return workers == 0 ? Runtime.getRuntime().availableProcessors() : workers;
    }

    @VisibleForTesting
    Queue<WorkUnit> buildQueue(List<TestElement> tests, ExecutionScope scope) {
        Queue<WorkUnit> queue = new ConcurrentLinkedQueue<>();
        if (scope == ExecutionScope.METHOD_LEVEL) {
            tests.forEach(t -> queue.add(new WorkUnit(t.getUniqueName(), ImmutableList.of(t))));
            return queue;
        }
        groupByClass(tests).forEach((className, classTests) ->
                queue.add(new WorkUnit(className, ImmutableList.copyOf(classTests))));
        return queue;
    }

    private void runParallel(UnitTestRunner runner, Queue<WorkUnit> queue, int workers,
                             ResultSink sink) {
        if (queue.isEmpty()) {
            return;
        }
        ExecutorService service = Executors.newFixedThreadPool(workers,
                new ThreadFactoryBuilder()
                        .setDaemon(true)
                        .setNameFormat("fixtureflow-worker-%d")
                        .build());
        try {
            List<Future<Void>> futures = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                Callable<Void> worker = () -> {
                    drain(runner, queue, sink);
                    return null;
                };
                futures.add(service.submit(worker));
            }
            service.shutdown();

            Map<Integer, Throwable> exceptionMap = new HashMap<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get();
                } catch (ExecutionException e) {
                    log.error("runParallel: worker {} died", i, e.getCause());
                    exceptionMap.put(i, e.getCause());
                }
            }
            if (!exceptionMap.isEmpty()) {
                throw new SchedulerException(exceptionMap);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UnrecoverableInterruptedError(e);
        } finally {
            service.shutdownNow();
        }
    }

    private void drain(UnitTestRunner runner, Queue<WorkUnit> queue, ResultSink sink) {
        while (!cancellation.isCancellationRequested()) {
            WorkUnit unit = queue.poll();
            if (unit == null) {
                return;
            }
            log.debug("drain: running {}", unit.getName());
            for (TestElement test : unit.getTests()) {
                runOne(runner, test, sink);
            }
        }
    }

    private void runSequential(UnitTestRunner runner, List<TestElement> tests, ResultSink sink) {
        for (List<TestElement> classTests : groupByClass(tests).values()) {
            for (TestElement test : classTests) {
                if (cancellation.isCancellationRequested()) {
                    return;
                }
                runOne(runner, test, sink);
            }
        }
    }

    /**
     * Runs a test and reports it. Failures of the engine become an error result for the test
     * rather than ending the run.
     */
    private void runOne(UnitTestRunner runner, TestElement test, ResultSink sink) {
        List<TestResult> results;
        try {
            results = runner.runSingleTest(test);
        } catch (RuntimeException e) {
            log.error("runOne: unexpected error running {}", test.getUniqueName(), e);
            results = ImmutableList.of(TestResult.failed(new TestFailedException(
                    UnitTestOutcome.ERROR, "An unexpected error occurred while running test "
                    + test.getUniqueName() + ". " + ExceptionUtil.formattedMessage(e),
                    ExceptionUtil.stackTrace(e), e)));
        }
        UnitTestOutcome outcome = TestMethodRunner.aggregateOutcome(results);
        if (outcome != UnitTestOutcome.PASSED) {
            log.debug("Test {} failed with outcome {}", test.getUniqueName(), outcome);
        }
        sink.onResult(test, results);
    }

    /**
     * Tests grouped by class in order of first appearance, each group in discovery order or
     * by unique name.
     */
    private Map<String, List<TestElement>> groupByClass(List<TestElement> tests) {
        Map<String, List<TestElement>> byClass = tests.stream()
                .collect(Collectors.groupingBy(TestElement::getClassName, LinkedHashMap::new,
                        Collectors.toList()));
        if (settings.isOrderTestsByNameInClass()) {
            byClass.values().forEach(l -> l.sort(Comparator.comparing(TestElement::getUniqueName)));
        }
        return byClass;
    }

    private boolean isDoNotParallelize(TestSource source, TestElement test) {
        if (test.isDoNotParallelize()) {
            return true;
        }
        try {
            TestMethodDescriptor descriptor = metadata.resolveMethod(source, test);
            return descriptor != null && descriptor.isDoNotParallelize();
        } catch (TypeInspectionException e) {
            // reported when the test runs
            return false;
        }
    }
}
