package org.fixtureflow.runtime;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.fixtureflow.runtime.context.CancellationSource;
import org.fixtureflow.runtime.context.OutputCapture;
import org.fixtureflow.runtime.execution.TestInvoker;
import org.fixtureflow.runtime.execution.TestMethodRunner;
import org.fixtureflow.runtime.execution.timeout.TimeoutStrategies;
import org.fixtureflow.runtime.fixture.FixtureMethodRunner;
import org.fixtureflow.runtime.fixture.FixtureStore;
import org.fixtureflow.runtime.metadata.MetadataCache;
import org.fixtureflow.runtime.model.TestElement;
import org.fixtureflow.runtime.model.TestSource;
import org.fixtureflow.runtime.scheduler.ResultSink;
import org.fixtureflow.runtime.scheduler.Scheduler;

/**
 * One execution of a set of tests. Owns everything whose lifetime is the run: the metadata
 * cache, the fixture states and the timeout threads. Two runs share nothing.
 *
 * <pre>{@code
 * try (TestRun run = new TestRun(ExecutionSettings.DEFAULT)) {
 *     run.execute(elements, sources, sink);
 * }
 * }</pre>
 */
@Slf4j
public class TestRun implements AutoCloseable {

    @Getter
    private final ExecutionSettings settings;

    private final CancellationSource cancellation = new CancellationSource();

    private final TimeoutStrategies timeouts = new TimeoutStrategies();

    private final Scheduler scheduler;

    public TestRun(@Nonnull ExecutionSettings settings) {
        this.settings = settings;
        if (settings.isCaptureOutput()) {
            OutputCapture.install();
        }
        MetadataCache metadata = new MetadataCache(settings);
        FixtureStore fixtures = new FixtureStore(new FixtureMethodRunner(timeouts));
        TestMethodRunner methodRunner = new TestMethodRunner(
                new TestInvoker(timeouts, cancellation));
        this.scheduler = Scheduler.builder()
                .settings(settings)
                .metadata(metadata)
                .fixtures(fixtures)
                .methodRunner(methodRunner)
                .cancellation(cancellation)
                .build();
    }

    public void execute(@Nonnull List<TestElement> elements,
                        @Nonnull Collection<TestSource> sources, @Nonnull ResultSink sink) {
        Map<String, TestSource> byId = sources.stream()
                .collect(Collectors.toMap(TestSource::getId, Function.identity()));
        log.info("execute: {} tests from {} sources", elements.size(), byId.size());
        scheduler.run(elements, byId, sink);
        log.info("execute: done{}", cancellation.isCancellationRequested() ? " (canceled)" : "");
    }

    /**
     * Stops the run: no test starts after this call. Tests already running are asked to stop
     * through their cancellation token.
     */
    public void cancel() {
        log.info("cancel: run canceled");
        cancellation.cancel();
    }

    public boolean isCanceled() {
        return cancellation.isCancellationRequested();
    }

    @Override
    public void close() {
        timeouts.close();
    }
}
