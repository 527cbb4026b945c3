package org.fixtureflow.runtime.metadata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.fixtureflow.runtime.ExecutionSettings;
import org.fixtureflow.runtime.exceptions.SchedulerException;
import org.fixtureflow.runtime.model.TestElement;
import org.fixtureflow.runtime.model.TestSource;
import org.fixtureflow.test.concurrent.ConcurrentScheduler;
import org.fixtureflow.test.samples.SharedClassFixture;
import org.junit.Test;

public class ConcurrentResolutionTest {

    private static final int THREADS = 8;

    private static final int ITERATIONS = 64;

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final TestSource source = TestSource.of("concurrent", SharedClassFixture.class);

    @Test
    public void everyThreadSeesTheSameDescriptor() {
        MetadataCache cache = new MetadataCache(ExecutionSettings.DEFAULT);
        Set<ClassDescriptor> classes = ConcurrentHashMap.newKeySet();
        Set<TestMethodDescriptor> methods = ConcurrentHashMap.newKeySet();
        ConcurrentScheduler scheduler = new ConcurrentScheduler();

        scheduler.schedule(ITERATIONS, i -> {
            classes.add(cache.resolveClass(source, SharedClassFixture.class.getName()));
            methods.add(cache.resolveMethod(source,
                    TestElement.of("concurrent", SharedClassFixture.class, "first")));
        });
        scheduler.execute(THREADS, TIMEOUT);

        assertThat(classes).hasSize(1);
        assertThat(methods).hasSize(1);
        assertThat(methods.iterator().next().getParent()).isSameAs(classes.iterator().next());
    }

    @Test
    public void failingOperationsAreCollected() {
        ConcurrentScheduler scheduler = new ConcurrentScheduler();

        scheduler.schedule(4, i -> {
            if (i % 2 == 0) {
                throw new IllegalStateException("iteration " + i);
            }
        });

        Throwable thrown = catchThrowable(() -> scheduler.execute(2, TIMEOUT));

        assertThat(thrown).isInstanceOf(SchedulerException.class);
        assertThat(((SchedulerException) thrown).getExceptionMap()).containsOnlyKeys(0, 2);
    }
}
