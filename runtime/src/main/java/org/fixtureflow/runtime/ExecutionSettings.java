package org.fixtureflow.runtime;

import java.time.Duration;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NonNull;
import org.fixtureflow.api.ClassCleanupBehavior;
import org.fixtureflow.api.ExecutionScope;

/**
 * Run wide settings. Values set here override what a test source declares.
 */
@Builder(toBuilder = true)
@Getter
public class ExecutionSettings {

    public static final ExecutionSettings DEFAULT = ExecutionSettings.builder().build();

    /**
     * Number of parallel workers. {@code null} defers to the source, {@code 0} means one per
     * available processor and a negative count disables parallel execution.
     */
    @Nullable
    private final Integer parallelWorkers;

    @Nullable
    private final ExecutionScope parallelScope;

    private final boolean disableParallelization;

    @Nullable
    private final ClassCleanupBehavior classCleanupBehavior;

    /** Run the tests of a class ordered by unique name instead of discovery order. */
    private final boolean orderTestsByNameInClass;

    /**
     * Whether tests without an explicit timeout mode use cooperative cancellation instead of
     * running on a dedicated thread.
     */
    private final boolean cooperativeCancellation;

    /** Timeout applied to tests that declare none. {@link Duration#ZERO} means none. */
    @Default
    @NonNull
    private final Duration defaultTestTimeout = Duration.ZERO;

    /** Timeout applied to fixture methods that declare none. */
    @Default
    @NonNull
    private final Duration defaultFixtureTimeout = Duration.ZERO;

    /** Redirect {@code System.out} and {@code System.err} into the results. */
    @Default
    private final boolean captureOutput = true;
}
