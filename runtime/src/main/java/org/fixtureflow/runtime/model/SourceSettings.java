package org.fixtureflow.runtime.model;

import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Getter;
import org.fixtureflow.api.ClassCleanupBehavior;
import org.fixtureflow.api.ExecutionScope;

/**
 * Execution settings declared by a test source itself. Run level settings override them.
 */
@Builder
@Getter
public class SourceSettings {

    public static final SourceSettings EMPTY = SourceSettings.builder().build();

    @Nullable
    private final Integer parallelWorkers;

    @Nullable
    private final ExecutionScope parallelScope;

    private final boolean doNotParallelize;

    @Nullable
    private final ClassCleanupBehavior classCleanupBehavior;
}
