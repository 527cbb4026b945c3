package org.fixtureflow.runtime.metadata;

import com.google.common.collect.ImmutableList;
import java.lang.reflect.Method;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.fixtureflow.runtime.model.TestSource;

/**
 * Fixtures and global hooks declared anywhere in a test source.
 */
@Builder
@Getter
public class AssemblyDescriptor {

    @NonNull
    private final TestSource source;

    @Nullable
    private final FixtureMethod assemblyInitialize;

    @Nullable
    private final FixtureMethod assemblyCleanup;

    @NonNull
    private final ImmutableList<Method> globalTestInitialize;

    @NonNull
    private final ImmutableList<Method> globalTestCleanup;

    public String getSourceId() {
        return source.getId();
    }
}
