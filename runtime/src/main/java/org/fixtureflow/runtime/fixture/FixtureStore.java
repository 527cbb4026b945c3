package org.fixtureflow.runtime.fixture;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.fixtureflow.runtime.metadata.AssemblyDescriptor;
import org.fixtureflow.runtime.metadata.ClassDescriptor;

/**
 * Fixture states of one run, created on first access and kept until the run ends.
 */
public class FixtureStore {

    private final FixtureMethodRunner runner;

    private final Map<String, AssemblyFixtureState> assemblies = new ConcurrentHashMap<>();

    private final Map<String, ClassFixtureState> classes = new ConcurrentHashMap<>();

    public FixtureStore(@Nonnull FixtureMethodRunner runner) {
        this.runner = runner;
    }

    @Nonnull
    public AssemblyFixtureState forAssembly(@Nonnull AssemblyDescriptor descriptor) {
        return assemblies.computeIfAbsent(descriptor.getSourceId(),
                id -> new AssemblyFixtureState(descriptor, runner));
    }

    @Nonnull
    public ClassFixtureState forClass(@Nonnull ClassDescriptor descriptor) {
        return classes.computeIfAbsent(key(descriptor.getSourceId(), descriptor.getClassName()),
                k -> new ClassFixtureState(descriptor, runner));
    }

    @Nullable
    public AssemblyFixtureState findAssembly(@Nonnull String sourceId) {
        return assemblies.get(sourceId);
    }

    @Nullable
    public ClassFixtureState findClass(@Nonnull String sourceId, @Nonnull String className) {
        return classes.get(key(sourceId, className));
    }

    /**
     * States of the given classes whose cleanup is still to run, in the given order.
     */
    @Nonnull
    public List<ClassFixtureState> pendingClassCleanups(@Nonnull List<ClassDescriptor> candidates) {
        return candidates.stream()
                .map(d -> classes.get(key(d.getSourceId(), d.getClassName())))
                .filter(Objects::nonNull)
                .filter(s -> s.isInitializeExecuted() && !s.isCleanupExecuted())
                .collect(Collectors.toList());
    }

    private static String key(String sourceId, String className) {
        return sourceId + "::" + className;
    }
}
