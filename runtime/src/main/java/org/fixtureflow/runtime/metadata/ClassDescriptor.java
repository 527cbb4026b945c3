package org.fixtureflow.runtime.metadata;

import com.google.common.collect.ImmutableList;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.fixtureflow.api.ClassCleanupBehavior;

/**
 * Everything needed to run the tests of one class, computed once when the class is first
 * resolved.
 *
 * <p>Fixture chains are stored in execution order: {@link #getInitializeChain()} starts with
 * the top-most base class, {@link #getCleanupChain()} with the class itself. The same holds
 * for the per-test initialize and cleanup lists.
 */
@Builder
@Getter
public class ClassDescriptor {

    @NonNull
    private final AssemblyDescriptor parent;

    @NonNull
    private final Class<?> type;

    @NonNull
    private final Constructor<?> constructor;

    @Nullable
    private final Method contextSetter;

    @NonNull
    private final ImmutableList<FixtureMethod> initializeChain;

    @NonNull
    private final ImmutableList<FixtureMethod> cleanupChain;

    @NonNull
    private final ImmutableList<Method> testInitialize;

    @NonNull
    private final ImmutableList<Method> testCleanup;

    /** Cleanup timing declared on the class cleanup method, if any. */
    @NonNull
    private final ClassCleanupBehavior declaredCleanupBehavior;

    private final boolean ignored;

    @Nullable
    private final String ignoreMessage;

    private final boolean doNotParallelize;

    public String getClassName() {
        return type.getName();
    }

    public String getSourceId() {
        return parent.getSourceId();
    }

    public boolean hasExecutableCleanup() {
        return !cleanupChain.isEmpty();
    }

    public boolean constructorTakesContext() {
        return constructor.getParameterCount() == 1;
    }
}
