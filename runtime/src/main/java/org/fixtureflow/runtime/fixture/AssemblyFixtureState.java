package org.fixtureflow.runtime.fixture;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.fixtureflow.runtime.exceptions.TestFailedException;
import org.fixtureflow.runtime.metadata.AssemblyDescriptor;
import org.fixtureflow.runtime.metadata.FixtureMethod;
import org.fixtureflow.runtime.model.FixtureKind;
import org.fixtureflow.util.ExceptionUtil;

/**
 * Assembly initialize and cleanup of one test source.
 */
public class AssemblyFixtureState extends FixtureState {

    @Getter
    private final AssemblyDescriptor descriptor;

    public AssemblyFixtureState(AssemblyDescriptor descriptor, FixtureMethodRunner runner) {
        super(runner);
        this.descriptor = descriptor;
    }

    @Override
    public String getScopeName() {
        return descriptor.getSourceId();
    }

    @Override
    protected List<FixtureMethod> initializeChain() {
        return descriptor.getAssemblyInitialize() == null
                ? ImmutableList.of() : ImmutableList.of(descriptor.getAssemblyInitialize());
    }

    @Override
    protected List<FixtureMethod> cleanupChain() {
        return descriptor.getAssemblyCleanup() == null
                ? ImmutableList.of() : ImmutableList.of(descriptor.getAssemblyCleanup());
    }

    @Override
    protected FixtureKind initializeKind() {
        return FixtureKind.ASSEMBLY_INITIALIZE;
    }

    @Override
    protected FixtureKind cleanupKind() {
        return FixtureKind.ASSEMBLY_CLEANUP;
    }

    @Override
    protected TestFailedException initializeFailure(FixtureMethod method, Throwable thrown) {
        return new TestFailedException(ExceptionUtil.outcomeOf(thrown),
                "Assembly Initialization method " + method + " threw exception. "
                        + ExceptionUtil.formattedMessage(thrown) + ". Aborting test execution.",
                ExceptionUtil.stackTrace(thrown), thrown);
    }
}
