package org.fixtureflow.runtime.fixture;

import java.util.List;
import lombok.Getter;
import org.fixtureflow.runtime.exceptions.TestFailedException;
import org.fixtureflow.runtime.metadata.ClassDescriptor;
import org.fixtureflow.runtime.metadata.FixtureMethod;
import org.fixtureflow.runtime.model.FixtureKind;
import org.fixtureflow.util.ExceptionUtil;

/**
 * Class initialize and cleanup of one test class, base class fixtures included.
 */
public class ClassFixtureState extends FixtureState {

    @Getter
    private final ClassDescriptor descriptor;

    public ClassFixtureState(ClassDescriptor descriptor, FixtureMethodRunner runner) {
        super(runner);
        this.descriptor = descriptor;
    }

    @Override
    public String getScopeName() {
        return descriptor.getClassName();
    }

    @Override
    protected List<FixtureMethod> initializeChain() {
        return descriptor.getInitializeChain();
    }

    @Override
    protected List<FixtureMethod> cleanupChain() {
        return descriptor.getCleanupChain();
    }

    @Override
    protected FixtureKind initializeKind() {
        return FixtureKind.CLASS_INITIALIZE;
    }

    @Override
    protected FixtureKind cleanupKind() {
        return FixtureKind.CLASS_CLEANUP;
    }

    /**
     * A class whose initialize never ran had no test executed: nothing to clean up.
     */
    @Override
    protected boolean isCleanupAllowed() {
        return isInitializeExecuted();
    }

    @Override
    protected TestFailedException initializeFailure(FixtureMethod method, Throwable thrown) {
        return new TestFailedException(ExceptionUtil.outcomeOf(thrown),
                "Class Initialization method " + method + " threw exception. "
                        + ExceptionUtil.formattedMessage(thrown) + ".",
                ExceptionUtil.stackTrace(thrown), thrown);
    }
}
