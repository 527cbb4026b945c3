package org.fixtureflow.runtime.metadata;

import java.lang.reflect.Method;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.fixtureflow.runtime.retry.RetryPolicy;

/**
 * A resolved test method. Immutable and shared by every worker running the test.
 */
@Builder
@Getter
public class TestMethodDescriptor {

    @NonNull
    private final ClassDescriptor parent;

    @NonNull
    private final Method method;

    @Nullable
    private final TimeoutInfo timeout;

    @Nullable
    private final RetryPolicy retryPolicy;

    @Nullable
    private final ExpectedExceptionVerifier expectedException;

    private final boolean doNotParallelize;

    private final boolean ignored;

    @Nullable
    private final String ignoreMessage;

    /** Why the method cannot be run, {@code null} when it can. */
    @Nullable
    private final String notRunnableReason;

    /** Static method supplying the data rows, {@code null} for plain tests. */
    @Nullable
    private final Method dataSource;

    public boolean isRunnable() {
        return notRunnableReason == null;
    }

    public boolean isDataDriven() {
        return dataSource != null;
    }

    public String getName() {
        return method.getName();
    }

    public String getClassName() {
        return parent.getClassName();
    }
}
