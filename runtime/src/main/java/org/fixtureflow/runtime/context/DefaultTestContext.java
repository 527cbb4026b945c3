package org.fixtureflow.runtime.context;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nonnull;
import lombok.Getter;
import lombok.Setter;
import org.fixtureflow.api.CancellationToken;
import org.fixtureflow.api.TestContext;
import org.fixtureflow.runtime.model.UnitTestOutcome;

/**
 * Context of one test invocation or one fixture execution. Closing it detaches its token
 * from the run's.
 */
public class DefaultTestContext implements TestContext, AutoCloseable {

    @Getter
    private final String testName;

    @Getter
    private final String fullyQualifiedClassName;

    @Getter
    private final CancellationSource cancellationSource;

    @Getter
    private final LogBuffer logBuffer;

    @Getter
    private final Map<String, Object> properties = new ConcurrentHashMap<>();

    @Getter
    @Setter
    private volatile UnitTestOutcome outcome = UnitTestOutcome.IN_PROGRESS;

    public DefaultTestContext(@Nonnull String testName, @Nonnull String fullyQualifiedClassName,
                              @Nonnull CancellationSource cancellationSource,
                              @Nonnull LogBuffer logBuffer) {
        this.testName = testName;
        this.fullyQualifiedClassName = fullyQualifiedClassName;
        this.cancellationSource = cancellationSource;
        this.logBuffer = logBuffer;
    }

    /**
     * Context whose cancellation follows {@code runToken} and whose output goes to a buffer
     * of its own.
     */
    public static DefaultTestContext create(String testName, String className,
                                            CancellationToken runToken) {
        return new DefaultTestContext(testName, className,
                new CancellationSource().linkTo(runToken), new LogBuffer());
    }

    @Override
    public void close() {
        cancellationSource.unlink();
    }

    @Override
    public String getCurrentTestOutcome() {
        return outcome.name();
    }

    @Override
    public CancellationToken getCancellationToken() {
        return cancellationSource;
    }

    @Override
    public void writeLine(String message) {
        logBuffer.appendMessage(message);
    }

    @Override
    public void writeLine(String format, Object... args) {
        logBuffer.appendMessage(String.format(format, args));
    }
}
