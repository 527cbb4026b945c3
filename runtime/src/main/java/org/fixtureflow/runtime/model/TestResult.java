package org.fixtureflow.runtime.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import javax.annotation.Nullable;
import lombok.Data;
import lombok.experimental.Accessors;
import org.fixtureflow.runtime.exceptions.TestFailedException;

/**
 * Result of one invocation of a test, or of one data row of a data driven test.
 */
@Data
@Accessors(chain = true)
public class TestResult {

    private UnitTestOutcome outcome = UnitTestOutcome.ERROR;

    private Duration duration = Duration.ZERO;

    @Nullable
    private TestFailedException failure;

    private String standardOut = "";

    private String standardError = "";

    private String testContextMessages = "";

    /** Cleanup problems that did not change the outcome. */
    private final List<String> warnings = new ArrayList<>();

    private UUID executionId = UUID.randomUUID();

    @Nullable
    private UUID parentExecutionId;

    @Nullable
    private String displayName;

    /** Index of the data row, or -1 for tests without rows. */
    private int dataRowIndex = -1;

    private int attemptCount = 1;

    public static TestResult of(UnitTestOutcome outcome) {
        return new TestResult().setOutcome(outcome);
    }

    public static TestResult failed(TestFailedException failure) {
        return new TestResult().setOutcome(failure.getOutcome()).setFailure(failure);
    }

    @Nullable
    public String getErrorMessage() {
        return failure == null ? null : failure.getMessage();
    }

    public TestResult addWarning(String warning) {
        warnings.add(warning);
        return this;
    }

    public TestResult prependLogs(TestResult other) {
        standardOut = other.standardOut + standardOut;
        standardError = other.standardError + standardError;
        testContextMessages = other.testContextMessages + testContextMessages;
        return this;
    }

    public TestResult appendLogs(TestResult other) {
        standardOut = standardOut + other.standardOut;
        standardError = standardError + other.standardError;
        testContextMessages = testContextMessages + other.testContextMessages;
        return this;
    }

    /**
     * Copy carrying only the outcome and the failure. Used to hand a cached fixture result
     * to later tests without repeating the fixture's output.
     */
    public TestResult withoutLogs() {
        return new TestResult().setOutcome(outcome).setFailure(failure);
    }
}
