package org.fixtureflow.test.assertions;

import org.assertj.core.api.AbstractAssert;
import org.fixtureflow.runtime.model.TestResult;
import org.fixtureflow.runtime.model.UnitTestOutcome;

public class TestResultAssert extends AbstractAssert<TestResultAssert, TestResult> {

    public TestResultAssert(TestResult actual) {
        super(actual, TestResultAssert.class);
    }

    public TestResultAssert hasOutcome(UnitTestOutcome expected) {
        isNotNull();

        if (actual.getOutcome() != expected) {
            failWithMessage("Expected outcome <%s> but was <%s> (%s)",
                    expected, actual.getOutcome(), actual.getErrorMessage());
        }

        return this;
    }

    public TestResultAssert passed() {
        return hasOutcome(UnitTestOutcome.PASSED);
    }

    public TestResultAssert hasErrorMessage(String expected) {
        isNotNull();

        if (!expected.equals(actual.getErrorMessage())) {
            failWithMessage("Expected error message <%s> but was <%s>",
                    expected, actual.getErrorMessage());
        }

        return this;
    }

    public TestResultAssert hasErrorMessageContaining(String expected) {
        isNotNull();

        String message = actual.getErrorMessage();
        if (message == null || !message.contains(expected)) {
            failWithMessage("Expected error message containing <%s> but was <%s>",
                    expected, message);
        }

        return this;
    }

    public TestResultAssert hasWarningContaining(String expected) {
        isNotNull();

        if (actual.getWarnings().stream().noneMatch(w -> w.contains(expected))) {
            failWithMessage("Expected a warning containing <%s> but warnings were <%s>",
                    expected, actual.getWarnings());
        }

        return this;
    }
}
