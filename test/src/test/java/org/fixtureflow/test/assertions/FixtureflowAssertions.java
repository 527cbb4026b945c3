package org.fixtureflow.test.assertions;

import org.assertj.core.api.Assertions;
import org.fixtureflow.runtime.model.TestResult;

public class FixtureflowAssertions extends Assertions {

    public static TestResultAssert assertThat(TestResult actual) {
        return new TestResultAssert(actual);
    }
}
