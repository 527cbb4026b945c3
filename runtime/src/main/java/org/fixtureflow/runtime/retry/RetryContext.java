package org.fixtureflow.runtime.retry;

import java.util.List;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.fixtureflow.runtime.model.TestResult;

@Getter
@RequiredArgsConstructor
public class RetryContext {

    /** Runs the test once more on a fresh instance. */
    @NonNull
    private final Supplier<List<TestResult>> executeTask;

    @NonNull
    private final List<TestResult> firstRunResults;
}
