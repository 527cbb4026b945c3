package org.fixtureflow.runtime.execution;

import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;
import org.fixtureflow.runtime.exceptions.TestFailedException;
import org.fixtureflow.runtime.metadata.TestMethodDescriptor;
import org.fixtureflow.runtime.model.TestResult;
import org.fixtureflow.runtime.model.UnitTestOutcome;
import org.fixtureflow.runtime.retry.RetryContext;
import org.fixtureflow.runtime.retry.RetryPolicy;
import org.fixtureflow.runtime.retry.RetryResult;
import org.fixtureflow.util.ExceptionUtil;

/**
 * Runs a resolved test: expands its data rows, retries it when its policy asks for it and
 * never lets an exception escape.
 */
@Slf4j
public class TestMethodRunner {

    private final TestInvoker invoker;

    public TestMethodRunner(@Nonnull TestInvoker invoker) {
        this.invoker = invoker;
    }

    /**
     * @param initializationLogs output of the shared fixtures run for this test, reported
     *                           with the first result
     * @return one result, or one per data row, never empty
     */
    @Nonnull
    public List<TestResult> execute(@Nonnull TestMethodDescriptor test,
                                    @Nonnull TestResult initializationLogs) {
        List<TestResult> results = safeRun(test);

        RetryPolicy retryPolicy = test.getRetryPolicy();
        if (retryPolicy != null && !RetryPolicy.isAcceptable(results)) {
            RetryResult retry = retryPolicy.execute(new RetryContext(() -> safeRun(test), results));
            log.debug("execute: {}.{} ran {} times", test.getClassName(), test.getName(),
                    retry.getAttemptCount());
            results = retry.last();
        }

        results.get(0).prependLogs(initializationLogs);
        return results;
    }

    /**
     * Most important outcome among the results.
     */
    @Nonnull
    public static UnitTestOutcome aggregateOutcome(@Nonnull List<TestResult> results) {
        UnitTestOutcome aggregate = UnitTestOutcome.PASSED;
        for (TestResult result : results) {
            aggregate = aggregate.moreImportant(result.getOutcome());
        }
        return aggregate;
    }

    private List<TestResult> safeRun(TestMethodDescriptor test) {
        try {
            List<TestResult> results = run(test);
            if (results.isEmpty()) {
                return Lists.newArrayList(TestResult.failed(new TestFailedException(
                        UnitTestOutcome.ERROR, "No test result was produced for test method "
                        + test.getClassName() + "." + test.getName() + ".")));
            }
            return results;
        } catch (TestFailedException e) {
            return Lists.newArrayList(TestResult.failed(e));
        } catch (RuntimeException e) {
            log.error("safeRun: unexpected error running {}.{}", test.getClassName(),
                    test.getName(), e);
            return Lists.newArrayList(TestResult.failed(new TestFailedException(
                    UnitTestOutcome.ERROR, "Exception thrown while executing test. "
                    + ExceptionUtil.formattedMessage(e), ExceptionUtil.stackTrace(e), e)));
        }
    }

    private List<TestResult> run(TestMethodDescriptor test) {
        if (!test.isDataDriven()) {
            return Lists.newArrayList(invoker.invoke(test, null));
        }

        List<Object[]> rows = readRows(test);
        UUID parentExecutionId = UUID.randomUUID();
        List<TestResult> results = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Object[] row = rows.get(i);
            TestResult result = invoker.invoke(test, row)
                    .setDataRowIndex(i)
                    .setParentExecutionId(parentExecutionId)
                    .setDisplayName(test.getName() + " (" + Arrays.stream(row)
                            .map(String::valueOf)
                            .collect(Collectors.joining(", ")) + ")");
            results.add(result);
        }
        return results;
    }

    private static List<Object[]> readRows(TestMethodDescriptor test) {
        try {
            Iterable<?> source = (Iterable<?>) test.getDataSource().invoke(null);
            List<Object[]> rows = new ArrayList<>();
            if (source == null) {
                return rows;
            }
            for (Object row : source) {
                rows.add(row instanceof Object[] ? (Object[]) row : new Object[] {row});
            }
            return rows;
        } catch (Throwable t) {
            Throwable real = ExceptionUtil.unwrap(t);
            throw new TestFailedException(UnitTestOutcome.FAILED, "Unable to read the data rows "
                    + "of test method " + test.getClassName() + "." + test.getName() + ". "
                    + ExceptionUtil.formattedMessage(real), ExceptionUtil.stackTrace(real), real);
        }
    }
}
