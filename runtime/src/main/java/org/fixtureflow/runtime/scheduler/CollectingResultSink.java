package org.fixtureflow.runtime.scheduler;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import org.fixtureflow.runtime.model.TestElement;
import org.fixtureflow.runtime.model.TestResult;

/**
 * Keeps every result in memory, keyed by unique name.
 */
public class CollectingResultSink implements ResultSink {

    private final Map<String, List<TestResult>> results = new LinkedHashMap<>();

    private final List<String> warnings = new ArrayList<>();

    @Override
    public synchronized void onResult(TestElement element, List<TestResult> results) {
        this.results.put(element.getUniqueName(), ImmutableList.copyOf(results));
    }

    @Override
    public synchronized void onWarning(String warning) {
        warnings.add(warning);
    }

    @Nullable
    public synchronized List<TestResult> resultsFor(String uniqueName) {
        return results.get(uniqueName);
    }

    /**
     * The single result of a test without data rows.
     */
    @Nullable
    public synchronized TestResult resultFor(String uniqueName) {
        List<TestResult> list = results.get(uniqueName);
        return list == null || list.isEmpty() ? null : list.get(list.size() - 1);
    }

    public synchronized Map<String, List<TestResult>> getResults() {
        return new LinkedHashMap<>(results);
    }

    public synchronized List<String> getWarnings() {
        return new ArrayList<>(warnings);
    }

    public synchronized int size() {
        return results.size();
    }
}
