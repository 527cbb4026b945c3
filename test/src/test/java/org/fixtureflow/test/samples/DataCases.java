package org.fixtureflow.test.samples;

import com.google.common.collect.ImmutableList;
import java.util.concurrent.atomic.AtomicInteger;
import org.fixtureflow.api.DynamicData;
import org.fixtureflow.api.Retry;
import org.fixtureflow.api.TestClass;
import org.fixtureflow.api.TestMethod;

@TestClass
public class DataCases {

    public static final AtomicInteger FLAKY_RUNS = new AtomicInteger();

    public static Iterable<Object[]> words() {
        return ImmutableList.of(new Object[] {"alpha", 5}, new Object[] {"beta", 4},
                new Object[] {"gamma", 4});
    }

    @TestMethod
    @DynamicData("words")
    public void lengthMatches(String word, int length) {
        if (word.length() != length) {
            throw new AssertionError(word + " has " + word.length() + " letters");
        }
    }

    @TestMethod
    @Retry(maxAttempts = 3)
    public void flaky() {
        if (FLAKY_RUNS.incrementAndGet() < 2) {
            throw new AssertionError("first run fails");
        }
    }
}
