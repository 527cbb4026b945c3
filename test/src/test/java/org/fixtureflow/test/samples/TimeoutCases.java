package org.fixtureflow.test.samples;

import java.util.concurrent.atomic.AtomicInteger;
import org.fixtureflow.api.TestCleanup;
import org.fixtureflow.api.TestClass;
import org.fixtureflow.api.TestContext;
import org.fixtureflow.api.TestMethod;
import org.fixtureflow.api.Timeout;
import org.fixtureflow.api.TimeoutMode;

@TestClass
public class TimeoutCases {

    public static final AtomicInteger CLEANUP = new AtomicInteger();

    private TestContext context;

    public void setTestContext(TestContext context) {
        this.context = context;
    }

    @TestMethod
    @Timeout(value = 100, mode = TimeoutMode.HARD)
    public void sleepsTooLong() throws InterruptedException {
        Thread.sleep(10_000);
    }

    @TestMethod
    @Timeout(value = 100, mode = TimeoutMode.COOPERATIVE)
    public void stopsWhenAsked() throws InterruptedException {
        while (true) {
            context.getCancellationToken().throwIfCancellationRequested();
            Thread.sleep(5);
        }
    }

    @TestMethod
    @Timeout(5_000)
    public void finishesInTime() {
    }

    @TestCleanup
    public void tearDown() {
        CLEANUP.incrementAndGet();
    }
}
