package org.fixtureflow.test.samples;

import java.util.concurrent.atomic.AtomicInteger;
import org.fixtureflow.api.ClassCleanup;
import org.fixtureflow.api.ClassInitialize;
import org.fixtureflow.api.TestClass;
import org.fixtureflow.api.TestContext;
import org.fixtureflow.api.TestMethod;

/**
 * Ten quick tests sharing a class fixture whose cleanup waits for the end of the source.
 */
@TestClass
public class CancelableCases {

    public static final AtomicInteger TESTS_RUN = new AtomicInteger();

    public static final AtomicInteger CLEANUP = new AtomicInteger();

    public static volatile boolean failCleanup = false;

    public static void reset() {
        TESTS_RUN.set(0);
        CLEANUP.set(0);
        failCleanup = false;
    }

    @ClassInitialize
    public static void init(TestContext context) {
    }

    @ClassCleanup
    public static void cleanup() {
        CLEANUP.incrementAndGet();
        if (failCleanup) {
            throw new IllegalStateException("cleanup broke");
        }
    }

    @TestMethod
    public void test0() {
        TESTS_RUN.incrementAndGet();
    }

    @TestMethod
    public void test1() {
        TESTS_RUN.incrementAndGet();
    }

    @TestMethod
    public void test2() {
        TESTS_RUN.incrementAndGet();
    }

    @TestMethod
    public void test3() {
        TESTS_RUN.incrementAndGet();
    }

    @TestMethod
    public void test4() {
        TESTS_RUN.incrementAndGet();
    }

    @TestMethod
    public void test5() {
        TESTS_RUN.incrementAndGet();
    }

    @TestMethod
    public void test6() {
        TESTS_RUN.incrementAndGet();
    }

    @TestMethod
    public void test7() {
        TESTS_RUN.incrementAndGet();
    }

    @TestMethod
    public void test8() {
        TESTS_RUN.incrementAndGet();
    }

    @TestMethod
    public void test9() {
        TESTS_RUN.incrementAndGet();
    }
}
