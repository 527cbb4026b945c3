package org.fixtureflow.test.samples;

import org.fixtureflow.api.ClassCleanup;
import org.fixtureflow.api.ClassCleanupBehavior;
import org.fixtureflow.api.ClassInitialize;
import org.fixtureflow.api.TestClass;
import org.fixtureflow.api.TestContext;
import org.fixtureflow.api.TestMethod;

@TestClass
public class FirstCases {

    @ClassInitialize
    public static void init(TestContext context) {
        AssemblyHooks.EVENTS.add("init:first");
    }

    @ClassCleanup(behavior = ClassCleanupBehavior.END_OF_CLASS)
    public static void cleanup() {
        AssemblyHooks.EVENTS.add("cleanup:first");
    }

    @TestMethod
    public void one() {
        AssemblyHooks.EVENTS.add("test:first");
    }

    @TestMethod
    public void two() {
        AssemblyHooks.EVENTS.add("test:first");
    }

    @TestMethod
    public void three() {
        AssemblyHooks.EVENTS.add("test:first");
    }
}
