package org.fixtureflow.test.samples;

import org.fixtureflow.api.ClassCleanup;
import org.fixtureflow.api.ClassCleanupBehavior;
import org.fixtureflow.api.ClassInitialize;
import org.fixtureflow.api.TestClass;
import org.fixtureflow.api.TestContext;
import org.fixtureflow.api.TestMethod;

/**
 * Both class fixtures fail; cleanup still runs because initialize was attempted.
 */
@TestClass
public class BrokenClassLifecycle {

    @ClassInitialize
    public static void init(TestContext context) {
        throw new IllegalStateException("init broke");
    }

    @ClassCleanup(behavior = ClassCleanupBehavior.END_OF_CLASS)
    public static void cleanup() {
        throw new IllegalStateException("cleanup broke");
    }

    @TestMethod
    public void only() {
    }
}
