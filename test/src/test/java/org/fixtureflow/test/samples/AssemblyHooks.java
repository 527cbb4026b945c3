package org.fixtureflow.test.samples;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.fixtureflow.api.AssemblyCleanup;
import org.fixtureflow.api.AssemblyInitialize;
import org.fixtureflow.api.TestContext;

/**
 * Assembly fixtures of the source made of {@link FirstCases} and {@link SecondCases}. Every
 * fixture of that source records itself in {@link #EVENTS}.
 */
public class AssemblyHooks {

    public static final List<String> EVENTS = Collections.synchronizedList(new ArrayList<>());

    @AssemblyInitialize
    public static void initialize(TestContext context) {
        EVENTS.add("assembly-init");
    }

    @AssemblyCleanup
    public static void cleanup() {
        EVENTS.add("assembly-cleanup");
    }
}
