package org.fixtureflow.runtime.completion;

import lombok.Value;

/**
 * What became due when a test completed.
 */
@Value
public class CompletionDecision {

    public static final CompletionDecision NONE = new CompletionDecision(false, false);

    boolean runClassCleanupNow;

    boolean runAssemblyCleanupNow;
}
