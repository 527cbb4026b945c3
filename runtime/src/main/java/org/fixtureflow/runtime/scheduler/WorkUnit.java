package org.fixtureflow.runtime.scheduler;

import com.google.common.collect.ImmutableList;
import lombok.Value;
import org.fixtureflow.runtime.model.TestElement;

/**
 * Tests handed to a worker in one go: a single test, or every test of a class.
 */
@Value
public class WorkUnit {

    String name;

    ImmutableList<TestElement> tests;
}
