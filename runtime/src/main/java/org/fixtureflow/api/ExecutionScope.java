package org.fixtureflow.api;

/**
 * Granularity of the units handed to parallel workers.
 */
public enum ExecutionScope {
    /** Every test is its own unit. */
    METHOD_LEVEL,
    /** All tests of one class form a unit and run on the same worker. */
    CLASS_LEVEL
}
