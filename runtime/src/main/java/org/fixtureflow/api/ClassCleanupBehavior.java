package org.fixtureflow.api;

/**
 * When a class cleanup runs.
 */
public enum ClassCleanupBehavior {
    /** Defer to the run settings, then to the source settings. */
    DEFAULT,
    /** Right after the last test of the class completes. */
    END_OF_CLASS,
    /** Once every test of the source has completed, before the assembly cleanup. */
    END_OF_ASSEMBLY
}
