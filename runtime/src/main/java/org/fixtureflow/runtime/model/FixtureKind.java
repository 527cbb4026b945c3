package org.fixtureflow.runtime.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kind of shared fixture. Also used as the trait of synthetic elements that only report
 * the outcome of a fixture.
 */
@RequiredArgsConstructor
public enum FixtureKind {
    ASSEMBLY_INITIALIZE("Assembly Initialization"),
    ASSEMBLY_CLEANUP("Assembly Cleanup"),
    CLASS_INITIALIZE("Class Initialization"),
    CLASS_CLEANUP("Class Cleanup");

    @Getter
    private final String displayName;
}
