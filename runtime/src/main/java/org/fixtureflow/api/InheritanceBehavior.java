package org.fixtureflow.api;

/**
 * Whether a base-class fixture also runs for the classes that extend it.
 */
public enum InheritanceBehavior {
    NONE,
    BEFORE_EACH_DERIVED_CLASS
}
