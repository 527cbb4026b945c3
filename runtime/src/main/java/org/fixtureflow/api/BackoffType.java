package org.fixtureflow.api;

public enum BackoffType {
    CONSTANT,
    EXPONENTIAL
}
