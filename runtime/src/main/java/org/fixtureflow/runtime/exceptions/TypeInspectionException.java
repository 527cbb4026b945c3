package org.fixtureflow.runtime.exceptions;

/**
 * A test class or source declares its fixtures in a way the engine cannot run: duplicate
 * fixtures, wrong signatures, a row source that cannot be used.
 */
public class TypeInspectionException extends RuntimeException {

    public TypeInspectionException(String message) {
        super(message);
    }

    public TypeInspectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
