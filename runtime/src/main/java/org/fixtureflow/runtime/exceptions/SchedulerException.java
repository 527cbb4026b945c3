package org.fixtureflow.runtime.exceptions;

import java.util.Map;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * One or more scheduler workers died. The map is keyed by worker index.
 */
public class SchedulerException extends RuntimeException {

    @Getter
    private final Map<Integer, Throwable> exceptionMap;

    public SchedulerException(Map<Integer, Throwable> exceptionMap) {
        super(exceptionMap.entrySet().stream()
                .map(e -> "Worker " + e.getKey() + ": "
                        + e.getValue().getClass().getSimpleName())
                .collect(Collectors.joining("\n")));
        this.exceptionMap = exceptionMap;
    }
}
