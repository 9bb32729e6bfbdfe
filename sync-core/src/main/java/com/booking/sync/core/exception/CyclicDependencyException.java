package com.booking.sync.core.exception;

import java.util.List;
import java.util.stream.Collectors;

public class CyclicDependencyException extends Exception {
    private final List<?> cycle;

    public CyclicDependencyException(List<?> cycle) {
        super(String.format(
                "Cyclic dependency detected: %s",
                cycle.stream().map(String::valueOf).collect(Collectors.joining(" -> "))
        ));
        this.cycle = cycle;
    }

    public List<?> getCycle() {
        return this.cycle;
    }
}
