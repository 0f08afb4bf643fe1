package com.agileflow.planning.workgraph.exception;

import lombok.Getter;

/**
 * Adding the requested dependency would close a loop in the dependency graph.
 */
@Getter
public class CircularDependencyException extends RuntimeException {

    private final String itemId;
    private final String dependencyId;

    public CircularDependencyException(String itemId, String dependencyId) {
        super("Circular dependency detected. Cannot make " + itemId + " depend on " + dependencyId);
        this.itemId = itemId;
        this.dependencyId = dependencyId;
    }
}
