package com.agileflow.planning.workgraph.exception;

public class InvalidDependencyException extends RuntimeException {

    public InvalidDependencyException(String message) {
        super(message);
    }
}
