package com.agileflow.planning.workgraph.exception;

/**
 * The plan handed to the executor is empty or malformed. Raised before any move is applied.
 */
public class InvalidRebalancePlanException extends RuntimeException {

    public InvalidRebalancePlanException(String message) {
        super(message);
    }
}
