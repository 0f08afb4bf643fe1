package com.agileflow.planning.workgraph.exception;

/**
 * A work item, team, sprint or member referenced by a request does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException of(String resourceType, String id) {
        return new ResourceNotFoundException(resourceType + " not found with id: " + id);
    }
}
