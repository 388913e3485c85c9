package com.topdeck.riskgraph.exception;

import lombok.Getter;

/**
 * Raised when a requested resource id is absent from the graph.
 * Terminal for the analysis that asked for it: no partial report is produced.
 */
@Getter
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceId;

    public ResourceNotFoundException(String resourceId) {
        super("Resource not found with id: " + resourceId);
        this.resourceId = resourceId;
    }
}
