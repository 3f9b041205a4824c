package com.agentgraph.exception;

/**
 * Exception thrown when a referenced node is not found.
 */
public class ReferenceNotFoundException extends GraphException {

    public ReferenceNotFoundException(ErrorCode code, String message) {
        super(code, message);
    }

    public ReferenceNotFoundException(ErrorCode code, String resource, String identifier) {
        super(code, String.format("%s with identifier '%s' not found", resource, identifier));
    }
}
