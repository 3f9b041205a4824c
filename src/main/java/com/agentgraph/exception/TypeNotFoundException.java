package com.agentgraph.exception;

/**
 * Exception thrown when a node or edge type cannot be resolved in scope.
 */
public class TypeNotFoundException extends GraphException {

    public TypeNotFoundException(ErrorCode code, String message) {
        super(code, message);
    }
}
