package com.agentgraph.exception;

/**
 * Exception thrown when a type name breaks the naming convention of its kind.
 */
public class InvalidNameException extends GraphException {

    public InvalidNameException(String message) {
        super(ErrorCode.INVALID_NAME, message);
    }
}
