package com.agentgraph.exception;

/**
 * Exception thrown when attempting to create a type whose name is already taken in scope.
 */
public class DuplicateTypeException extends GraphException {

    public DuplicateTypeException(String kindLabel, String name) {
        super(ErrorCode.DUPLICATE_TYPE, String.format("%s type \"%s\" already exists.", kindLabel, name));
    }
}
