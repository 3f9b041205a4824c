package com.agentgraph.exception;

import lombok.Getter;

/**
 * Base class for every failure raised by the graph engine.
 */
@Getter
public class GraphException extends RuntimeException {

    private final ErrorCode code;

    public GraphException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public GraphException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Message with the code prefix, e.g. {@code "DUPLICATE_TYPE: Node type \"Company\" already exists."}.
     */
    public String getCodedMessage() {
        return code.name() + ": " + getMessage();
    }
}
