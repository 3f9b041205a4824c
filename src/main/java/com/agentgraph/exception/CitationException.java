package com.agentgraph.exception;

import lombok.Getter;

/**
 * Exception thrown when derived-knowledge content is not grounded in valid graph citations.
 */
@Getter
public class CitationException extends GraphException {

    public enum Reason {
        NO_CITATIONS,
        INVALID_FORMAT,
        UNRESOLVED
    }

    private final Reason reason;

    public CitationException(Reason reason, String message) {
        super(ErrorCode.CITATION_ERROR, message);
        this.reason = reason;
    }
}
