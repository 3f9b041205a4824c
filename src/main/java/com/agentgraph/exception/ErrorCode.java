package com.agentgraph.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Machine-readable failure codes surfaced to tool callers and REST clients.
 */
@Getter
public enum ErrorCode {

    INVALID_NAME(HttpStatus.BAD_REQUEST),
    DUPLICATE_TYPE(HttpStatus.CONFLICT),
    NODE_TYPE_NOT_FOUND(HttpStatus.NOT_FOUND),
    EDGE_TYPE_NOT_FOUND(HttpStatus.NOT_FOUND),
    NODE_PROPERTIES_SCHEMA_VALIDATION_FAILED(HttpStatus.BAD_REQUEST),
    EDGE_PROPERTIES_SCHEMA_VALIDATION_FAILED(HttpStatus.BAD_REQUEST),
    SOURCE_NODE_NOT_FOUND(HttpStatus.NOT_FOUND),
    TARGET_NODE_NOT_FOUND(HttpStatus.NOT_FOUND),
    NODE_NOT_FOUND(HttpStatus.NOT_FOUND),
    CITATION_ERROR(HttpStatus.BAD_REQUEST),
    INVALID_PARAMETERS(HttpStatus.BAD_REQUEST),
    UNKNOWN_TOOL(HttpStatus.NOT_FOUND),
    UNEXPECTED_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }
}
