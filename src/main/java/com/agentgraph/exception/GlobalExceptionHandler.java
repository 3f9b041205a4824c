package com.agentgraph.exception;

import com.agentgraph.model.dto.ErrorResponse;
import com.agentgraph.schema.Violation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SchemaValidationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleSchemaValidation(SchemaValidationException ex) {
        log.warn("Schema validation failed: {}", ex.getMessage());
        ErrorResponse error = ErrorResponse.builder()
                .code(ex.getCode().name())
                .detail(ex.getCodedMessage())
                .violations(ex.getViolations().stream()
                        .map(Violation::getMessage)
                        .collect(Collectors.toList()))
                .traceId(UUID.randomUUID().toString())
                .build();
        return Mono.just(ResponseEntity.status(ex.getCode().getHttpStatus()).body(error));
    }

    @ExceptionHandler(GraphException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGraphException(GraphException ex) {
        HttpStatus status = ex.getCode().getHttpStatus();
        if (status.is5xxServerError()) {
            log.error("Graph operation failed", ex);
        } else {
            log.warn("Graph operation rejected: {}", ex.getCodedMessage());
        }
        ErrorResponse error = ErrorResponse.builder()
                .code(ex.getCode().name())
                .detail(ex.getCodedMessage())
                .traceId(UUID.randomUUID().toString())
                .build();
        return Mono.just(ResponseEntity.status(status).body(error));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", errors);
        ErrorResponse error = ErrorResponse.builder()
                .code(ErrorCode.INVALID_PARAMETERS.name())
                .detail("Validation failed: " + errors)
                .traceId(UUID.randomUUID().toString())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(ServerWebInputException ex) {
        log.warn("Bad request: {}", ex.getReason());
        ErrorResponse error = ErrorResponse.builder()
                .code(ErrorCode.INVALID_PARAMETERS.name())
                .detail("Invalid request: " + ex.getReason())
                .traceId(UUID.randomUUID().toString())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        ErrorResponse error = ErrorResponse.builder()
                .code(ErrorCode.UNEXPECTED_ERROR.name())
                .detail("Internal server error: " + ex.getMessage())
                .traceId(UUID.randomUUID().toString())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error));
    }
}
