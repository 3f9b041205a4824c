package com.agentgraph.exception;

import com.agentgraph.schema.Violation;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception carrying every structural violation found for a node or edge write.
 */
@Getter
public class SchemaValidationException extends GraphException {

    private final List<Violation> violations;

    public SchemaValidationException(ErrorCode code, List<Violation> violations) {
        super(code, violations.stream()
                .map(Violation::getMessage)
                .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }
}
