package com.agentgraph.model;

import com.agentgraph.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * The two families of dynamic types held by the registry.
 */
@Getter
public enum TypeKind {

    NODE("node", "Node", ErrorCode.NODE_TYPE_NOT_FOUND, ErrorCode.NODE_PROPERTIES_SCHEMA_VALIDATION_FAILED,
            "listNodeTypes"),
    EDGE("edge", "Edge", ErrorCode.EDGE_TYPE_NOT_FOUND, ErrorCode.EDGE_PROPERTIES_SCHEMA_VALIDATION_FAILED,
            "listEdgeTypes");

    private final String value;
    private final String label;
    private final ErrorCode notFoundCode;
    private final ErrorCode schemaFailureCode;
    private final String listToolName;

    TypeKind(String value, String label, ErrorCode notFoundCode, ErrorCode schemaFailureCode, String listToolName) {
        this.value = value;
        this.label = label;
        this.notFoundCode = notFoundCode;
        this.schemaFailureCode = schemaFailureCode;
        this.listToolName = listToolName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static TypeKind fromValue(String value) {
        for (TypeKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown type kind: " + value);
    }
}
