package com.agentgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who created a type definition.
 */
public enum TypeOrigin {

    SYSTEM("system"),
    AGENT("agent");

    private final String value;

    TypeOrigin(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TypeOrigin fromValue(String value) {
        for (TypeOrigin origin : values()) {
            if (origin.value.equalsIgnoreCase(value)) {
                return origin;
            }
        }
        throw new IllegalArgumentException("Unknown type origin: " + value);
    }
}
