package com.agentgraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of an idempotent node or edge write.
 */
public enum UpsertAction {

    CREATED("created"),
    UPDATED("updated"),
    ALREADY_EXISTS("already_exists");

    private final String value;

    UpsertAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
