package com.agentgraph.schema;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single structural problem found while validating a value. The message already
 * starts with the dotted path, e.g. {@code "properties.ticker expected string, got number (123)"}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Violation {

    private String path;
    private String message;

    @Override
    public String toString() {
        return message;
    }
}
