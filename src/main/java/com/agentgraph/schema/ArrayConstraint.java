package com.agentgraph.schema;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.util.List;

/**
 * Item count bounds plus an optional item schema, applied to arrays only.
 */
@Getter
public class ArrayConstraint implements Constraint {

    private final Integer minItems;
    private final Integer maxItems;
    private final SchemaNode items;

    public ArrayConstraint(Integer minItems, Integer maxItems, SchemaNode items) {
        this.minItems = minItems;
        this.maxItems = maxItems;
        this.items = items;
    }

    @Override
    public void check(JsonNode value, String path, List<Violation> violations) {
        if (value == null || !value.isArray()) {
            return;
        }
        int size = value.size();
        if (minItems != null && size < minItems) {
            violations.add(new Violation(path, String.format("%s must have at least %d items, got %d",
                    path, minItems, size)));
        }
        if (maxItems != null && size > maxItems) {
            violations.add(new Violation(path, String.format("%s must have at most %d items, got %d",
                    path, maxItems, size)));
        }
        if (items != null) {
            for (int i = 0; i < size; i++) {
                items.evaluate(value.get(i), path + "[" + i + "]", violations);
            }
        }
    }
}
