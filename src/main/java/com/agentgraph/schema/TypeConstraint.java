package com.agentgraph.schema;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.util.List;

/**
 * The {@code type} keyword. Evaluated before every other constraint of its level; a mismatch
 * stops descent into the value.
 */
@Getter
public class TypeConstraint implements Constraint {

    private final List<String> types;

    public TypeConstraint(List<String> types) {
        this.types = List.copyOf(types);
    }

    public boolean accepts(JsonNode value) {
        return types.stream().anyMatch(type -> JsonKinds.matches(value, type));
    }

    @Override
    public void check(JsonNode value, String path, List<Violation> violations) {
        if (!accepts(value)) {
            violations.add(new Violation(path, String.format("%s expected %s, got %s (%s)",
                    path, String.join("|", types), JsonKinds.label(value), JsonKinds.render(value))));
        }
    }
}
