package com.agentgraph.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The {@code enum} keyword.
 */
@Getter
public class EnumConstraint implements Constraint {

    private final List<JsonNode> allowed;

    public EnumConstraint(List<JsonNode> allowed) {
        this.allowed = List.copyOf(allowed);
    }

    @Override
    public void check(JsonNode value, String path, List<Violation> violations) {
        JsonNode actual = value == null ? NullNode.getInstance() : value;
        boolean member = allowed.stream().anyMatch(candidate -> JsonKinds.sameValue(candidate, actual));
        if (!member) {
            String choices = allowed.stream()
                    .map(JsonNode::toString)
                    .collect(Collectors.joining(", "));
            violations.add(new Violation(path, path + " must be one of " + choices));
        }
    }
}
