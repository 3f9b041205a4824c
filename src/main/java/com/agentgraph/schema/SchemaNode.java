package com.agentgraph.schema;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.util.List;

/**
 * One compiled level of a properties schema: an optional type gate followed by the
 * remaining constraints in keyword order (enum, numeric, string, array, object).
 */
@Getter
public class SchemaNode {

    public static final SchemaNode UNCONSTRAINED = new SchemaNode(null, List.of());

    private final TypeConstraint type;
    private final List<Constraint> constraints;

    public SchemaNode(TypeConstraint type, List<Constraint> constraints) {
        this.type = type;
        this.constraints = List.copyOf(constraints);
    }

    public void evaluate(JsonNode value, String path, List<Violation> violations) {
        if (type != null && !type.accepts(value)) {
            type.check(value, path, violations);
            return;
        }
        for (Constraint constraint : constraints) {
            constraint.check(value, path, violations);
        }
    }
}
