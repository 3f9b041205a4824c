package com.agentgraph.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One keyword group of a compiled schema level. Implementations only inspect values of
 * the runtime kind they care about and ignore everything else.
 */
public interface Constraint {

    void check(JsonNode value, String path, List<Violation> violations);
}
