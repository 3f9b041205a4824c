package com.agentgraph.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates node and edge properties against their type's properties schema.
 *
 * Validation never throws: it always returns the complete list of violations so that a
 * caller can correct every problem in a single follow-up write.
 */
@Component
@RequiredArgsConstructor
public class SchemaValidator {

    public static final String PROPERTIES_PATH = "properties";

    private final ObjectMapper objectMapper;

    /**
     * Validate a value against a schema descriptor, reporting paths relative to {@code rootPath}.
     *
     * @param value    value to check
     * @param schema   schema descriptor, {@code null} accepts everything
     * @param rootPath path prefix for violation messages
     * @return violations in discovery order, empty when the value conforms
     */
    public List<Violation> validate(JsonNode value, JsonNode schema, String rootPath) {
        List<Violation> violations = new ArrayList<>();
        if (schema == null || schema.isNull()) {
            return violations;
        }
        SchemaParser.parse(schema).evaluate(value, rootPath, violations);
        return violations;
    }

    /**
     * Validate a properties map against a type's schema with the {@code properties} root path.
     */
    public List<Violation> validateProperties(Map<String, Object> properties, JsonNode schema) {
        JsonNode value = objectMapper.valueToTree(properties == null ? Map.of() : properties);
        return validate(value, schema, PROPERTIES_PATH);
    }
}
