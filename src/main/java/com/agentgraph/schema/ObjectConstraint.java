package com.agentgraph.schema;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * {@code required} keys and per-property schemas, applied to objects only. Keys without a
 * property schema pass through unchecked.
 */
@Getter
public class ObjectConstraint implements Constraint {

    private final List<String> required;
    private final Map<String, SchemaNode> properties;

    public ObjectConstraint(List<String> required, Map<String, SchemaNode> properties) {
        this.required = List.copyOf(required);
        this.properties = properties;
    }

    @Override
    public void check(JsonNode value, String path, List<Violation> violations) {
        if (value == null || !value.isObject()) {
            return;
        }
        for (String key : required) {
            if (!value.has(key)) {
                violations.add(new Violation(path + "." + key, path + "." + key + " is required"));
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            SchemaNode propertySchema = properties.get(field.getKey());
            if (propertySchema != null) {
                propertySchema.evaluate(field.getValue(), path + "." + field.getKey(), violations);
            }
        }
    }
}
