package com.agentgraph.schema;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles a JSON-Schema-like descriptor into a {@link SchemaNode} tree.
 *
 * Only the keywords the graph engine enforces are read: type, enum, minimum, maximum,
 * minLength, maxLength, pattern, format (date-time), minItems, maxItems, items,
 * required and properties. Everything else is ignored.
 */
@Slf4j
public final class SchemaParser {

    private SchemaParser() {
    }

    public static SchemaNode parse(JsonNode schema) {
        if (schema == null || !schema.isObject()) {
            return SchemaNode.UNCONSTRAINED;
        }

        TypeConstraint type = parseType(schema.get("type"));
        List<Constraint> constraints = new ArrayList<>();

        JsonNode enumNode = schema.get("enum");
        if (enumNode != null && enumNode.isArray()) {
            List<JsonNode> allowed = new ArrayList<>();
            enumNode.forEach(allowed::add);
            constraints.add(new EnumConstraint(allowed));
        }

        BigDecimal minimum = decimal(schema.get("minimum"));
        BigDecimal maximum = decimal(schema.get("maximum"));
        if (minimum != null || maximum != null) {
            constraints.add(new NumericConstraint(minimum, maximum));
        }

        Integer minLength = integer(schema.get("minLength"));
        Integer maxLength = integer(schema.get("maxLength"));
        Pattern pattern = compilePattern(schema.get("pattern"));
        boolean dateTime = "date-time".equals(text(schema.get("format")));
        if (minLength != null || maxLength != null || pattern != null || dateTime) {
            constraints.add(new StringConstraint(minLength, maxLength, pattern, dateTime));
        }

        Integer minItems = integer(schema.get("minItems"));
        Integer maxItems = integer(schema.get("maxItems"));
        JsonNode itemsNode = schema.get("items");
        SchemaNode items = itemsNode != null && itemsNode.isObject() ? parse(itemsNode) : null;
        if (minItems != null || maxItems != null || items != null) {
            constraints.add(new ArrayConstraint(minItems, maxItems, items));
        }

        List<String> required = new ArrayList<>();
        JsonNode requiredNode = schema.get("required");
        if (requiredNode != null && requiredNode.isArray()) {
            requiredNode.forEach(key -> {
                if (key.isTextual()) {
                    required.add(key.textValue());
                }
            });
        }
        Map<String, SchemaNode> properties = new LinkedHashMap<>();
        JsonNode propertiesNode = schema.get("properties");
        if (propertiesNode != null && propertiesNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = propertiesNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                properties.put(field.getKey(), parse(field.getValue()));
            }
        }
        if (!required.isEmpty() || !properties.isEmpty()) {
            constraints.add(new ObjectConstraint(required, properties));
        }

        return new SchemaNode(type, constraints);
    }

    private static TypeConstraint parseType(JsonNode typeNode) {
        if (typeNode == null) {
            return null;
        }
        List<String> types = new ArrayList<>();
        if (typeNode.isTextual()) {
            types.add(typeNode.textValue());
        } else if (typeNode.isArray()) {
            typeNode.forEach(entry -> {
                if (entry.isTextual()) {
                    types.add(entry.textValue());
                }
            });
        }
        return types.isEmpty() ? null : new TypeConstraint(types);
    }

    private static Pattern compilePattern(JsonNode node) {
        String source = text(node);
        if (source == null) {
            return null;
        }
        try {
            return Pattern.compile(source);
        } catch (PatternSyntaxException e) {
            log.debug("Ignoring invalid schema pattern {}: {}", source, e.getDescription());
            return null;
        }
    }

    private static BigDecimal decimal(JsonNode node) {
        return node != null && node.isNumber() ? node.decimalValue() : null;
    }

    private static Integer integer(JsonNode node) {
        return node != null && node.isNumber() ? node.intValue() : null;
    }

    private static String text(JsonNode node) {
        return node != null && node.isTextual() ? node.textValue() : null;
    }
}
