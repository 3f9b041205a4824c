package com.agentgraph.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * Runtime kind helpers shared by the constraint nodes.
 */
final class JsonKinds {

    private JsonKinds() {
    }

    /**
     * Kind label used in violation messages: null, array, object, number, string or boolean.
     */
    static String label(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "null";
        }
        if (value.isArray()) {
            return "array";
        }
        if (value.isObject()) {
            return "object";
        }
        if (value.isNumber()) {
            return "number";
        }
        if (value.isTextual()) {
            return "string";
        }
        if (value.isBoolean()) {
            return "boolean";
        }
        return value.getNodeType().name().toLowerCase();
    }

    static boolean matches(JsonNode value, String schemaType) {
        switch (schemaType) {
            case "null":
                return value == null || value.isNull();
            case "array":
                return value != null && value.isArray();
            case "object":
                return value != null && value.isObject();
            case "integer":
                return isWholeNumber(value);
            case "number":
                return value != null && value.isNumber();
            case "string":
                return value != null && value.isTextual();
            case "boolean":
                return value != null && value.isBoolean();
            default:
                return false;
        }
    }

    static boolean isWholeNumber(JsonNode value) {
        if (value == null || !value.isNumber()) {
            return false;
        }
        if (value.isIntegralNumber()) {
            return true;
        }
        double d = value.doubleValue();
        return !Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d);
    }

    /**
     * Numeric equality by value so that {@code 1} and {@code 1.0} compare equal.
     */
    static boolean sameValue(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        return a.equals(b);
    }

    static String formatNumber(BigDecimal number) {
        BigDecimal stripped = number.stripTrailingZeros();
        if (stripped.scale() < 0) {
            stripped = stripped.setScale(0);
        }
        return stripped.toPlainString();
    }

    static String render(JsonNode value) {
        return value == null ? "null" : value.toString();
    }
}
