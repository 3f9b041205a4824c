package com.agentgraph.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for SchemaValidator.
 */
class SchemaValidatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SchemaValidator validator = new SchemaValidator(objectMapper);

    private static final String COMPANY_SCHEMA = "{\"type\":\"object\",\"required\":[\"ticker\"],"
            + "\"properties\":{\"ticker\":{\"type\":\"string\"},\"price\":{\"type\":\"number\"}}}";

    @Test
    void validateProperties_MissingRequiredKey() {
        List<String> messages = messages(Map.of("price", 10), COMPANY_SCHEMA);

        assertThat(messages).containsExactly("properties.ticker is required");
    }

    @Test
    void validateProperties_ConformingValuePasses() {
        assertThat(messages(Map.of("ticker", "ACME", "price", 171.88), COMPANY_SCHEMA)).isEmpty();
    }

    @Test
    void validateProperties_NumericStringIsNotANumber() {
        List<String> messages = messages(Map.of("ticker", "ACME", "price", "$171.88"), COMPANY_SCHEMA);

        assertThat(messages).containsExactly("properties.price expected number, got string (\"$171.88\")");
    }

    @Test
    void validateProperties_WrongTypeForString() {
        List<String> messages = messages(Map.of("ticker", 123), COMPANY_SCHEMA);

        assertThat(messages).containsExactly("properties.ticker expected string, got number (123)");
    }

    @Test
    void validateProperties_NullSchemaAcceptsEverything() {
        assertThat(validator.validateProperties(Map.of("anything", List.of(1, "two")), null)).isEmpty();
    }

    @Test
    void validateProperties_UnknownKeysPassThrough() {
        assertThat(messages(Map.of("ticker", "ACME", "sector", 42), COMPANY_SCHEMA)).isEmpty();
    }

    @Test
    void validate_ReportsEveryViolation() {
        String schema = "{\"type\":\"object\",\"required\":[\"a\",\"b\"],\"properties\":{"
                + "\"c\":{\"type\":\"integer\"},\"d\":{\"type\":\"boolean\"}}}";

        List<String> messages = messages(Map.of("c", 1.5, "d", "yes"), schema);

        assertThat(messages).containsExactlyInAnyOrder(
                "properties.a is required",
                "properties.b is required",
                "properties.c expected integer, got number (1.5)",
                "properties.d expected boolean, got string (\"yes\")");
    }

    @Test
    void validate_IntegerAcceptsWholeDecimal() {
        String schema = "{\"type\":\"object\",\"properties\":{\"count\":{\"type\":\"integer\"}}}";

        assertThat(messages(Map.of("count", 3.0), schema)).isEmpty();
        assertThat(messages(Map.of("count", 3), schema)).isEmpty();
    }

    @Test
    void validate_UnionTypes() {
        String schema = "{\"type\":\"object\",\"properties\":{\"v\":{\"type\":[\"string\",\"null\"]}}}";

        assertThat(validator.validate(tree("{\"v\":null}"), tree(schema), "properties")).isEmpty();
        assertThat(validator.validate(tree("{\"v\":true}"), tree(schema), "properties"))
                .extracting(Violation::getMessage)
                .containsExactly("properties.v expected string|null, got boolean (true)");
    }

    @Test
    void validate_EnumComparesNumbersByValue() {
        String schema = "{\"type\":\"object\",\"properties\":{"
                + "\"level\":{\"enum\":[1,2,3]},\"action\":{\"type\":\"string\",\"enum\":[\"BUY\",\"SELL\",\"HOLD\"]}}}";

        assertThat(validator.validate(tree("{\"level\":2.0,\"action\":\"HOLD\"}"), tree(schema), "properties"))
                .isEmpty();
        assertThat(validator.validate(tree("{\"action\":\"buy\"}"), tree(schema), "properties"))
                .extracting(Violation::getMessage)
                .containsExactly("properties.action must be one of \"BUY\", \"SELL\", \"HOLD\"");
    }

    @Test
    void validate_NumericBounds() {
        String schema = "{\"type\":\"object\",\"properties\":{\"confidence\":{\"type\":\"number\","
                + "\"minimum\":0,\"maximum\":1}}}";

        assertThat(messages(Map.of("confidence", 1.5), schema))
                .containsExactly("properties.confidence must be <= 1, got 1.5");
        assertThat(messages(Map.of("confidence", -0.25), schema))
                .containsExactly("properties.confidence must be >= 0, got -0.25");
        assertThat(messages(Map.of("confidence", 1), schema)).isEmpty();
    }

    @Test
    void validate_StringLengthAndPattern() {
        String schema = "{\"type\":\"object\",\"properties\":{\"ticker\":{\"type\":\"string\","
                + "\"minLength\":2,\"maxLength\":5,\"pattern\":\"^[A-Z]+$\"}}}";

        assertThat(messages(Map.of("ticker", "a"), schema)).containsExactly(
                "properties.ticker must have length >= 2, got 1",
                "properties.ticker must match pattern ^[A-Z]+$, got \"a\"");
        assertThat(messages(Map.of("ticker", "ABCDEF"), schema))
                .containsExactly("properties.ticker must have length <= 5, got 6");
    }

    @Test
    void validate_PatternIsSearchedNotAnchored() {
        String schema = "{\"type\":\"object\",\"properties\":{\"url\":{\"type\":\"string\",\"pattern\":\"https?://\"}}}";

        assertThat(messages(Map.of("url", "see https://example.com"), schema)).isEmpty();
    }

    @Test
    void validate_InvalidPatternIsIgnored() {
        String schema = "{\"type\":\"object\",\"properties\":{\"code\":{\"type\":\"string\",\"pattern\":\"([a-z\"}}}";

        assertThat(messages(Map.of("code", "anything"), schema)).isEmpty();
    }

    @Test
    void validate_DateTimeFormat() {
        String schema = "{\"type\":\"object\",\"properties\":{\"at\":{\"type\":\"string\",\"format\":\"date-time\"}}}";

        assertThat(messages(Map.of("at", "2025-01-15T10:30:00Z"), schema)).isEmpty();
        assertThat(messages(Map.of("at", "2025-01-15"), schema)).isEmpty();
        assertThat(messages(Map.of("at", "yesterday"), schema))
                .containsExactly("properties.at must be a valid date-time string, got \"yesterday\"");
    }

    @Test
    void validate_DateTimeAcceptsSpaceSeparatedTimestamps() {
        String schema = "{\"type\":\"object\",\"properties\":{\"at\":{\"type\":\"string\",\"format\":\"date-time\"}}}";

        assertThat(messages(Map.of("at", "2024-01-15 10:30:00"), schema)).isEmpty();
        assertThat(messages(Map.of("at", "2024-01-15 10:30"), schema)).isEmpty();
        assertThat(messages(Map.of("at", "2024-01-15 10:30:00.250+02:00"), schema)).isEmpty();
    }

    @Test
    void validate_DateTimeAcceptsSlashedDates() {
        String schema = "{\"type\":\"object\",\"properties\":{\"at\":{\"type\":\"string\",\"format\":\"date-time\"}}}";

        assertThat(messages(Map.of("at", "2024/01/15"), schema)).isEmpty();
        assertThat(messages(Map.of("at", "2024/01/15 10:30:00"), schema)).isEmpty();
        assertThat(messages(Map.of("at", "2024/13/15"), schema)).hasSize(1);
    }

    @Test
    void validate_DateTimeAcceptsWrittenDates() {
        String schema = "{\"type\":\"object\",\"properties\":{\"at\":{\"type\":\"string\",\"format\":\"date-time\"}}}";

        assertThat(messages(Map.of("at", "January 15, 2024"), schema)).isEmpty();
        assertThat(messages(Map.of("at", "Jan 15, 2024 10:30"), schema)).isEmpty();
        assertThat(messages(Map.of("at", "Smarch 15, 2024"), schema)).hasSize(1);
    }

    @Test
    void validate_ArraysRecurseIntoItems() {
        String schema = "{\"type\":\"object\",\"properties\":{\"tags\":{\"type\":\"array\",\"minItems\":1,"
                + "\"maxItems\":3,\"items\":{\"type\":\"string\"}}}}";

        assertThat(validator.validate(tree("{\"tags\":[\"a\",2,\"c\"]}"), tree(schema), "properties"))
                .extracting(Violation::getMessage)
                .containsExactly("properties.tags[1] expected string, got number (2)");
        assertThat(validator.validate(tree("{\"tags\":[]}"), tree(schema), "properties"))
                .extracting(Violation::getMessage)
                .containsExactly("properties.tags must have at least 1 items, got 0");
        assertThat(validator.validate(tree("{\"tags\":[\"a\",\"b\",\"c\",\"d\"]}"), tree(schema), "properties"))
                .extracting(Violation::getMessage)
                .containsExactly("properties.tags must have at most 3 items, got 4");
    }

    @Test
    void validate_NestedObjectsReportFullPath() {
        String schema = "{\"type\":\"object\",\"properties\":{\"address\":{\"type\":\"object\","
                + "\"required\":[\"city\"],\"properties\":{\"zip\":{\"type\":\"string\"}}}}}";

        assertThat(validator.validate(tree("{\"address\":{\"zip\":12345}}"), tree(schema), "properties"))
                .extracting(Violation::getMessage)
                .containsExactly(
                        "properties.address.city is required",
                        "properties.address.zip expected string, got number (12345)");
    }

    @Test
    void validate_TypeMismatchStopsDescent() {
        String schema = "{\"type\":\"object\",\"properties\":{\"address\":{\"type\":\"object\",\"required\":[\"city\"]}}}";

        assertThat(validator.validate(tree("{\"address\":\"Main Street\"}"), tree(schema), "properties"))
                .extracting(Violation::getMessage)
                .containsExactly("properties.address expected object, got string (\"Main Street\")");
    }

    private List<String> messages(Map<String, Object> properties, String schema) {
        return validator.validateProperties(properties, tree(schema)).stream()
                .map(Violation::getMessage)
                .collect(Collectors.toList());
    }

    private JsonNode tree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
