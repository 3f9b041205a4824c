package com.agentgraph.util;

import com.agentgraph.exception.ErrorCode;
import com.agentgraph.exception.GraphException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts the JSON text columns (schemas, example properties, node and edge properties)
 * to and from their in-memory form.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * Serialize a map to JSON text.
     */
    public String write(Map<String, Object> value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize JSON column", e);
            throw new GraphException(ErrorCode.UNEXPECTED_ERROR, "Failed to serialize JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Deserialize JSON text to an insertion-ordered map. Null text yields null.
     */
    public Map<String, Object> readMap(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize JSON column", e);
            throw new GraphException(ErrorCode.UNEXPECTED_ERROR, "Stored JSON is unreadable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Deserialize JSON text to a tree. Null text yields null.
     */
    public JsonNode readTree(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize JSON column", e);
            throw new GraphException(ErrorCode.UNEXPECTED_ERROR, "Stored JSON is unreadable: " + e.getOriginalMessage(), e);
        }
    }

    public JsonNode toTree(Object value) {
        return objectMapper.valueToTree(value);
    }
}
