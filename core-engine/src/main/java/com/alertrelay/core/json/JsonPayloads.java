package com.alertrelay.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared Jackson configuration for webhook bodies and result maps.
 *
 * @since 1.0.0
 */
public final class JsonPayloads {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    /** Thread-safe once configured. */
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private JsonPayloads() {
        // utility class
    }

    /**
     * Parse a raw webhook body that must be a JSON object.
     *
     * @param json raw body
     * @return mutable, insertion-ordered map
     * @throws IllegalArgumentException if the body is empty, malformed or not an object
     */
    public static Map<String, Object> parseObject(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Payload body is empty");
        }
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("Payload must be a JSON object");
            }
            return MAPPER.convertValue(node, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Convert an arbitrary bean into a plain map.
     *
     * @throws IllegalArgumentException if Jackson cannot represent the value as an object
     */
    public static Map<String, Object> toMap(Object value) {
        return MAPPER.convertValue(value, MAP_TYPE);
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
