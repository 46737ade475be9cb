package com.formula.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds {@code field id -> value} maps from JSON payloads.
 * Nested JSON objects are flattened using dot notation (e.g., {"x":{"y":"z"}} becomes "x.y" -> "z").
 */
public final class FieldValuesFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private FieldValuesFactory() {
    }

    /**
     * Parse a JSON object into field values.
     *
     * @param jsonPayload JSON object text; null or blank yields an empty map
     * @return Unmodifiable flattened values, in document order
     * @throws IllegalArgumentException if the payload is not a JSON object
     */
    public static Map<String, Object> fromJson(String jsonPayload) {
        if (jsonPayload == null || jsonPayload.isBlank()) {
            return Map.of();
        }
        return fromMap(parseJson(jsonPayload));
    }

    /**
     * Flatten an already parsed map. The input is not modified.
     */
    public static Map<String, Object> fromMap(Map<String, ?> values) {
        Map<String, Object> result = new LinkedHashMap<>();
        flattenRecursive("", values, result);
        return Collections.unmodifiableMap(result);
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static void flattenRecursive(String prefix, Map<String, ?> map, Map<String, Object> result) {
        for (Map.Entry<String, ?> entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object value = entry.getValue();

            if (value instanceof Map) {
                flattenRecursive(key, (Map<String, Object>) value, result);
            } else if (value instanceof Number number) {
                result.put(key, Values.normalize(number));
            } else {
                // Lists are kept as-is so sum/min/max can take a table column
                result.put(key, value);
            }
        }
    }
}
