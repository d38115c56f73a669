package com.acme.autodoist.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;

public final class Jsons {
    private static final ObjectMapper M = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private Jsons() {
    }

    public static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch(Exception e) {
            throw new RuntimeException(e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return M.readValue(json, clazz);
        } catch(Exception e) {
            throw new RuntimeException(e);
        }
    }

    public static <T> T convert(JsonNode node, Class<T> clazz) {
        try {
            return M.treeToValue(node, clazz);
        } catch(JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Parses untrusted input; malformed JSON surfaces as the checked Jackson exception.
     */
    public static JsonNode readTree(String json) throws JsonProcessingException {
        return M.readTree(json);
    }

    /**
     * Lenient read used for stored columns: null, blank or broken JSON becomes an empty map.
     */
    public static Map<String, Object> toMap(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> m = M.readValue(json, MAP);
            return m == null ? new LinkedHashMap<>() : m;
        } catch(JsonProcessingException e) {
            return new LinkedHashMap<>();
        }
    }

    /**
     * Typed view of a nested JSON object value; anything that is not an object becomes an empty map.
     */
    public static Map<String, Object> asMap(Object value) {
        if (!(value instanceof Map)) {
            return new LinkedHashMap<>();
        }
        return M.convertValue(value, MAP);
    }

    public static Map<String, Object> merge(Map<String, Object> a, Map<String, Object> b) {
        var m = new LinkedHashMap<String, Object>();
        m.putAll(a);
        m.putAll(b);
        return m;
    }

    /**
     * Text value of a field, or null when missing, null or not a scalar.
     */
    public static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || v.isContainerNode()) {
            return null;
        }
        return v.asText();
    }
}
