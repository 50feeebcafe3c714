package com.dragnet.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;

public final class JsonUtil {
    private static final ObjectMapper M = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    static {
        M.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    private JsonUtil() {}

    public static ObjectMapper mapper() {
        return M;
    }

    public static ObjectNode object() {
        return M.createObjectNode();
    }

    public static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON encode failed", e);
        }
    }

    public static JsonNode parse(String json) {
        try {
            return M.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON decode failed: " + e.getOriginalMessage(), e);
        }
    }

    public static Map<String, Object> parseObject(String json) {
        try {
            return M.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON decode failed: " + e.getOriginalMessage(), e);
        }
    }

    public static <T> T convert(JsonNode node, Class<T> type) {
        return M.convertValue(node, type);
    }

    public static JsonNode toTree(Object o) {
        return M.valueToTree(o);
    }
}
