package com.predicate.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads JSON into the plain Java values the engine evaluates:
 * {@code LinkedHashMap} objects, {@code ArrayList} arrays, {@code String},
 * {@code Integer}/{@code Long}/{@code Double} numbers, {@code Boolean} and null.
 */
public final class JsonValues {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonValues() {
    }

    /**
     * Parse JSON text, e.g. an event payload.
     *
     * @param json JSON text
     * @return Parsed value
     * @throws IllegalArgumentException if the text is not valid JSON
     */
    public static Object parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Invalid JSON payload: empty input");
        }
        try {
            return objectMapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Read JSON from a stream.
     */
    public static Object read(InputStream inputStream) throws IOException {
        return objectMapper.readValue(inputStream, Object.class);
    }

    /**
     * Convert a Jackson tree. Missing nodes become null.
     */
    public static Object fromNode(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return objectMapper.convertValue(node, Object.class);
    }
}
