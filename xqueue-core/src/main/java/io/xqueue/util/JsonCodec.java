package io.xqueue.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shared Jackson mapper for the small JSON documents the consumer writes and reads:
 * grader requests, callback bodies, the failure notice and the submission header.
 */
public final class JsonCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonCodec() {
    }

    public static ObjectNode newObject() {
        return MAPPER.createObjectNode();
    }

    /**
     * Serializes a node to compact JSON.
     *
     * @param node the node
     * @return the JSON text
     */
    public static String toJson(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON", e);
        }
    }

    /**
     * Parses a JSON object.
     *
     * @param json the text
     * @return the parsed object
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public static ObjectNode parseObject(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Expected JSON object, got empty input");
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (!(node instanceof ObjectNode object)) {
            throw new IllegalArgumentException("Expected JSON object");
        }
        return object;
    }
}
