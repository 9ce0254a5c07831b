package im.arun.mathreader.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.mathreader.model.SemanticNode;

import java.util.Map;

/**
 * Converts trees to and from plain maps and JSON. Rebuilding a tree from
 * its map restores type, content, children and metadata, and keeps
 * {@code node_id} and {@code accessibility} verbatim.
 */
public final class TreeSerializer {
    private static final ObjectMapper objectMapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private TreeSerializer() {}

    public static Map<String, Object> toMap(SemanticNode node) {
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    /**
     * @throws IllegalArgumentException if the map does not describe a node
     */
    public static SemanticNode fromMap(Map<String, ?> data) {
        return objectMapper.convertValue(data, SemanticNode.class);
    }

    public static String toJson(SemanticNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tree", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the JSON is malformed or not a node
     */
    public static SemanticNode fromJson(String json) {
        try {
            return objectMapper.readValue(json, SemanticNode.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid tree JSON: " + e.getOriginalMessage(), e);
        }
    }
}
