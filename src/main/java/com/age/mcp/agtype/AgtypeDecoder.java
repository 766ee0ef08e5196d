package com.age.mcp.agtype;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.List;
import java.util.Map;

/**
 * Decodes single agtype values returned by Apache AGE.
 *
 * <p>Agtype is a superset of JSON: vertices and edges are JSON objects followed by a
 * {@code ::vertex} or {@code ::edge} tag, paths are arrays followed by {@code ::path},
 * and numerics may carry a {@code ::numeric} tag. Only text shaped like a JSON object
 * or array is parsed; everything else is returned as-is.</p>
 */
public final class AgtypeDecoder {

    /** Separator between an agtype payload and its type tag. */
    public static final String TAG_SEPARATOR = "::";

    public static final String VERTEX_TAG = "::vertex";
    public static final String EDGE_TAG = "::edge";

    // "{...} {...}" is malformed, not a value followed by noise
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

    private AgtypeDecoder() {
        // utility class
    }

    /**
     * Decodes one agtype scalar.
     *
     * @param text raw text, may be null
     * @return a {@code Map} for {@code {...}}, a {@code List} for {@code [...]},
     *         otherwise {@code text} unchanged
     * @throws DecodeException if text wrapped in braces or brackets is not valid JSON
     */
    public static Object decodeScalar(String text) {
        if (text == null) {
            return null;
        }
        if (text.startsWith("{") && text.endsWith("}")) {
            return readValue(text, MAP_TYPE);
        }
        if (text.startsWith("[") && text.endsWith("]")) {
            return readValue(text, LIST_TYPE);
        }
        return text;
    }

    /**
     * Removes every {@code ::vertex} and {@code ::edge} tag and decodes the remainder
     * with {@link #decodeScalar(String)}. Other tags are left in place.
     */
    public static Object decodeTagged(String text) {
        return decodeScalar(stripGraphTags(text));
    }

    /**
     * Returns true for strings that carry an agtype tag.
     */
    public static boolean isTagged(Object value) {
        return value instanceof String s && s.contains(TAG_SEPARATOR);
    }

    /**
     * Removes all literal {@code ::vertex} and {@code ::edge} occurrences.
     */
    public static String stripGraphTags(String text) {
        if (text == null) {
            return null;
        }
        return text.replace(VERTEX_TAG, "").replace(EDGE_TAG, "");
    }

    /**
     * Parses a JSON array.
     *
     * @throws DecodeException if {@code json} is not a valid JSON array
     */
    static List<Object> parseArray(String json) {
        return readValue(json, LIST_TYPE);
    }

    private static <T> T readValue(String text, TypeReference<T> type) {
        try {
            return MAPPER.readValue(text, type);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Malformed agtype value", text, e);
        }
    }
}
