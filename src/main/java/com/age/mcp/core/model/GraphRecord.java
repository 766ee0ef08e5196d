package com.age.mcp.core.model;

import com.age.mcp.agtype.DecodeException;
import com.age.mcp.agtype.RecordDecoder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A decoded Apache AGE vertex or edge.
 *
 * <p>A record is a vertex unless both {@code startId} and {@code endId} are set, in which
 * case it is an edge. An explicit kind given at construction overrides that rule.
 * Instances are immutable; properties, including nested maps and lists, are copied
 * into unmodifiable collections.</p>
 *
 * <p>Serialized form (see {@link #toMap()}):</p>
 * <pre>
 * {"label": "City", "properties": {"name": "NYC"}, "id": 844424930131969,
 *  "start_id": null, "end_id": null, "kind": null}
 * </pre>
 */
public final class GraphRecord {

    public static final String LABEL = "label";
    public static final String PROPERTIES = "properties";
    public static final String ID = "id";
    public static final String START_ID = "start_id";
    public static final String END_ID = "end_id";
    public static final String KIND = "kind";

    private static final Set<String> FIELDS = Set.of(LABEL, PROPERTIES, ID, START_ID, END_ID, KIND);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final String label;
    private final Map<String, Object> properties;
    private final Long id;
    private final Long startId;
    private final Long endId;
    private final RecordKind explicitKind;

    private GraphRecord(Builder builder) {
        this.label = Objects.requireNonNull(builder.label, "label is required");
        if (label.isBlank()) {
            throw new IllegalArgumentException("label must not be blank");
        }
        this.properties = builder.properties != null
                ? immutableMap(builder.properties)
                : Map.of();
        this.id = builder.id;
        this.startId = builder.startId;
        this.endId = builder.endId;
        this.explicitKind = builder.kind;
    }

    public String getLabel() {
        return label;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    public Long getId() {
        return id;
    }

    public Long getStartId() {
        return startId;
    }

    public Long getEndId() {
        return endId;
    }

    /**
     * Classifies this record. An explicit kind wins, otherwise a record with both
     * endpoint ids is an edge and anything else is a vertex.
     */
    public RecordKind kind() {
        if (explicitKind != null) {
            return explicitKind;
        }
        return startId != null && endId != null ? RecordKind.EDGE : RecordKind.VERTEX;
    }

    public boolean isVertex() {
        return kind() == RecordKind.VERTEX;
    }

    public boolean isEdge() {
        return kind() == RecordKind.EDGE;
    }

    /**
     * Decodes raw result rows with {@link RecordDecoder#decodeBatch(List)} and maps every
     * decoded object to a record.
     *
     * @throws DecodeException         if the agtype text is malformed
     * @throws SchemaMismatchException if a decoded value does not fit the record shape
     */
    public static List<GraphRecord> fromDecodedRows(List<? extends Map<String, ?>> rows) {
        List<Object> decoded = RecordDecoder.decodeBatch(rows);
        List<GraphRecord> records = new ArrayList<>(decoded.size());
        for (Object value : decoded) {
            if (!(value instanceof Map<?, ?> map)) {
                throw new SchemaMismatchException(
                        "Decoded agtype value is not an object: " + value, null);
            }
            records.add(fromMap(asStringKeyed(map)));
        }
        return records;
    }

    /**
     * Builds a record from its map form. Only the keys {@code label}, {@code properties},
     * {@code id}, {@code start_id}, {@code end_id} and {@code kind} are accepted; missing
     * optional keys take their defaults.
     *
     * @throws SchemaMismatchException on unknown keys, a missing label or badly typed values
     */
    public static GraphRecord fromMap(Map<String, ?> map) {
        for (String key : map.keySet()) {
            if (!FIELDS.contains(key)) {
                throw new SchemaMismatchException("Unknown graph record field '" + key + "'", key);
            }
        }

        Object label = map.get(LABEL);
        if (!(label instanceof String s) || s.isBlank()) {
            throw new SchemaMismatchException("Graph record requires a non-blank string 'label', got: " + label, LABEL);
        }

        Object properties = map.get(PROPERTIES);
        if (properties != null && !(properties instanceof Map)) {
            throw new SchemaMismatchException("'properties' must be an object, got: " + properties, PROPERTIES);
        }

        return builder()
                .label((String) label)
                .properties(properties == null ? null : asStringKeyed((Map<?, ?>) properties))
                .id(toLong(map.get(ID), ID))
                .startId(toLong(map.get(START_ID), START_ID))
                .endId(toLong(map.get(END_ID), END_ID))
                .kind(toKind(map.get(KIND)))
                .build();
    }

    /**
     * Parses JSON text and delegates to {@link #fromMap(Map)}.
     *
     * @throws DecodeException if the text is not a JSON object
     */
    public static GraphRecord fromText(String text) {
        Map<String, Object> map;
        try {
            map = MAPPER.readValue(text, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Malformed graph record JSON", text, e);
        }
        return fromMap(map);
    }

    /**
     * Returns the map form of this record; every field is present, absent values are null.
     * {@code kind} is only non-null when it was set explicitly.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(LABEL, label);
        map.put(PROPERTIES, new LinkedHashMap<>(properties));
        map.put(ID, id);
        map.put(START_ID, startId);
        map.put(END_ID, endId);
        map.put(KIND, explicitKind != null ? explicitKind.getTag() : null);
        return map;
    }

    /**
     * Returns {@link #toMap()} as JSON. Values JSON cannot represent are written as their
     * {@code toString()}.
     */
    public String toText() {
        try {
            return MAPPER.writeValueAsString(jsonSafe(toMap()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize graph record " + label, e);
        }
    }

    private static Map<String, Object> immutableMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), immutableValue(v)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object immutableValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return immutableMap(map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(v -> copy.add(immutableValue(v)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static Object jsonSafe(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> safe = new LinkedHashMap<>();
            map.forEach((k, v) -> safe.put(String.valueOf(k), jsonSafe(v)));
            return safe;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> safe = new ArrayList<>(collection.size());
            collection.forEach(v -> safe.add(jsonSafe(v)));
            return safe;
        }
        return String.valueOf(value);
    }

    private static Map<String, Object> asStringKeyed(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private static Long toLong(Object value, String key) {
        if (value == null) {
            return null;
        }
        if (value instanceof Long l) {
            return l;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            try {
                return big.longValueExact();
            } catch (ArithmeticException e) {
                throw new SchemaMismatchException("'" + key + "' is out of range: " + value, key, e);
            }
        }
        throw new SchemaMismatchException("'" + key + "' must be an integer, got: " + value, key);
    }

    private static RecordKind toKind(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof RecordKind kind) {
            return kind;
        }
        if (value instanceof String s) {
            try {
                return RecordKind.fromTag(s);
            } catch (IllegalArgumentException e) {
                throw new SchemaMismatchException(e.getMessage(), KIND, e);
            }
        }
        throw new SchemaMismatchException("'kind' must be a string, got: " + value, KIND);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphRecord that = (GraphRecord) o;
        return label.equals(that.label)
                && properties.equals(that.properties)
                && Objects.equals(id, that.id)
                && Objects.equals(startId, that.startId)
                && Objects.equals(endId, that.endId)
                && explicitKind == that.explicitKind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, properties, id, startId, endId, explicitKind);
    }

    @Override
    public String toString() {
        return "GraphRecord{" +
                "kind=" + kind().getTag() +
                ", label='" + label + '\'' +
                ", id=" + id +
                (isEdge() ? ", startId=" + startId + ", endId=" + endId : "") +
                ", properties=" + properties +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String label;
        private Map<String, Object> properties;
        private Long id;
        private Long startId;
        private Long endId;
        private RecordKind kind;

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder properties(Map<String, Object> properties) {
            this.properties = properties;
            return this;
        }

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder startId(Long startId) {
            this.startId = startId;
            return this;
        }

        public Builder endId(Long endId) {
            this.endId = endId;
            return this;
        }

        /**
         * Forces the record kind instead of deriving it from the endpoint ids.
         */
        public Builder kind(RecordKind kind) {
            this.kind = kind;
            return this;
        }

        public GraphRecord build() {
            return new GraphRecord(this);
        }
    }
}
