package com.age.mcp.agtype;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes result rows whose columns hold agtype text.
 *
 * <p>Both entry points work on rows that were already fetched; neither performs I/O.
 * Rows are ordered column-name to value maps as produced by the SQL layer.</p>
 */
public final class RecordDecoder {
    private static final Logger log = LoggerFactory.getLogger(RecordDecoder.class);

    private RecordDecoder() {
        // utility class
    }

    /**
     * Decodes one row. Every string value containing {@code ::} is replaced by its
     * decoded payload (see {@link AgtypeDecoder#decodeTagged(String)}); other values
     * pass through unchanged. Column order is preserved.
     *
     * @param row the raw row
     * @return a new ordered map with decoded values
     * @throws DecodeException if a tagged value is malformed
     */
    public static Map<String, Object> decodeRow(Map<String, ?> row) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : row.entrySet()) {
            Object value = entry.getValue();
            if (AgtypeDecoder.isTagged(value)) {
                value = AgtypeDecoder.decodeTagged((String) value);
            }
            result.put(entry.getKey(), value);
        }
        return result;
    }

    /**
     * Decodes a batch of rows with a single JSON parse.
     *
     * <p>All {@code ::}-bearing strings are collected in row order, then column order,
     * joined with commas, stripped of {@code ::vertex}/{@code ::edge} tags and parsed as
     * one JSON array. Rows with several tagged columns contribute several elements, so
     * the result is aligned with rows only when each row has one tagged column.</p>
     *
     * @param rows raw rows
     * @return the parsed array elements, or an empty list when no tagged value exists
     * @throws DecodeException if the combined text is not a valid JSON array;
     *                         no partial result is returned
     */
    public static List<Object> decodeBatch(List<? extends Map<String, ?>> rows) {
        List<String> tagged = new ArrayList<>();
        for (Map<String, ?> row : rows) {
            for (Object value : row.values()) {
                if (AgtypeDecoder.isTagged(value)) {
                    tagged.add((String) value);
                }
            }
        }
        if (tagged.isEmpty()) {
            log.debug("No agtype values in batch of {} rows", rows.size());
            return List.of();
        }

        String concatenated = AgtypeDecoder.stripGraphTags(String.join(",", tagged));
        List<Object> decoded = AgtypeDecoder.parseArray("[" + concatenated + "]");
        log.debug("Decoded {} agtype values from {} rows", decoded.size(), rows.size());
        return decoded;
    }
}
