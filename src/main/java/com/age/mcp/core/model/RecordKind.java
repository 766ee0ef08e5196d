package com.age.mcp.core.model;

import java.util.Locale;

/**
 * Kind of graph record: a vertex (node) or an edge (relationship).
 */
public enum RecordKind {
    VERTEX("vertex"),
    EDGE("edge");

    private final String tag;

    RecordKind(String tag) {
        this.tag = tag;
    }

    /**
     * Lowercase name as used by agtype tags and serialized records.
     */
    public String getTag() {
        return tag;
    }

    /**
     * Parses a tag, case-insensitively.
     *
     * @throws IllegalArgumentException for anything other than vertex or edge
     */
    public static RecordKind fromTag(String tag) {
        for (RecordKind kind : values()) {
            if (kind.tag.equals(tag.toLowerCase(Locale.ROOT))) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown record kind: " + tag);
    }
}
