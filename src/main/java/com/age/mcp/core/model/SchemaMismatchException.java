package com.age.mcp.core.model;

/**
 * Runtime exception thrown when a decoded map does not fit the {@link GraphRecord} shape.
 */
public class SchemaMismatchException extends RuntimeException {

    private final String key;

    public SchemaMismatchException(String message, String key) {
        super(message);
        this.key = key;
    }

    public SchemaMismatchException(String message, String key, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /**
     * The offending key, or null when the problem is not tied to one key.
     */
    public String getKey() {
        return key;
    }
}
